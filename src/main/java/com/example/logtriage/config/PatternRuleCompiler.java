package com.example.logtriage.config;

import com.example.logtriage.exception.MalformedPatternException;
import com.example.logtriage.model.PatternRule;
import com.example.logtriage.model.SuspectFilter;
import com.example.logtriage.model.TriageRules;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Проверяет и компилирует правила из {@link TriageConfig}.
 * Любое некорректное правило останавливает загрузку целиком.
 */
@Slf4j
public final class PatternRuleCompiler {

    static final String MENTION_GRAMMAR = "mention-grammar";
    static final String CALL_SITE_PATTERN = "call-site-pattern";
    static final String TEST_IDENTIFIER_PATTERN = "test-identifier-pattern";

    private PatternRuleCompiler() {
    }

    public static TriageRules compile(TriageConfig config) {
        List<PatternRule> rules = compileRules(config.getPatternRules());

        Pattern mentionGrammar = compileRequired(MENTION_GRAMMAR, config.getMentionGrammar(), 0);
        Pattern callSitePattern = compileRequired(CALL_SITE_PATTERN, config.getCallSitePattern(), 0);
        requireGroup(CALL_SITE_PATTERN, callSitePattern, "file");
        requireGroup(CALL_SITE_PATTERN, callSitePattern, "line");
        boolean callSiteHasColumn = hasNamedGroup(callSitePattern, "column");

        String testIdSource = config.getTestIdentifierPattern();
        Pattern testIdentifierPattern = testIdSource == null || testIdSource.isBlank()
                ? mentionGrammar
                : compileRequired(TEST_IDENTIFIER_PATTERN, testIdSource, 0);

        log.info("Loaded {} pattern rules ({} traced)", rules.size(),
                rules.stream().filter(PatternRule::isTrace).count());

        return TriageRules.builder()
                .patternRules(rules)
                .mentionGrammar(mentionGrammar)
                .callSitePattern(callSitePattern)
                .callSiteHasColumn(callSiteHasColumn)
                .testIdentifierPattern(testIdentifierPattern)
                .contextLookback(Math.max(0, config.getContextLookback()))
                .contextLookahead(Math.max(0, config.getContextLookahead()))
                .snippetMaxLength(Math.max(1, config.getSnippetMaxLength()))
                .suspectFilter(new SuspectFilter(config.getSuspectModuleName(), config.getSuspectMarker()))
                .build();
    }

    static List<PatternRule> compileRules(List<TriageConfig.PatternRuleProperties> properties) {
        List<PatternRule> rules = new ArrayList<>();
        Set<String> names = new HashSet<>();

        for (int i = 0; i < properties.size(); i++) {
            TriageConfig.PatternRuleProperties props = properties.get(i);
            String name = props.getName();

            if (name == null || name.isBlank()) {
                throw new MalformedPatternException("#" + (i + 1), "rule name is blank");
            }
            if (!names.add(name)) {
                throw new MalformedPatternException(name, "duplicate rule name");
            }

            int flags = props.isCaseInsensitive() ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0;
            String source = props.getPattern();
            if (source != null && props.isLiteral()) {
                source = Pattern.quote(source);
            }

            rules.add(PatternRule.builder()
                    .name(name)
                    .pattern(compileRequired(name, source, flags))
                    .caseInsensitive(props.isCaseInsensitive())
                    .literal(props.isLiteral())
                    .trace(props.isTrace())
                    .build());
        }
        return List.copyOf(rules);
    }

    private static Pattern compileRequired(String name, String source, int flags) {
        if (source == null || source.isEmpty()) {
            throw new MalformedPatternException(name, "pattern is empty");
        }

        Pattern pattern;
        try {
            pattern = Pattern.compile(source, flags);
        } catch (PatternSyntaxException e) {
            throw new MalformedPatternException(name, e.getDescription() + " near index " + e.getIndex(), e);
        }

        // Шаблон, совпадающий с пустой строкой, засчитывал бы совпадение на каждой позиции
        if (pattern.matcher("").matches()) {
            throw new MalformedPatternException(name, "pattern matches the empty string");
        }
        return pattern;
    }

    private static void requireGroup(String name, Pattern pattern, String group) {
        if (!hasNamedGroup(pattern, group)) {
            throw new MalformedPatternException(name, "named group '" + group + "' is missing");
        }
    }

    /**
     * Объявлена ли в шаблоне именованная группа. Экранированный текст вида {@code \(?<line>}
     * группой не считается.
     */
    static boolean hasNamedGroup(Pattern pattern, String group) {
        // Пустая альтернатива гарантирует совпадение, иначе group(name) бросит IllegalStateException
        try {
            Matcher lookup = Pattern.compile("(?:" + pattern.pattern() + ")|", pattern.flags()).matcher("");
            lookup.matches();
            lookup.group(group);
            return true;
        } catch (IllegalArgumentException e) {
            // сюда же попадает PatternSyntaxException
            return false;
        }
    }
}
