package com.example.logtriage.config;

import com.example.logtriage.TriageTestSupport;
import com.example.logtriage.exception.MalformedPatternException;
import com.example.logtriage.model.PatternRule;
import com.example.logtriage.model.TriageRules;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static com.example.logtriage.TriageTestSupport.rule;
import static org.junit.jupiter.api.Assertions.*;

class PatternRuleCompilerTest {

    @Test
    void shouldCompileRulesInDeclarationOrder() {
        TriageRules rules = TriageTestSupport.rules();

        List<String> names = rules.getPatternRules().stream().map(PatternRule::getName).toList();
        assertEquals(List.of("Database Config Missing", "Type Error", "Connection Refused", "Timeout"), names);
        assertEquals(2, rules.getTracedRules().size());
    }

    @Test
    void literalRuleShouldNotBeTreatedAsRegex() {
        // Given
        TriageConfig config = new TriageConfig();
        config.setPatternRules(List.of(rule("Brackets", "expect(received)", false, true, false)));

        // When
        PatternRule compiled = PatternRuleCompiler.compile(config).getPatternRules().get(0);

        // Then
        assertTrue(compiled.matcher("expect(received).toBe(1)").find());
        assertFalse(compiled.matcher("expectreceived").find());
    }

    @Test
    void shouldFailOnInvalidRegex() {
        TriageConfig config = new TriageConfig();
        config.setPatternRules(List.of(
                rule("Valid", "ok", false, false, false),
                rule("Broken", "([unclosed", false, false, false)));

        MalformedPatternException e = assertThrows(MalformedPatternException.class,
                () -> PatternRuleCompiler.compile(config));
        assertEquals("Broken", e.getRuleName());
    }

    @Test
    void shouldFailOnPatternMatchingEmptyString() {
        TriageConfig config = new TriageConfig();
        config.setPatternRules(List.of(rule("Greedy", "x*", false, false, false)));

        assertThrows(MalformedPatternException.class, () -> PatternRuleCompiler.compile(config));
    }

    @Test
    void shouldFailOnBlankOrDuplicateName() {
        TriageConfig blank = new TriageConfig();
        blank.setPatternRules(List.of(rule(" ", "error", false, false, false)));
        assertThrows(MalformedPatternException.class, () -> PatternRuleCompiler.compile(blank));

        TriageConfig duplicate = new TriageConfig();
        duplicate.setPatternRules(List.of(
                rule("Same", "a", false, false, false),
                rule("Same", "b", false, false, false)));
        assertThrows(MalformedPatternException.class, () -> PatternRuleCompiler.compile(duplicate));
    }

    @Test
    void shouldFailWhenCallSitePatternLacksNamedGroups() {
        TriageConfig config = new TriageConfig();
        config.setCallSitePattern("([\\w/]+\\.ts):(\\d+)");

        MalformedPatternException e = assertThrows(MalformedPatternException.class,
                () -> PatternRuleCompiler.compile(config));
        assertEquals(PatternRuleCompiler.CALL_SITE_PATTERN, e.getRuleName());
    }

    @Test
    void testIdentifierPatternShouldDefaultToMentionGrammar() {
        TriageRules rules = PatternRuleCompiler.compile(new TriageConfig());

        assertSame(rules.getMentionGrammar(), rules.getTestIdentifierPattern());
    }

    @Test
    void escapedGroupSyntaxShouldNotSatisfyRequiredGroup() {
        // Given: в шаблоне только текст "(?<line>" после экранированной скобки
        TriageConfig config = new TriageConfig();
        config.setCallSitePattern("(?<file>[\\w/]+\\.ts):\\d+(?:\\(?<line>)?");

        // When
        MalformedPatternException e = assertThrows(MalformedPatternException.class,
                () -> PatternRuleCompiler.compile(config));

        // Then
        assertEquals(PatternRuleCompiler.CALL_SITE_PATTERN, e.getRuleName());
    }

    @Test
    void shouldDetectDeclaredNamedGroups() {
        Pattern pattern = Pattern.compile("(?<file>\\S+):(?<line>\\d+)|\\(?<column>");

        assertTrue(PatternRuleCompiler.hasNamedGroup(pattern, "file"));
        assertTrue(PatternRuleCompiler.hasNamedGroup(pattern, "line"));
        assertFalse(PatternRuleCompiler.hasNamedGroup(pattern, "column"));
    }

    @Test
    void columnGroupShouldBeOptional() {
        TriageConfig config = new TriageConfig();
        config.setCallSitePattern("(?<file>[\\w/]+\\.ts):(?<line>\\d+)");

        assertFalse(PatternRuleCompiler.compile(config).isCallSiteHasColumn());
        assertTrue(PatternRuleCompiler.compile(new TriageConfig()).isCallSiteHasColumn());
    }
}
