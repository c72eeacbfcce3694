package com.example.logtriage.service;

import com.example.logtriage.model.ContextWindow;
import com.example.logtriage.model.ErrorOccurrence;
import com.example.logtriage.model.FrameReferences;
import com.example.logtriage.model.LogDocument;
import com.example.logtriage.model.PatternRule;
import com.example.logtriage.model.TriageRules;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Находит строки, на которых сработали правила с трассировкой, и для каждой
 * строит {@link ErrorOccurrence} с контекстом и местом возникновения.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OccurrenceScanner {

    private static final String ELLIPSIS = "...";

    private final TriageRules triageRules;
    private final PatternMatcher patternMatcher;
    private final ContextWindowExtractor contextWindowExtractor;
    private final StackFrameParser stackFrameParser;

    /**
     * Правила ищутся по всему тексту, поэтому совпадение может занимать несколько строк.
     * Вхождение привязывается к строке, где совпадение начинается. Одна строка даёт
     * не больше одного вхождения, при нескольких правилах побеждает объявленное раньше.
     */
    public List<ErrorOccurrence> scan(LogDocument document) {
        List<PatternRule> tracedRules = triageRules.getTracedRules();
        if (tracedRules.isEmpty() || document.isEmpty()) {
            return List.of();
        }

        Map<Integer, PatternRule> ruleByLine = new TreeMap<>();
        for (PatternRule rule : tracedRules) {
            for (int start : patternMatcher.matchStarts(document.getText(), rule)) {
                ruleByLine.putIfAbsent(document.lineIndexAt(start), rule);
            }
        }

        List<String> lines = document.getLines();
        List<ErrorOccurrence> occurrences = new ArrayList<>(ruleByLine.size());
        ruleByLine.forEach((index, rule) -> occurrences.add(buildOccurrence(lines, index, rule)));

        log.info("Found {} traced error occurrences", occurrences.size());
        return occurrences;
    }

    /**
     * Строит вхождение для строки с индексом {@code index}. Не зависит от других вхождений.
     */
    public ErrorOccurrence buildOccurrence(List<String> lines, int index, PatternRule rule) {
        ContextWindow window = contextWindowExtractor.extract(
                lines, index, triageRules.getContextLookback(), triageRules.getContextLookahead());
        FrameReferences references = stackFrameParser.parse(window.getText());

        ErrorOccurrence occurrence = ErrorOccurrence.builder()
                .lineNumber(index + 1)
                .ruleName(rule.getName())
                .callSite(references.getCallSiteReference())
                .testIdentifier(references.getTestIdentifier())
                .snippet(toSnippet(window.getText(), triageRules.getSnippetMaxLength()))
                .context(window)
                .build();

        log.debug("Occurrence at line {}: site={}, test={}",
                occurrence.getLineNumber(), occurrence.getCallSite(), occurrence.getTestIdentifier());
        return occurrence;
    }

    /**
     * Сворачивает пробелы и обрезает текст до maxLength символов, включая многоточие.
     */
    static String toSnippet(String text, int maxLength) {
        String collapsed = text.replaceAll("\\s+", " ").trim();
        if (collapsed.length() <= maxLength) {
            return collapsed;
        }
        if (maxLength <= ELLIPSIS.length()) {
            return collapsed.substring(0, maxLength);
        }
        return collapsed.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }
}
