package com.example.logtriage.service;

import com.example.logtriage.model.CallSite;
import com.example.logtriage.model.FrameReferences;
import com.example.logtriage.model.TriageRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Разбирает текст контекста в поисках места вызова и идентификатора теста.
 * <p>
 * В окне обычно один главный фрейм, поэтому берётся только первое совпадение
 * каждого вида в порядке текста. Места вызова и тесты ищутся независимо.
 */
@Slf4j
@Service
public class StackFrameParser {

    private final Pattern callSitePattern;
    private final boolean callSiteHasColumn;
    private final Pattern testIdentifierPattern;

    public StackFrameParser(TriageRules triageRules) {
        this.callSitePattern = triageRules.getCallSitePattern();
        this.callSiteHasColumn = triageRules.isCallSiteHasColumn();
        this.testIdentifierPattern = triageRules.getTestIdentifierPattern();
    }

    public FrameReferences parse(String contextText) {
        if (contextText == null || contextText.isEmpty()) {
            return FrameReferences.none();
        }

        CallSite callSite = findCallSite(contextText).orElse(null);
        String testIdentifier = findTestIdentifier(contextText).orElse(FrameReferences.UNKNOWN);
        return new FrameReferences(callSite, testIdentifier);
    }

    /**
     * Первое место вызова вида path:line[:column].
     */
    public Optional<CallSite> findCallSite(String text) {
        Matcher matcher = callSitePattern.matcher(text);
        while (matcher.find()) {
            Integer line = parseNumber(matcher.group("line"));
            if (line == null) {
                // номер строки не помещается в int, ищем дальше
                continue;
            }
            Integer column = callSiteHasColumn ? parseNumber(matcher.group("column")) : null;

            return Optional.of(CallSite.builder()
                    .filePath(MentionExtractor.normalize(matcher.group("file")))
                    .lineNumber(line)
                    .columnNumber(column != null ? column : 0)
                    .build());
        }
        return Optional.empty();
    }

    /**
     * Первый идентификатор теста.
     */
    public Optional<String> findTestIdentifier(String text) {
        Matcher matcher = testIdentifierPattern.matcher(text);
        while (matcher.find()) {
            if (matcher.end() > matcher.start()) {
                return Optional.of(MentionExtractor.normalize(matcher.group()));
            }
        }
        return Optional.empty();
    }

    private static Integer parseNumber(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.debug("Ignoring out-of-range number in call site: {}", value);
            return null;
        }
    }
}
