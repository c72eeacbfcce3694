package com.example.logtriage.service;

import com.example.logtriage.TriageTestSupport;
import com.example.logtriage.config.PatternRuleCompiler;
import com.example.logtriage.config.TriageConfig;
import com.example.logtriage.model.ErrorOccurrence;
import com.example.logtriage.model.LogDocument;
import com.example.logtriage.model.TriageRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OccurrenceScannerTest {

    private OccurrenceScanner scanner;

    @BeforeEach
    void setUp() {
        scanner = TriageTestSupport.occurrenceScanner(TriageTestSupport.rules());
    }

    @Test
    void shouldBuildOccurrencePerTracedLine() {
        // Given
        LogDocument document = LogDocument.of("run.log", TriageTestSupport.SAMPLE_LOG);

        // When
        List<ErrorOccurrence> occurrences = scanner.scan(document);

        // Then: ECONNREFUSED не трассируется
        assertEquals(2, occurrences.size());

        ErrorOccurrence dbMissing = occurrences.get(0);
        assertEquals(2, dbMissing.getLineNumber());
        assertEquals("Database Config Missing", dbMissing.getRuleName());
        assertEquals("src/modules/database/database.manager.ts:120:15", dbMissing.getCallSite());
        assertEquals("test/db.spec.ts", dbMissing.getTestIdentifier());
        assertEquals(0, dbMissing.getContext().getStart());
        assertEquals(4, dbMissing.getContext().getEnd());

        ErrorOccurrence typeError = occurrences.get(1);
        assertEquals(6, typeError.getLineNumber());
        assertEquals("Type Error", typeError.getRuleName());
        assertEquals("src/modules/redis/redis.service.ts:88:3", typeError.getCallSite());
        assertEquals("test/other.spec.ts", typeError.getTestIdentifier());
    }

    @Test
    void lineMatchingSeveralRulesShouldProduceOneOccurrence() {
        LogDocument document = LogDocument.of("run.log",
                "TypeError: Connection configuration is required for undefined");

        List<ErrorOccurrence> occurrences = scanner.scan(document);

        assertEquals(1, occurrences.size());
        assertEquals("Database Config Missing", occurrences.get(0).getRuleName());
        assertEquals("unknown", occurrences.get(0).getCallSite());
        assertEquals("unknown", occurrences.get(0).getTestIdentifier());
    }

    @Test
    void shouldTruncateSnippet() {
        // Given
        TriageConfig config = TriageTestSupport.config();
        config.setSnippetMaxLength(20);
        TriageRules rules = PatternRuleCompiler.compile(config);
        OccurrenceScanner shortScanner = TriageTestSupport.occurrenceScanner(rules);

        // When
        List<ErrorOccurrence> occurrences = shortScanner.scan(
                LogDocument.of("run.log", TriageTestSupport.SAMPLE_LOG));

        // Then
        String snippet = occurrences.get(0).getSnippet();
        assertEquals(20, snippet.length());
        assertTrue(snippet.endsWith("..."));
        assertEquals("RUN test/db.spec....", snippet);
    }

    @Test
    void snippetShouldCollapseWhitespace() {
        assertEquals("a b c", OccurrenceScanner.toSnippet("  a\n\t b   c \n", 100));
        assertEquals("abc", OccurrenceScanner.toSnippet("abcdef", 3));
    }

    @Test
    void emptyDocumentShouldHaveNoOccurrences() {
        assertTrue(scanner.scan(LogDocument.empty()).isEmpty());
    }

    @Test
    void matchSpanningLinesShouldProduceOccurrenceAtStartLine() {
        // Given
        TriageConfig config = TriageTestSupport.config();
        config.setPatternRules(List.of(TriageTestSupport.rule("Error With Frame", "Error:\\s+at", false, false, true)));
        TriageRules rules = PatternRuleCompiler.compile(config);
        LogDocument document = LogDocument.of("run.log", "ok\nError:\n    at x (src/a.ts:1:1)\n");

        // When
        List<ErrorOccurrence> occurrences = TriageTestSupport.occurrenceScanner(rules).scan(document);

        // Then
        assertEquals(1, new PatternMatcher().countMatches(document.getText(), rules.getPatternRules().get(0)));
        assertEquals(1, occurrences.size());
        assertEquals(2, occurrences.get(0).getLineNumber());
        assertEquals("Error With Frame", occurrences.get(0).getRuleName());
        assertEquals("src/a.ts:1:1", occurrences.get(0).getCallSite());
    }

    @Test
    void occurrencesShouldFollowLineOrderAcrossRules() {
        LogDocument document = LogDocument.of("run.log", String.join("\n",
                "TypeError: first",
                "Connection configuration is required for db"));

        List<ErrorOccurrence> occurrences = scanner.scan(document);

        assertEquals(List.of(1, 2), occurrences.stream().map(ErrorOccurrence::getLineNumber).toList());
        assertEquals("Type Error", occurrences.get(0).getRuleName());
        assertEquals("Database Config Missing", occurrences.get(1).getRuleName());
    }
}
