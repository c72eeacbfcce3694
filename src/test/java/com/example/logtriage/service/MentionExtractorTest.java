package com.example.logtriage.service;

import com.example.logtriage.TriageTestSupport;
import com.example.logtriage.model.LogDocument;
import com.example.logtriage.model.Tally;
import com.example.logtriage.model.TallyEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class MentionExtractorTest {

    private MentionExtractor mentionExtractor;
    private Pattern grammar;

    @BeforeEach
    void setUp() {
        mentionExtractor = new MentionExtractor();
        grammar = TriageTestSupport.rules().getMentionGrammar();
    }

    @Test
    void shouldRankMentionsByCount() {
        // Given
        String log = String.join("\n",
                "FAIL test/b.spec.ts",
                "FAIL test/a.spec.ts",
                "    at Object.<anonymous> (test/a.spec.ts:10:5)",
                "RUN test/a.spec.ts");

        // When
        Tally<String> mentions = mentionExtractor.extractMentions(LogDocument.of("run.log", log), grammar);

        // Then
        assertEquals(List.of(
                new TallyEntry<>("test/a.spec.ts", 3),
                new TallyEntry<>("test/b.spec.ts", 1)), mentions.ranked(2));
        assertEquals(2, mentions.distinctCount());
    }

    @Test
    void shouldTakeLongestPathAndNormalizeIt() {
        String log = "RUN ./packages/titan/test/db.spec.ts and packages\\titan\\test\\db.spec.ts";

        Tally<String> mentions = mentionExtractor.extractMentions(LogDocument.of("run.log", log),
                Pattern.compile("(?:[\\w.@\\\\-]+[/\\\\])*[\\w.@-]+\\.spec\\.ts"));

        assertEquals(1, mentions.distinctCount());
        assertEquals(2, mentions.count("packages/titan/test/db.spec.ts"));
    }

    @Test
    void shouldIgnoreFilesWithoutTestSuffix() {
        String log = "at Service.run (src/service.ts:1:1) loading src/db.json and test/helpers.ts";

        Tally<String> mentions = mentionExtractor.extractMentions(LogDocument.of("run.log", log), grammar);

        assertTrue(mentions.isEmpty());
    }

    @Test
    void emptyDocumentShouldHaveNoMentions() {
        Tally<String> mentions = mentionExtractor.extractMentions(LogDocument.empty(), grammar);

        assertEquals(0, mentions.distinctCount());
    }

    @Test
    void longTokenShouldBeScannedInLinearTime() {
        // Given: строка как у минифицированного бандла, в конце одно настоящее упоминание
        String log = "snapshot " + "x".repeat(200_000) + " FAIL /repo/test/a.spec.ts";

        // When
        Tally<String> mentions = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> mentionExtractor.extractMentions(LogDocument.of("run.log", log), grammar));

        // Then
        assertEquals(1, mentions.distinctCount());
        assertEquals(1, mentions.count("repo/test/a.spec.ts"));
    }

    @Test
    void shouldNotMatchInsideLongerToken() {
        String log = "hash abc-test/a.spec.ts and path/to/a.spec.ts";

        Tally<String> mentions = mentionExtractor.extractMentions(LogDocument.of("run.log", log), grammar);

        assertEquals(2, mentions.distinctCount());
        assertEquals(1, mentions.count("abc-test/a.spec.ts"));
        assertEquals(1, mentions.count("path/to/a.spec.ts"));
    }
}
