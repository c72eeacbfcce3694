package com.example.logtriage.service;

import com.example.logtriage.metrics.TriageMetrics;
import com.example.logtriage.model.ErrorOccurrence;
import com.example.logtriage.model.LogDocument;
import com.example.logtriage.model.MatchCount;
import com.example.logtriage.model.ReportLimits;
import com.example.logtriage.model.Tally;
import com.example.logtriage.model.TriageReport;
import com.example.logtriage.model.TriageRules;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Основной workflow разбора лога: один проход по загруженному документу.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TriageWorkflow {
    private final TriageRules triageRules;
    private final LogDocumentLoader documentLoader;
    private final PatternMatcher patternMatcher;
    private final MentionExtractor mentionExtractor;
    private final OccurrenceScanner occurrenceScanner;
    private final OriginCorrelator originCorrelator;
    private final TriageReporter reporter;
    private final TriageMetrics triageMetrics;

    /**
     * Загружает файл и разбирает его.
     */
    public TriageReport analyze(Path logFile, ReportLimits limits) {
        Timer.Sample loadSample = triageMetrics.startTimer();
        LogDocument document;
        try {
            document = documentLoader.load(logFile);
        } catch (RuntimeException e) {
            triageMetrics.recordFailed();
            throw e;
        }
        triageMetrics.recordStepDuration(loadSample, "load");
        return analyze(document, limits);
    }

    public TriageReport analyze(LogDocument document, ReportLimits limits) {
        Timer.Sample totalSample = triageMetrics.startTimer();
        try {
            // 1. Классификация по категориям
            Timer.Sample matchSample = triageMetrics.startTimer();
            List<MatchCount> matchCounts = patternMatcher.countMatches(document, triageRules.getPatternRules());
            triageMetrics.recordStepDuration(matchSample, "match");

            // 2. Упоминания тестов
            Timer.Sample mentionSample = triageMetrics.startTimer();
            Tally<String> mentions = mentionExtractor.extractMentions(document, triageRules.getMentionGrammar());
            triageMetrics.recordStepDuration(mentionSample, "mentions");

            // 3. Вхождения с контекстом и местом вызова
            Timer.Sample scanSample = triageMetrics.startTimer();
            List<ErrorOccurrence> occurrences = occurrenceScanner.scan(document);
            triageMetrics.recordStepDuration(scanSample, "occurrences");

            // 4. Подозрительные источники
            Tally<String> origins = originCorrelator.correlate(occurrences, triageRules.getSuspectFilter());

            TriageReport report = reporter.assemble(document, matchCounts, mentions, occurrences, origins, limits);

            triageMetrics.setOccurrencesCount(occurrences.size());
            triageMetrics.setCategoriesMatched(report.getCategories().size());
            triageMetrics.recordCompleted();
            log.info("Triage completed: {} categories matched, {} occurrences, {} distinct mentions",
                    report.getCategories().size(), occurrences.size(), mentions.distinctCount());
            return report;

        } catch (RuntimeException e) {
            triageMetrics.recordFailed();
            throw e;
        } finally {
            triageMetrics.recordTotalDuration(totalSample);
        }
    }
}
