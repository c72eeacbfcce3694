package com.example.logtriage.service;

import com.example.logtriage.model.ErrorOccurrence;
import com.example.logtriage.model.LogDocument;
import com.example.logtriage.model.MatchCount;
import com.example.logtriage.model.ReportLimits;
import com.example.logtriage.model.Tally;
import com.example.logtriage.model.TallyEntry;
import com.example.logtriage.model.TriageReport;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Строит четыре представления отчёта. Каждое считается только из своих входных данных.
 */
@Service
public class TriageReporter {

    public TriageReport assemble(LogDocument document,
                                 List<MatchCount> matchCounts,
                                 Tally<String> mentions,
                                 List<ErrorOccurrence> occurrences,
                                 Tally<String> origins,
                                 ReportLimits limits) {
        return TriageReport.builder()
                .source(document.getSource())
                .totalLines(document.getLineCount())
                .categories(categoryView(matchCounts))
                .topMentions(mentionView(mentions, limits.getTopMentions()))
                .distinctMentions(mentions.distinctCount())
                .errorLocations(locationView(occurrences, limits.getDedupCap()))
                .totalOccurrences(occurrences.size())
                .topOrigins(originView(origins, limits.getTopOrigins()))
                .build();
    }

    /**
     * Категории с ненулевым счётчиком по убыванию. При равенстве сохраняется порядок объявления.
     */
    public List<MatchCount> categoryView(List<MatchCount> matchCounts) {
        List<MatchCount> matched = new ArrayList<>();
        for (MatchCount count : matchCounts) {
            if (count.getCount() > 0) {
                matched.add(count);
            }
        }
        matched.sort(Comparator.comparingInt(MatchCount::getCount).reversed());
        return List.copyOf(matched);
    }

    public List<TallyEntry<String>> mentionView(Tally<String> mentions, int topN) {
        return mentions.ranked(topN);
    }

    /**
     * Первое вхождение для каждой уникальной пары (место вызова, тест) в исходном порядке.
     * Останавливается, как только набрано {@code cap} пар.
     */
    public List<ErrorOccurrence> locationView(List<ErrorOccurrence> occurrences, int cap) {
        List<ErrorOccurrence> unique = new ArrayList<>();
        Set<List<String>> seen = new HashSet<>();
        for (ErrorOccurrence occurrence : occurrences) {
            if (unique.size() >= cap) {
                break;
            }
            if (seen.add(Arrays.asList(occurrence.getCallSite(), occurrence.getTestIdentifier()))) {
                unique.add(occurrence);
            }
        }
        return List.copyOf(unique);
    }

    public List<TallyEntry<String>> originView(Tally<String> origins, int topN) {
        return origins.ranked(topN);
    }
}
