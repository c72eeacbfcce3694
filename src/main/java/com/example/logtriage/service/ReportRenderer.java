package com.example.logtriage.service;

import com.example.logtriage.model.ErrorOccurrence;
import com.example.logtriage.model.MatchCount;
import com.example.logtriage.model.TallyEntry;
import com.example.logtriage.model.TriageReport;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Рендерит отчёт в текстовом виде для консоли.
 * Вывод зависит только от содержимого отчёта, без времени и случайных данных.
 */
@Service
public class ReportRenderer {

    private static final String NONE = "  (none)\n";
    private static final String SEPARATOR = "═══════════════════════════════════════════════════════════\n";

    public String render(TriageReport report) {
        StringBuilder out = new StringBuilder();

        out.append(SEPARATOR);
        out.append("  LOG TRIAGE REPORT\n");
        out.append(SEPARATOR);
        out.append("  Source:        ").append(report.getSource()).append('\n');
        out.append("  Lines scanned: ").append(report.getTotalLines()).append('\n');
        out.append('\n');

        renderCategories(out, report.getCategories());
        renderMentions(out, report);
        renderLocations(out, report);
        renderOrigins(out, report.getTopOrigins());

        return out.toString();
    }

    private void renderCategories(StringBuilder out, List<MatchCount> categories) {
        out.append("== Error categories ==\n");
        if (categories.isEmpty()) {
            out.append(NONE);
        }
        for (MatchCount category : categories) {
            out.append("  ").append(formatCategory(category)).append('\n');
        }
        out.append('\n');
    }

    private void renderMentions(StringBuilder out, TriageReport report) {
        out.append("== Test file mentions ==\n");
        if (report.getTopMentions().isEmpty()) {
            out.append(NONE);
        }
        for (TallyEntry<String> mention : report.getTopMentions()) {
            out.append("  ").append(mention.getKey()).append(": ").append(mention.getCount()).append('\n');
        }
        out.append("  Total distinct references: ").append(report.getDistinctMentions()).append('\n');
        out.append('\n');
    }

    private void renderLocations(StringBuilder out, TriageReport report) {
        out.append("== Error locations ==\n");
        if (report.getErrorLocations().isEmpty()) {
            out.append(NONE);
        }
        for (ErrorOccurrence occurrence : report.getErrorLocations()) {
            out.append("  [line ").append(occurrence.getLineNumber()).append("] ")
                    .append(occurrence.getRuleName()).append('\n');
            out.append("    site: ").append(occurrence.getCallSite()).append('\n');
            out.append("    test: ").append(occurrence.getTestIdentifier()).append('\n');
            out.append("    context: ").append(occurrence.getSnippet()).append('\n');
        }
        out.append('\n');
    }

    private void renderOrigins(StringBuilder out, List<TallyEntry<String>> origins) {
        out.append("== Top originating sites ==\n");
        if (origins.isEmpty()) {
            out.append(NONE);
        }
        for (TallyEntry<String> origin : origins) {
            out.append("  ").append(origin.getKey()).append(": ").append(origin.getCount()).append('\n');
        }
    }

    static String formatCategory(MatchCount category) {
        return category.getRuleName() + ": " + category.getCount()
                + (category.getCount() == 1 ? " occurrence" : " occurrences");
    }
}
