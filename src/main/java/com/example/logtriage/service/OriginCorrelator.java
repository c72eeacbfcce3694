package com.example.logtriage.service;

import com.example.logtriage.model.ErrorOccurrence;
import com.example.logtriage.model.SuspectFilter;
import com.example.logtriage.model.Tally;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Отбирает вхождения, похожие на источник проблемы, и считает их места вызова.
 */
@Slf4j
@Service
public class OriginCorrelator {

    /**
     * Вхождение подозрительно, если место вызова содержит имя модуля
     * ИЛИ контекст содержит маркер. Достаточно одного условия.
     */
    public Tally<String> correlate(List<ErrorOccurrence> occurrences, SuspectFilter filter) {
        Tally.Builder<String> tally = Tally.builder();
        for (ErrorOccurrence occurrence : occurrences) {
            if (isSuspect(occurrence, filter)) {
                tally.add(occurrence.getCallSite());
            }
        }

        Tally<String> origins = tally.build();
        log.debug("Correlated {} suspect occurrences into {} origins",
                origins.totalCount(), origins.distinctCount());
        return origins;
    }

    public boolean isSuspect(ErrorOccurrence occurrence, SuspectFilter filter) {
        boolean moduleMatch = filter.hasModuleName()
                && occurrence.getCallSite() != null
                && occurrence.getCallSite().contains(filter.getModuleName());
        boolean markerMatch = filter.hasMarker()
                && occurrence.getContextText().contains(filter.getMarker());
        return moduleMatch || markerMatch;
    }
}
