package com.example.logtriage.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Метрики процесса разбора логов.
 */
@Component
public class TriageMetrics {

    private final MeterRegistry meterRegistry;
    private final Timer totalDuration;
    private final Counter completedTotal;
    private final Counter failedTotal;
    private final AtomicInteger lastOccurrencesCount;
    private final AtomicInteger lastCategoriesMatched;

    public TriageMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.totalDuration = Timer.builder("triage.duration.total")
            .description("Total duration of log triage")
            .register(meterRegistry);

        this.completedTotal = Counter.builder("triage.completed.total")
            .description("Total number of completed triage runs")
            .register(meterRegistry);

        this.failedTotal = Counter.builder("triage.failed.total")
            .description("Total number of failed triage runs")
            .register(meterRegistry);

        this.lastOccurrencesCount = new AtomicInteger(0);
        Gauge.builder("triage.occurrences.count", lastOccurrencesCount, AtomicInteger::get)
            .description("Number of traced error occurrences in last run")
            .register(meterRegistry);

        this.lastCategoriesMatched = new AtomicInteger(0);
        Gauge.builder("triage.categories.matched", lastCategoriesMatched, AtomicInteger::get)
            .description("Number of error categories with at least one match in last run")
            .register(meterRegistry);
    }

    /**
     * Начинает замер времени разбора или отдельного шага.
     */
    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Записывает время выполнения всего разбора.
     */
    public void recordTotalDuration(Timer.Sample sample) {
        sample.stop(totalDuration);
    }

    /**
     * Записывает время выполнения отдельного шага.
     */
    public void recordStepDuration(Timer.Sample sample, String stepName) {
        Timer stepTimer = Timer.builder("triage.step.duration")
            .tag("step", stepName)
            .description("Duration of triage step")
            .register(meterRegistry);
        sample.stop(stepTimer);
    }

    /**
     * Обновляет количество вхождений с трассировкой за последний разбор.
     */
    public void setOccurrencesCount(int count) {
        lastOccurrencesCount.set(count);
    }

    /**
     * Обновляет количество категорий, у которых нашлось хотя бы одно совпадение.
     */
    public void setCategoriesMatched(int count) {
        lastCategoriesMatched.set(count);
    }

    /**
     * Отмечает успешное завершение разбора.
     */
    public void recordCompleted() {
        completedTotal.increment();
    }

    /**
     * Отмечает разбор, завершившийся ошибкой.
     */
    public void recordFailed() {
        failedTotal.increment();
    }
}
