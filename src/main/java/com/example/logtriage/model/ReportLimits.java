package com.example.logtriage.model;

import lombok.Builder;
import lombok.Value;

/**
 * Ограничения размера отчёта.
 */
@Value
@Builder(toBuilder = true)
public class ReportLimits {
    @Builder.Default
    int topMentions = 10;

    @Builder.Default
    int topOrigins = 5;

    @Builder.Default
    int dedupCap = 5;

    public static ReportLimits defaults() {
        return ReportLimits.builder().build();
    }
}
