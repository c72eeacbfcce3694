package com.example.logtriage.model;

import lombok.Value;

/**
 * Результат разбора контекста: первое место вызова и первый идентификатор теста.
 */
@Value
public class FrameReferences {

    public static final String UNKNOWN = "unknown";

    private static final FrameReferences NONE = new FrameReferences(null, UNKNOWN);

    /**
     * Место вызова или null, если в контексте его нет
     */
    CallSite callSite;

    /**
     * Идентификатор теста или {@link #UNKNOWN}
     */
    String testIdentifier;

    public static FrameReferences none() {
        return NONE;
    }

    public String getCallSiteReference() {
        return callSite != null ? callSite.toString() : UNKNOWN;
    }
}
