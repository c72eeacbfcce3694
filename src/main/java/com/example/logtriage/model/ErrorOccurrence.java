package com.example.logtriage.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

/**
 * Одно найденное вхождение ошибки с его происхождением.
 */
@Value
@Builder
public class ErrorOccurrence {
    /**
     * Номер строки (начиная с 1)
     */
    int lineNumber;

    /**
     * Правило, которое сработало на этой строке первым
     */
    String ruleName;

    /**
     * Место вызова вида path:line[:column] или "unknown"
     */
    String callSite;

    /**
     * Идентификатор теста или "unknown"
     */
    String testIdentifier;

    /**
     * Контекст в одну строку, обрезанный до заданной длины
     */
    String snippet;

    @JsonIgnore
    ContextWindow context;

    /**
     * Полный текст контекста, а если его нет, то фрагмент
     */
    @JsonIgnore
    public String getContextText() {
        if (context != null) {
            return context.getText();
        }
        return snippet != null ? snippet : "";
    }
}
