package com.example.logtriage.model;

import lombok.Value;

/**
 * Фрагмент строк вокруг совпадения: строки с индексами [start, end).
 * Всегда выполняется 0 &lt;= start &lt;= center &lt;= end &lt;= количество строк.
 */
@Value
public class ContextWindow {
    int center;
    int start;
    int end;
    String text;

    public int length() {
        return end - start;
    }
}
