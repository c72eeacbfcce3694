package com.example.logtriage.model;

import lombok.Builder;
import lombok.Value;

/**
 * Место вызова, разобранное из стек-трейса.
 */
@Value
@Builder
public class CallSite {
    /**
     * Путь к файлу в том виде, в котором он записан в логе
     */
    String filePath;

    /**
     * Номер строки (начиная с 1)
     */
    int lineNumber;

    /**
     * Номер колонки (начиная с 1), 0 если не указан
     */
    int columnNumber;

    @Override
    public String toString() {
        if (columnNumber > 0) {
            return filePath + ":" + lineNumber + ":" + columnNumber;
        }
        return filePath + ":" + lineNumber;
    }
}
