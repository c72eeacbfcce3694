package com.example.logtriage.model;

import lombok.Value;

/**
 * Условия, по которым вхождение считается подозрительным источником.
 * Пустое условие отключено.
 */
@Value
public class SuspectFilter {
    /**
     * Подстрока, которую ищем в месте вызова
     */
    String moduleName;

    /**
     * Подстрока, которую ищем в контексте вхождения
     */
    String marker;

    public static SuspectFilter none() {
        return new SuspectFilter(null, null);
    }

    public boolean hasModuleName() {
        return moduleName != null && !moduleName.isBlank();
    }

    public boolean hasMarker() {
        return marker != null && !marker.isBlank();
    }
}
