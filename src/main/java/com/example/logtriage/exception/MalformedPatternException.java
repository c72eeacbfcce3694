package com.example.logtriage.exception;

import lombok.Getter;

/**
 * Некорректное правило в конфигурации. Бросается при загрузке конфигурации,
 * до начала анализа.
 */
@Getter
public class MalformedPatternException extends RuntimeException {

    private final String ruleName;

    public MalformedPatternException(String ruleName, String message) {
        super("Invalid pattern rule '" + ruleName + "': " + message);
        this.ruleName = ruleName;
    }

    public MalformedPatternException(String ruleName, String message, Throwable cause) {
        super("Invalid pattern rule '" + ruleName + "': " + message, cause);
        this.ruleName = ruleName;
    }
}
