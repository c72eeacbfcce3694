package com.example.logtriage.exception;

import lombok.Getter;

/**
 * Лог не найден или не может быть прочитан.
 */
@Getter
public class LogInputNotFoundException extends RuntimeException {

    private final String location;

    public LogInputNotFoundException(String location, Throwable cause) {
        super("Log document cannot be read: " + location, cause);
        this.location = location;
    }
}
