package com.example.logtriage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Конфигурация вывода отчёта.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "output")
public class OutputConfig {

    /**
     * Формат отчёта
     */
    private Format format = Format.TEXT;

    /**
     * Файл для сохранения отчёта. Если не задан, отчёт печатается в stdout.
     */
    private String path;

    public enum Format {
        TEXT,
        JSON
    }
}
