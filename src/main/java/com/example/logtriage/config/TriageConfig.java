package com.example.logtriage.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Конфигурация разбора логов: правила классификации и параметры отчёта.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "triage")
public class TriageConfig {

    /**
     * Правила классификации ошибок. Порядок важен для отчёта при равных счётчиках.
     */
    @Valid
    private List<PatternRuleProperties> patternRules = new ArrayList<>();

    /**
     * Грамматика упоминаний тестовых файлов. Совпадение начинается только в начале токена
     * или сразу после ведущего разделителя пути.
     */
    private String mentionGrammar = "(?<![\\w.@-])(?<![\\w.@-][/\\\\])(?:[\\w.@-]+/)*[\\w.@-]+\\.(?:spec|test)\\.[cm]?[jt]sx?\\b";

    /**
     * Шаблон места вызова. Должен содержать именованные группы file и line, группа column необязательна.
     * Путь начинается только на границе токена.
     */
    private String callSitePattern =
            "(?<![\\w.@/\\\\-])(?<file>(?:[A-Za-z]:)?(?:[\\w.@-]*[/\\\\])*[\\w.@-]+\\.(?:[cm]?[jt]sx?|java|py|rs|go)):(?<line>\\d+)(?::(?<column>\\d+))?";

    /**
     * Шаблон идентификатора теста. Если не задан, используется грамматика упоминаний.
     */
    private String testIdentifierPattern;

    /**
     * Сколько строк брать до совпадения
     */
    @Min(0)
    private int contextLookback = 5;

    /**
     * Сколько строк брать после совпадения
     */
    @Min(0)
    private int contextLookahead = 10;

    /**
     * Максимум уникальных пар (место вызова, тест) в отчёте
     */
    @Min(0)
    private int dedupCap = 5;

    @Min(0)
    private int topNMentions = 10;

    @Min(0)
    private int topNOrigins = 5;

    /**
     * Максимальная длина фрагмента контекста в отчёте
     */
    @Min(1)
    private int snippetMaxLength = 200;

    /**
     * Имя модуля, места вызова из которого считаются подозрительными
     */
    private String suspectModuleName;

    /**
     * Маркер в контексте, который делает вхождение подозрительным
     */
    private String suspectMarker;

    @Data
    public static class PatternRuleProperties {
        /**
         * Название категории
         */
        private String name;

        /**
         * Регулярное выражение или литерал
         */
        private String pattern;

        private boolean caseInsensitive = false;

        /**
         * Искать pattern как обычную строку, без регулярных выражений
         */
        private boolean literal = false;

        /**
         * Искать контекст и место возникновения для каждого совпадения
         */
        private boolean trace = false;
    }
}
