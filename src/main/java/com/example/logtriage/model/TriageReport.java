package com.example.logtriage.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Итоговый отчёт разбора лога. Содержит четыре представления в порядке вывода.
 */
@Value
@Builder
public class TriageReport {
    /**
     * Источник лога
     */
    String source;

    /**
     * Количество просмотренных строк
     */
    int totalLines;

    /**
     * Категории с ненулевым числом совпадений, по убыванию
     */
    @Builder.Default
    List<MatchCount> categories = List.of();

    /**
     * Самые частые упоминания тестовых файлов
     */
    @Builder.Default
    List<TallyEntry<String>> topMentions = List.of();

    /**
     * Общее число уникальных упоминаний
     */
    int distinctMentions;

    /**
     * Уникальные пары (место вызова, тест), не больше лимита
     */
    @Builder.Default
    List<ErrorOccurrence> errorLocations = List.of();

    /**
     * Всего найдено вхождений до дедупликации
     */
    int totalOccurrences;

    /**
     * Самые частые подозрительные места вызова
     */
    @Builder.Default
    List<TallyEntry<String>> topOrigins = List.of();
}
