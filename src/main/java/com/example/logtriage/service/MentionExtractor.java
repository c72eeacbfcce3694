package com.example.logtriage.service;

import com.example.logtriage.model.LogDocument;
import com.example.logtriage.model.Tally;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Собирает упоминания тестовых файлов по всему тексту лога.
 */
@Slf4j
@Service
public class MentionExtractor {

    /**
     * Находит все токены, подходящие под грамматику, слева направо без пересечений.
     *
     * @param document лог
     * @param grammar  грамматика упоминаний
     * @return частотная таблица нормализованных упоминаний
     */
    public Tally<String> extractMentions(LogDocument document, Pattern grammar) {
        Tally.Builder<String> tally = Tally.builder();
        Matcher matcher = grammar.matcher(document.getText());
        while (matcher.find()) {
            if (matcher.end() == matcher.start()) {
                continue;
            }
            tally.add(normalize(matcher.group()));
        }

        Tally<String> result = tally.build();
        log.debug("Found {} distinct mentions", result.distinctCount());
        return result;
    }

    /**
     * Приводит ссылку к единому виду: прямые слэши, без ведущего "./".
     */
    static String normalize(String reference) {
        String normalized = reference.replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }
}
