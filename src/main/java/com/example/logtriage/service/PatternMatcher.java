package com.example.logtriage.service;

import com.example.logtriage.model.LogDocument;
import com.example.logtriage.model.MatchCount;
import com.example.logtriage.model.PatternRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Считает совпадения правил классификации по всему тексту лога.
 */
@Slf4j
@Service
public class PatternMatcher {

    /**
     * Возвращает по одному {@link MatchCount} на каждое правило в порядке объявления,
     * включая правила без совпадений.
     */
    public List<MatchCount> countMatches(LogDocument document, List<PatternRule> rules) {
        List<MatchCount> counts = new ArrayList<>(rules.size());
        for (PatternRule rule : rules) {
            int count = countMatches(document.getText(), rule);
            log.debug("Rule '{}' matched {} times", rule.getName(), count);
            counts.add(new MatchCount(rule.getName(), count));
        }
        return counts;
    }

    /**
     * Количество непересекающихся совпадений правила в тексте. Пустые совпадения не считаются.
     */
    public int countMatches(CharSequence text, PatternRule rule) {
        Matcher matcher = rule.matcher(text);
        int count = 0;
        while (matcher.find()) {
            if (matcher.end() > matcher.start()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Смещения начала всех непустых совпадений правила в тексте.
     */
    public List<Integer> matchStarts(CharSequence text, PatternRule rule) {
        Matcher matcher = rule.matcher(text);
        List<Integer> starts = new ArrayList<>();
        while (matcher.find()) {
            if (matcher.end() > matcher.start()) {
                starts.add(matcher.start());
            }
        }
        return starts;
    }
}
