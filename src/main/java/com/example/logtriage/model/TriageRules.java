package com.example.logtriage.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Проверенная и скомпилированная конфигурация разбора.
 * Создаётся один раз при загрузке конфигурации и дальше только читается.
 */
@Value
@Builder
public class TriageRules {
    @Builder.Default
    List<PatternRule> patternRules = List.of();

    Pattern mentionGrammar;

    Pattern callSitePattern;

    /**
     * Есть ли в шаблоне места вызова группа column
     */
    boolean callSiteHasColumn;

    Pattern testIdentifierPattern;

    int contextLookback;

    int contextLookahead;

    int snippetMaxLength;

    SuspectFilter suspectFilter;

    public List<PatternRule> getTracedRules() {
        return patternRules.stream().filter(PatternRule::isTrace).toList();
    }
}
