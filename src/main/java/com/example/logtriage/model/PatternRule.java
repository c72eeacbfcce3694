package com.example.logtriage.model;

import lombok.Builder;
import lombok.Value;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Именованное правило классификации ошибок с уже скомпилированным шаблоном.
 */
@Value
@Builder
public class PatternRule {
    /**
     * Название категории, например "Database Config Missing"
     */
    String name;

    /**
     * Скомпилированный шаблон (для литеральных правил уже экранирован)
     */
    Pattern pattern;

    boolean caseInsensitive;

    boolean literal;

    /**
     * Нужно ли для совпадений этого правила искать контекст и место возникновения
     */
    boolean trace;

    public Matcher matcher(CharSequence input) {
        return pattern.matcher(input);
    }
}
