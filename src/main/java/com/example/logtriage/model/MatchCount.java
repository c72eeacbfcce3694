package com.example.logtriage.model;

import lombok.Value;

/**
 * Количество совпадений одного правила по всему документу.
 */
@Value
public class MatchCount {
    String ruleName;
    int count;
}
