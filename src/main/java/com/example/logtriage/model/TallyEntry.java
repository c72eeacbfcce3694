package com.example.logtriage.model;

import lombok.Value;

/**
 * Строка рейтинга: ключ и сколько раз он встретился.
 */
@Value
public class TallyEntry<K> {
    K key;
    int count;
}
