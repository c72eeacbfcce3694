package com.example.logtriage.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Частотная таблица: счётчик на каждый уникальный ключ.
 * <p>
 * Помнит порядок первого появления ключей. Ранжирование идёт по убыванию счётчика,
 * при равенстве выше стоит ключ, встреченный раньше.
 */
public final class Tally<K> {

    private final Map<K, Integer> counts;

    private Tally(Map<K, Integer> counts) {
        this.counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }

    public static <K> Tally<K> empty() {
        return new Tally<>(Map.of());
    }

    public static <K> Builder<K> builder() {
        return new Builder<>();
    }

    public int count(K key) {
        return counts.getOrDefault(key, 0);
    }

    /**
     * Количество уникальных ключей.
     */
    public int distinctCount() {
        return counts.size();
    }

    public int totalCount() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /**
     * Все записи в порядке первого появления.
     */
    public List<TallyEntry<K>> entries() {
        List<TallyEntry<K>> entries = new ArrayList<>(counts.size());
        counts.forEach((key, count) -> entries.add(new TallyEntry<>(key, count)));
        return entries;
    }

    /**
     * Первые {@code limit} записей по убыванию счётчика.
     */
    public List<TallyEntry<K>> ranked(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<TallyEntry<K>> entries = entries();
        // List.sort стабилен, поэтому равные счётчики сохраняют порядок появления
        entries.sort(Comparator.comparingInt(TallyEntry<K>::getCount).reversed());
        return List.copyOf(entries.subList(0, Math.min(limit, entries.size())));
    }

    @Override
    public String toString() {
        return counts.toString();
    }

    public static final class Builder<K> {
        private final Map<K, Integer> counts = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder<K> add(K key) {
            counts.merge(key, 1, Integer::sum);
            return this;
        }

        public Tally<K> build() {
            return new Tally<>(counts);
        }
    }
}
