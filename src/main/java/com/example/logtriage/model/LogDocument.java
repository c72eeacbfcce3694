package com.example.logtriage.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Загруженный лог: полный текст и его разбиение на строки.
 * Номера строк в отчётах начинаются с 1, индексы в {@link #getLines()} с 0.
 */
@Getter
public final class LogDocument {

    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    private static final LogDocument EMPTY = new LogDocument("<empty>", "", List.of(), new int[0]);

    /**
     * Откуда загружен документ (путь к файлу или метка)
     */
    private final String source;

    /**
     * Полный текст лога
     */
    private final String text;

    /**
     * Строки лога без символов перевода строки
     */
    private final List<String> lines;

    @Getter(AccessLevel.NONE)
    private final int[] lineStarts;

    private LogDocument(String source, String text, List<String> lines, int[] lineStarts) {
        this.source = source;
        this.text = text;
        this.lines = lines;
        this.lineStarts = lineStarts;
    }

    /**
     * Создаёт документ из текста. Завершающий перевод строки любого вида не порождает пустую строку.
     */
    public static LogDocument of(String source, String text) {
        if (text == null || text.isEmpty()) {
            return new LogDocument(source, "", List.of(), new int[0]);
        }

        List<String> lines = new ArrayList<>();
        List<Integer> starts = new ArrayList<>();
        Matcher matcher = LINE_BREAK.matcher(text);
        int position = 0;
        while (matcher.find()) {
            starts.add(position);
            lines.add(text.substring(position, matcher.start()));
            position = matcher.end();
        }
        if (position < text.length()) {
            starts.add(position);
            lines.add(text.substring(position));
        }

        return new LogDocument(source, text, List.copyOf(lines),
                starts.stream().mapToInt(Integer::intValue).toArray());
    }

    public static LogDocument empty() {
        return EMPTY;
    }

    public int getLineCount() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    /**
     * Индекс строки (с 0), в которой находится символ с данным смещением в тексте.
     * Перевод строки относится к строке, которую он завершает.
     */
    public int lineIndexAt(int offset) {
        if (lineStarts.length == 0) {
            return 0;
        }
        int found = Arrays.binarySearch(lineStarts, offset);
        int index = found >= 0 ? found : -found - 2;
        return Math.max(0, Math.min(lineStarts.length - 1, index));
    }
}
