package com.example.logtriage.service;

import com.example.logtriage.model.ContextWindow;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Вырезает строки вокруг заданной строки лога.
 */
@Service
public class ContextWindowExtractor {

    /**
     * Возвращает окно [center - lookBack, center + lookAhead], обрезанное по границам документа.
     * Индекс центра вне диапазона не вызывает ошибку, а прижимается к границе.
     *
     * @param lines     строки документа
     * @param center    индекс строки (с 0)
     * @param lookBack  сколько строк брать до центра
     * @param lookAhead сколько строк брать после центра
     */
    public ContextWindow extract(List<String> lines, int center, int lookBack, int lookAhead) {
        int total = lines.size();
        int clampedCenter = clamp(center, 0, total);
        long rawStart = (long) clampedCenter - Math.max(0, lookBack);
        long rawEnd = (long) clampedCenter + Math.max(0, lookAhead) + 1;

        int start = (int) Math.max(0, rawStart);
        int end = (int) Math.min(total, rawEnd);

        String text = String.join("\n", lines.subList(start, end));
        return new ContextWindow(clampedCenter, start, end, text);
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
