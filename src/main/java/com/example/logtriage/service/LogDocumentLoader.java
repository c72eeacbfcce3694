package com.example.logtriage.service;

import com.example.logtriage.exception.LogInputNotFoundException;
import com.example.logtriage.model.LogDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Загружает лог в память целиком.
 */
@Slf4j
@Service
public class LogDocumentLoader {

    /**
     * Читает файл лога. Файл закрывается сразу после чтения.
     *
     * @param path путь к файлу
     * @return загруженный документ
     * @throws LogInputNotFoundException если файл не существует или не читается
     */
    public LogDocument load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new LogInputNotFoundException(String.valueOf(path), null);
        }

        try {
            // Логи тестов бывают с битыми байтами, заменяем их вместо ошибки
            byte[] bytes = Files.readAllBytes(path);
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPLACE)
                    .onUnmappableCharacter(CodingErrorAction.REPLACE)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();

            LogDocument document = LogDocument.of(path.toString(), text);
            log.info("Loaded log {} ({} lines)", path, document.getLineCount());
            return document;
        } catch (IOException e) {
            log.error("Error reading log file: {}", path, e);
            throw new LogInputNotFoundException(path.toString(), e);
        }
    }

    /**
     * Создаёт документ из строки в памяти.
     */
    public LogDocument fromText(String source, String text) {
        return LogDocument.of(source, text);
    }
}
