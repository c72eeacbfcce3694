package com.example.logtriage.service;

import com.example.logtriage.model.TriageReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Сериализует отчёт в JSON для программной обработки.
 */
@Slf4j
@Service
public class JsonReportWriter {

    private final ObjectMapper objectMapper;

    public JsonReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    public String write(TriageReport report) {
        try {
            return objectMapper.writeValueAsString(report) + "\n";
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize report", e);
            throw new IllegalStateException("Failed to serialize report: " + e.getMessage(), e);
        }
    }
}
