package com.fontlint.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.List;

/**
 * Renders audit reports as JSON.
 */
public final class AuditReportWriter {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private AuditReportWriter() {
    }

    public static String toJson(AuditReport report) {
        return write(report);
    }

    public static String toJson(List<AuditReport> reports) {
        return write(reports);
    }

    private static String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render audit report: " + e.getMessage(), e);
        }
    }
}
