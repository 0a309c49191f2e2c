package com.example.clipflow.service;

import java.util.Map;

/**
 * Outcome of a successful media tool invocation. {@code outputRef} is null for analysis-only
 * operations such as segment detection.
 */
public record MediaToolResult(String outputRef, Map<String, Object> metrics) {

    public static final String DURATION_SECONDS = "durationSeconds";
    public static final String SIZE_BYTES = "sizeBytes";
    public static final String SEGMENTS = "segments";

    public MediaToolResult {
        metrics = metrics != null ? Map.copyOf(metrics) : Map.of();
    }

    public Double durationSeconds() {
        Object value = metrics.get(DURATION_SECONDS);
        return value instanceof Number number ? number.doubleValue() : null;
    }
}
