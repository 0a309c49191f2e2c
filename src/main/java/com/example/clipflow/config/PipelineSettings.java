package com.example.clipflow.config;

import org.springframework.boot.convert.DurationStyle;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of the pipeline tunables. A snapshot is taken once per worker invocation
 * and passed down, so a refresh never changes values in the middle of an attempt.
 */
public record PipelineSettings(
        int maxAttempts,
        Duration retryBaseDelay,
        Duration retryMaxDelay,
        Duration recognitionExpiry,
        Duration coalesceInterval,
        double coalesceDelta,
        Duration runningTimeout,
        Duration pendingTimeout,
        Duration failureRetention,
        Duration successRetention,
        int purgeBatchSize,
        boolean reaperDryRun,
        int uploadChunkSize,
        long maxInputDurationSeconds,
        double silenceThresholdDb,
        long minSilenceMs,
        long minSegmentMs,
        long maxSegmentMs,
        String recognitionLanguage,
        String recognitionModel) {

    public static final String MAX_ATTEMPTS = "max-attempts";
    public static final String RETRY_BASE_DELAY = "retry-base-delay";
    public static final String RETRY_MAX_DELAY = "retry-max-delay";
    public static final String RECOGNITION_EXPIRY = "recognition-expiry";
    public static final String COALESCE_INTERVAL = "coalesce-interval";
    public static final String COALESCE_DELTA = "coalesce-delta";
    public static final String RUNNING_TIMEOUT = "running-timeout";
    public static final String PENDING_TIMEOUT = "pending-timeout";
    public static final String FAILURE_RETENTION = "failure-retention";
    public static final String SUCCESS_RETENTION = "success-retention";
    public static final String PURGE_BATCH_SIZE = "purge-batch-size";
    public static final String REAPER_DRY_RUN = "reaper-dry-run";
    public static final String UPLOAD_CHUNK_SIZE = "upload-chunk-size";
    public static final String MAX_INPUT_DURATION_SECONDS = "max-input-duration-seconds";
    public static final String SILENCE_THRESHOLD_DB = "silence-threshold-db";
    public static final String MIN_SILENCE_MS = "min-silence-ms";
    public static final String MIN_SEGMENT_MS = "min-segment-ms";
    public static final String MAX_SEGMENT_MS = "max-segment-ms";
    public static final String RECOGNITION_LANGUAGE = "recognition-language";
    public static final String RECOGNITION_MODEL = "recognition-model";

    public static final List<String> KEYS = List.of(
            MAX_ATTEMPTS, RETRY_BASE_DELAY, RETRY_MAX_DELAY, RECOGNITION_EXPIRY, COALESCE_INTERVAL, COALESCE_DELTA,
            RUNNING_TIMEOUT, PENDING_TIMEOUT, FAILURE_RETENTION, SUCCESS_RETENTION, PURGE_BATCH_SIZE, REAPER_DRY_RUN,
            UPLOAD_CHUNK_SIZE, MAX_INPUT_DURATION_SECONDS, SILENCE_THRESHOLD_DB, MIN_SILENCE_MS, MIN_SEGMENT_MS,
            MAX_SEGMENT_MS, RECOGNITION_LANGUAGE, RECOGNITION_MODEL);

    public PipelineSettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("max-attempts must be at least 1");
        }
        if (minSegmentMs <= 0 || maxSegmentMs < minSegmentMs) {
            throw new IllegalArgumentException("Segment bounds must satisfy 0 < min-segment-ms <= max-segment-ms");
        }
        if (uploadChunkSize <= 0) {
            throw new IllegalArgumentException("upload-chunk-size must be positive");
        }
    }

    public static PipelineSettings defaults() {
        return fromValues(Map.of());
    }

    /**
     * Builds a snapshot from raw string values keyed by the constants above. Missing keys take
     * their built-in default; malformed values raise {@link IllegalArgumentException}.
     */
    public static PipelineSettings fromValues(Map<String, String> values) {
        return new PipelineSettings(
                intValue(values, MAX_ATTEMPTS, 3),
                durationValue(values, RETRY_BASE_DELAY, Duration.ofSeconds(2)),
                durationValue(values, RETRY_MAX_DELAY, Duration.ofMinutes(1)),
                durationValue(values, RECOGNITION_EXPIRY, Duration.ofMinutes(30)),
                durationValue(values, COALESCE_INTERVAL, Duration.ofSeconds(1)),
                doubleValue(values, COALESCE_DELTA, 0.5),
                durationValue(values, RUNNING_TIMEOUT, Duration.ofHours(24)),
                durationValue(values, PENDING_TIMEOUT, Duration.ofHours(2)),
                durationValue(values, FAILURE_RETENTION, Duration.ofDays(7)),
                durationValue(values, SUCCESS_RETENTION, Duration.ofDays(30)),
                intValue(values, PURGE_BATCH_SIZE, 1000),
                Boolean.parseBoolean(values.getOrDefault(REAPER_DRY_RUN, "false").trim()),
                intValue(values, UPLOAD_CHUNK_SIZE, 1024 * 1024),
                longValue(values, MAX_INPUT_DURATION_SECONDS, 150L * 60L),
                doubleValue(values, SILENCE_THRESHOLD_DB, -35.0),
                longValue(values, MIN_SILENCE_MS, 500L),
                longValue(values, MIN_SEGMENT_MS, 10_000L),
                longValue(values, MAX_SEGMENT_MS, 45_000L),
                values.getOrDefault(RECOGNITION_LANGUAGE, "auto"),
                values.getOrDefault(RECOGNITION_MODEL, "default"));
    }

    private static int intValue(Map<String, String> values, String key, int fallback) {
        String raw = values.get(key);
        return raw == null ? fallback : Integer.parseInt(raw.trim());
    }

    private static long longValue(Map<String, String> values, String key, long fallback) {
        String raw = values.get(key);
        return raw == null ? fallback : Long.parseLong(raw.trim());
    }

    private static double doubleValue(Map<String, String> values, String key, double fallback) {
        String raw = values.get(key);
        return raw == null ? fallback : Double.parseDouble(raw.trim());
    }

    private static Duration durationValue(Map<String, String> values, String key, Duration fallback) {
        String raw = values.get(key);
        return raw == null ? fallback : DurationStyle.detectAndParse(raw.trim());
    }
}
