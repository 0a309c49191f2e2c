package com.example.clipflow.events;

import com.example.clipflow.domain.WorkUnit;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Locale;

/**
 * Last-write-wins progress snapshot for one target. Always derivable from the work unit row.
 */
public record ProgressEvent(
        @JsonProperty("target_id") String targetId,
        @JsonProperty("owner_id") String ownerId,
        @JsonProperty("work_unit_id") Long workUnitId,
        int attempt,
        String stage,
        double progress,
        String message,
        String status,
        Instant timestamp) {

    public static ProgressEvent of(WorkUnit unit, Instant timestamp) {
        return new ProgressEvent(
                unit.getTargetId(),
                unit.getOwnerId(),
                unit.getId(),
                unit.getAttemptCount(),
                unit.getCurrentStage() != null ? unit.getCurrentStage().getStageName() : null,
                unit.getProgress(),
                unit.getMessage(),
                unit.getStatus().name().toLowerCase(Locale.ROOT),
                timestamp);
    }

    /**
     * Same event with sub-stage progress applied.
     */
    public ProgressEvent withProgress(double newProgress, String newMessage, Instant newTimestamp) {
        return new ProgressEvent(targetId, ownerId, workUnitId, attempt, stage, newProgress,
                newMessage != null ? newMessage : message, status, newTimestamp);
    }

    public boolean isTerminal() {
        return "success".equals(status) || "failure".equals(status);
    }
}
