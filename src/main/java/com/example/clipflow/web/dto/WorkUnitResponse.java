package com.example.clipflow.web.dto;

import com.example.clipflow.domain.ErrorClassification;
import com.example.clipflow.domain.WorkUnit;
import com.example.clipflow.domain.WorkUnitKind;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * Client-facing snapshot of a work unit. Lease and internal bookkeeping are not exposed.
 */
public record WorkUnitResponse(
        Long id,
        @JsonProperty("target_id") String targetId,
        WorkUnitKind kind,
        String status,
        String stage,
        double progress,
        String message,
        int attempt,
        @JsonProperty("awaiting_callback") boolean awaitingCallback,
        @JsonProperty("error_classification") ErrorClassification errorClassification,
        Map<String, String> artifacts,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("completed_at") Instant completedAt
) {

    public static WorkUnitResponse fromEntity(WorkUnit unit) {
        if (unit == null) {
            throw new NullPointerException("Cannot create WorkUnitResponse from null WorkUnit entity");
        }
        return new WorkUnitResponse(
                unit.getId(),
                unit.getTargetId(),
                unit.getKind(),
                unit.getStatus().name().toLowerCase(Locale.ROOT),
                unit.getCurrentStage() != null ? unit.getCurrentStage().getStageName() : null,
                unit.getProgress(),
                unit.getMessage(),
                unit.getAttemptCount(),
                unit.isAwaitingCallback(),
                unit.getErrorClassification(),
                Map.copyOf(unit.getArtifacts()),
                unit.getCreatedAt(),
                unit.getStartedAt(),
                unit.getUpdatedAt(),
                unit.getCompletedAt()
        );
    }
}
