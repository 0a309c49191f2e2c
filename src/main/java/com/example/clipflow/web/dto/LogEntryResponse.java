package com.example.clipflow.web.dto;

import com.example.clipflow.domain.WorkUnitLogEntry;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Locale;

public record LogEntryResponse(
        @JsonProperty("old_status") String oldStatus,
        @JsonProperty("new_status") String newStatus,
        String stage,
        double progress,
        int attempt,
        String message,
        Instant timestamp
) {

    public static LogEntryResponse fromEntity(WorkUnitLogEntry entry) {
        return new LogEntryResponse(
                entry.getOldStatus() != null ? entry.getOldStatus().name().toLowerCase(Locale.ROOT) : null,
                entry.getNewStatus().name().toLowerCase(Locale.ROOT),
                entry.getStage() != null ? entry.getStage().getStageName() : null,
                entry.getProgress(),
                entry.getAttempt(),
                entry.getMessage(),
                entry.getCreatedAt()
        );
    }
}
