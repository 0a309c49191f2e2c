package com.example.clipflow.pipeline;

import java.util.Map;

/**
 * Result of running one stage: either it completed with artifacts, or it parked the unit on an
 * outstanding recognition callback.
 */
public record StageOutcome(Map<String, String> artifacts, String correlationId) {

    public StageOutcome {
        artifacts = artifacts != null ? Map.copyOf(artifacts) : Map.of();
    }

    public static StageOutcome completed(Map<String, String> artifacts) {
        return new StageOutcome(artifacts, null);
    }

    public static StageOutcome parked(String correlationId) {
        return new StageOutcome(Map.of(), correlationId);
    }

    public boolean isParked() {
        return correlationId != null;
    }
}
