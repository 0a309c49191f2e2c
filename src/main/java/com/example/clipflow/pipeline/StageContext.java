package com.example.clipflow.pipeline;

import com.example.clipflow.config.PipelineSettings;
import com.example.clipflow.domain.WorkUnit;
import com.example.clipflow.exceptions.PermanentInputException;
import com.example.clipflow.service.RetryPolicy;

/**
 * Everything a stage handler sees: a snapshot of the unit as it entered the stage, the settings
 * snapshot of this attempt and the attempt's retry policy.
 */
public record StageContext(WorkUnit unit,
                           String leaseToken,
                           PipelineSettings settings,
                           RetryPolicy retryPolicy,
                           ProgressReporter progress) {

    public String param(String key) {
        return unit.getParams().get(key);
    }

    public String artifact(String key) {
        return unit.getArtifacts().get(key);
    }

    /**
     * An input produced by an earlier stage, or supplied up front as the {@code <key>Ref} param
     * when the unit's plan starts after the producing stage.
     */
    public String requireInput(String key) {
        String value = artifact(key);
        if (value == null || value.isBlank()) {
            value = param(key + StageArtifacts.REF_SUFFIX);
        }
        if (value == null || value.isBlank()) {
            throw new PermanentInputException("Missing input '" + key + "' for stage " + unit.getCurrentStage());
        }
        return value;
    }

    /**
     * Blob key scoped to this unit and attempt, so a retry never reads a half-written output.
     */
    public String blobKey(String name) {
        return "work-units/" + unit.getId() + "/attempt-" + unit.getAttemptCount() + "/" + name;
    }
}
