package com.example.clipflow.service;

import com.example.clipflow.domain.ErrorClassification;
import com.example.clipflow.domain.PipelineStage;
import com.example.clipflow.domain.WorkUnit;
import com.example.clipflow.domain.WorkUnit.WorkUnitStatus;
import com.example.clipflow.domain.WorkUnitKind;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Owns every write to a work unit row. Each transition runs in its own transaction, appends to the
 * unit's bounded log and publishes a {@link com.example.clipflow.events.WorkUnitChangedEvent} that is
 * delivered after commit.
 * <p>
 * Operations taking a lease token are worker-side: they throw
 * {@link com.example.clipflow.exceptions.ConcurrencyConflictException} if the caller no longer holds
 * the unit's current attempt.
 */
public interface WorkUnitStatusUpdater {

    /**
     * Inserts a new live unit. Throws {@link org.springframework.dao.DataIntegrityViolationException}
     * if another live unit exists for the same target and kind.
     */
    WorkUnit createLive(String ownerId, String targetId, WorkUnitKind kind, Map<String, String> params);

    /**
     * Attempts to take the unit's current attempt. Returns the lease token if this caller won.
     */
    Optional<String> claim(Long workUnitId);

    WorkUnit advanceStage(Long workUnitId, String leaseToken, PipelineStage stage);

    /**
     * Persists sub-stage progress. Never lowers the stored value and publishes nothing.
     */
    void recordProgress(Long workUnitId, String leaseToken, double progress, String message);

    /**
     * Marks {@code stage} as done, moves progress to its ceiling and merges produced artifacts.
     */
    WorkUnit completeStage(Long workUnitId, String leaseToken, PipelineStage stage, Map<String, String> artifacts);

    /**
     * Releases the lease while a recognition result is outstanding. The unit stays RUNNING.
     */
    void park(Long workUnitId, String leaseToken, String correlationId);

    void succeed(Long workUnitId, String leaseToken);

    void fail(Long workUnitId, String leaseToken, String message, ErrorClassification classification);

    /**
     * Ends the current attempt and queues a new one after {@code backoff}.
     */
    void scheduleRetry(Long workUnitId, String leaseToken, String message, Duration backoff);

    /**
     * Makes a parked unit claimable again with the recognition result attached. Joins the caller's
     * transaction so the result can be consumed atomically with the resume.
     *
     * @param correlationId the correlation the result arrived on; must be the one the unit is parked on
     * @return false if the unit is no longer parked on {@code correlationId}
     */
    boolean resumeFromCallback(Long workUnitId, String correlationId, Map<String, String> artifacts);

    /**
     * Fails a unit parked on {@code correlationId}. Joins the caller's transaction.
     */
    boolean failParked(Long workUnitId, String correlationId, String message, ErrorClassification classification);

    /**
     * Cancels a live unit and discards any recognition correlation it is parked on. Terminal units
     * are returned unchanged.
     */
    WorkUnit cancel(Long workUnitId, String reason);

    /**
     * Re-activates a failed unit as a new attempt with progress reset.
     */
    WorkUnit retryFailed(Long workUnitId);

    /**
     * Fails the unit only if it is still in {@code expected} and was last updated before {@code threshold}.
     */
    boolean failIfStale(Long workUnitId, WorkUnitStatus expected, Instant threshold, String message,
                        ErrorClassification classification);
}
