package com.example.clipflow.service;

import com.example.clipflow.domain.CallbackCorrelation;

import java.time.Duration;
import java.time.Instant;

/**
 * Lifecycle of {@link CallbackCorrelation} rows on the worker side.
 */
public interface RecognitionCorrelationService {

    /**
     * Creates an awaiting correlation in its own transaction, before anything is sent out.
     */
    CallbackCorrelation open(Long workUnitId, Duration expiry);

    void recordRemoteTask(String correlationId, String remoteTaskId);

    /**
     * Removes a correlation whose submission never completed.
     */
    void discard(String correlationId);

    /**
     * Consumes a delivered correlation and resumes or fails its work unit in the same transaction.
     *
     * @return false if another consumer got there first
     */
    boolean consumeDelivered(CallbackCorrelation correlation);

    /**
     * Expires an overdue correlation and fails its work unit with a callback timeout.
     *
     * @return false if the correlation was delivered or expired in the meantime
     */
    boolean expire(CallbackCorrelation correlation, Instant now);

    int purgeExpired(Instant expiredBefore);
}
