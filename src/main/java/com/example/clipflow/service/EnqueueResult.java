package com.example.clipflow.service;

/**
 * Outcome of an enqueue. {@code created} is false when an existing live unit was returned.
 */
public record EnqueueResult(Long workUnitId, boolean created) {
}
