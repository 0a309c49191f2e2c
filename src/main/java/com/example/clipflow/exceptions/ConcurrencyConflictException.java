package com.example.clipflow.exceptions;

import com.example.clipflow.domain.ErrorClassification;

/**
 * The caller no longer holds the work unit (claim lost, lease revoked by cancel or the reaper).
 * Callers treat it as a silent stop, never as a failure of the unit.
 */
public class ConcurrencyConflictException extends PipelineException {
    public ConcurrencyConflictException(String message) {
        super(ErrorClassification.CONFLICT, message);
    }

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(ErrorClassification.CONFLICT, message, cause);
    }
}
