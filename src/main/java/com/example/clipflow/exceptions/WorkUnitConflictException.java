package com.example.clipflow.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * A request that contradicts the current state of a work unit, e.g. retrying a unit that has not failed.
 */
public class WorkUnitConflictException extends ResponseStatusException {

    public WorkUnitConflictException(String reason) {
        super(HttpStatus.CONFLICT, reason);
    }
}
