package com.example.clipflow.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class WorkUnitNotFoundException extends ResponseStatusException {

    public WorkUnitNotFoundException(Long workUnitId) {
        super(HttpStatus.NOT_FOUND, "Work unit not found: " + workUnitId);
    }
}
