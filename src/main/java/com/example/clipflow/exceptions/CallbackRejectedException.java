package com.example.clipflow.exceptions;

import org.springframework.http.HttpStatusCode;
import org.springframework.web.server.ResponseStatusException;

/**
 * A recognition callback that cannot be recorded (unknown or expired correlation).
 */
public class CallbackRejectedException extends ResponseStatusException {

    public CallbackRejectedException(HttpStatusCode status, String reason) {
        super(status, reason);
    }
}
