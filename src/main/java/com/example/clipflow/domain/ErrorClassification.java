package com.example.clipflow.domain;

/**
 * How a failure is treated by the retry policy and reported to clients.
 */
public enum ErrorClassification {
    TRANSIENT,        // external timeouts, 5xx, I/O: retried with backoff
    PERMANENT,        // invalid input, unsupported format, quota: fail immediately
    CONFLICT,         // lost a claim or lease: silent no-op
    CALLBACK_TIMEOUT, // recognition result never arrived before expiry
    CANCELLED
}
