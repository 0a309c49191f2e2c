package com.example.clipflow.exceptions;

import com.example.clipflow.domain.ErrorClassification;

/**
 * Base for failures raised inside a pipeline stage. The classification drives the retry policy.
 */
public abstract class PipelineException extends RuntimeException {

    private final ErrorClassification classification;

    protected PipelineException(ErrorClassification classification, String message) {
        super(message);
        this.classification = classification;
    }

    protected PipelineException(ErrorClassification classification, String message, Throwable cause) {
        super(message, cause);
        this.classification = classification;
    }

    public ErrorClassification getClassification() {
        return classification;
    }
}
