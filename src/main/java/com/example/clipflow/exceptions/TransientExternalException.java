package com.example.clipflow.exceptions;

import com.example.clipflow.domain.ErrorClassification;

public class TransientExternalException extends PipelineException {
    public TransientExternalException(String message) {
        super(ErrorClassification.TRANSIENT, message);
    }

    public TransientExternalException(String message, Throwable cause) {
        super(ErrorClassification.TRANSIENT, message, cause);
    }
}
