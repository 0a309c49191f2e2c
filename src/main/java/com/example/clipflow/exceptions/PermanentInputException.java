package com.example.clipflow.exceptions;

import com.example.clipflow.domain.ErrorClassification;

public class PermanentInputException extends PipelineException {
    public PermanentInputException(String message) {
        super(ErrorClassification.PERMANENT, message);
    }

    public PermanentInputException(String message, Throwable cause) {
        super(ErrorClassification.PERMANENT, message, cause);
    }
}
