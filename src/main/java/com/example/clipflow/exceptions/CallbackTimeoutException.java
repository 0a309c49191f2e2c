package com.example.clipflow.exceptions;

import com.example.clipflow.domain.ErrorClassification;

public class CallbackTimeoutException extends PipelineException {
    public CallbackTimeoutException(String message) {
        super(ErrorClassification.CALLBACK_TIMEOUT, message);
    }
}
