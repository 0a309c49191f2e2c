package com.example.clipflow.exceptions;

import com.example.clipflow.domain.ErrorClassification;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Maps arbitrary throwables onto the pipeline's error taxonomy. The cause chain is walked
 * until a recognised type is found; anything unrecognised is treated as permanent.
 */
public final class ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 10;

    private ErrorClassifier() {
    }

    public static ErrorClassification classify(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            ErrorClassification classification = classifySingle(current);
            if (classification != null) {
                return classification;
            }
            current = current.getCause();
        }
        return ErrorClassification.PERMANENT;
    }

    private static ErrorClassification classifySingle(Throwable error) {
        if (error instanceof PipelineException pipelineException) {
            return pipelineException.getClassification();
        }
        if (error instanceof HttpClientErrorException clientError) {
            int status = clientError.getStatusCode().value();
            return (status == 408 || status == 429) ? ErrorClassification.TRANSIENT : ErrorClassification.PERMANENT;
        }
        if (error instanceof HttpServerErrorException
                || error instanceof ResourceAccessException
                || error instanceof TimeoutException
                || error instanceof IOException
                || error instanceof TransientDataAccessException) {
            return ErrorClassification.TRANSIENT;
        }
        if (error instanceof IllegalArgumentException) {
            return ErrorClassification.PERMANENT;
        }
        return null;
    }

    /**
     * Short, client-safe description of a failure.
     */
    public static String describe(Throwable error) {
        ErrorClassification classification = classify(error);
        String detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return switch (classification) {
            case TRANSIENT -> "Temporary failure: " + detail;
            case CALLBACK_TIMEOUT -> "Timed out: " + detail;
            case CANCELLED -> "Cancelled: " + detail;
            default -> "Failed: " + detail;
        };
    }
}
