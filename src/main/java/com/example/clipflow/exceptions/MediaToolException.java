package com.example.clipflow.exceptions;

import com.example.clipflow.domain.ErrorClassification;

/**
 * Failure of a media tool invocation, e.g. a non-zero FFmpeg exit or a timeout.
 */
public class MediaToolException extends PipelineException {

    private final Integer exitCode; // null if the process never reported one
    private final String stderrOutput;

    public MediaToolException(ErrorClassification classification, String message) {
        super(classification, message);
        this.exitCode = null;
        this.stderrOutput = null;
    }

    public MediaToolException(ErrorClassification classification, String message, Throwable cause) {
        super(classification, message, cause);
        this.exitCode = null;
        this.stderrOutput = null;
    }

    public MediaToolException(ErrorClassification classification, String message, int exitCode, String stderrOutput) {
        super(classification, message);
        this.exitCode = exitCode;
        this.stderrOutput = stderrOutput;
    }

    public Integer getExitCode() {
        return exitCode;
    }

    public String getStderrOutput() {
        return stderrOutput;
    }
}
