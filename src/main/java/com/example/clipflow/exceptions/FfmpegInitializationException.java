package com.example.clipflow.exceptions;

public class FfmpegInitializationException extends RuntimeException {
    public FfmpegInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
