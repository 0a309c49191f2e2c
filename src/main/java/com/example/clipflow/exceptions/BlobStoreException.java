package com.example.clipflow.exceptions;

public class BlobStoreException extends RuntimeException {
    public BlobStoreException(String message) {
        super(message);
    }

    public BlobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
