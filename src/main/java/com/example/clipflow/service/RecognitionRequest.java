package com.example.clipflow.service;

/**
 * What the recognition service needs to transcribe one audio blob.
 */
public record RecognitionRequest(String correlationId,
                                 String audioRef,
                                 String filename,
                                 String language,
                                 String model,
                                 int chunkSize) {
}
