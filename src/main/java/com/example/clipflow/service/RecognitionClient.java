package com.example.clipflow.service;

/**
 * Client for the remote speech recognition service. Submission returns once the audio is
 * uploaded; the result arrives later through the callback receiver.
 */
public interface RecognitionClient {

    @FunctionalInterface
    interface UploadProgressListener {
        void onProgress(long uploadedBytes, long totalBytes);
    }

    RecognitionSubmission submit(RecognitionRequest request, RetryPolicy retryPolicy, UploadProgressListener listener);

    /**
     * Downloads the transcript a callback pointed at.
     */
    String fetchResult(String resultRef, RetryPolicy retryPolicy);
}
