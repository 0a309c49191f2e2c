package com.example.clipflow.service;

public record RecognitionSubmission(String remoteTaskId, String uploadUrl, long uploadedBytes) {
}
