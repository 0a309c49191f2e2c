package com.example.clipflow.pipeline;

public record AudioSegment(long startMs, long endMs) {

    public AudioSegment {
        if (startMs < 0 || endMs < startMs) {
            throw new IllegalArgumentException("Invalid segment bounds: " + startMs + ".." + endMs);
        }
    }

    public long durationMs() {
        return endMs - startMs;
    }
}
