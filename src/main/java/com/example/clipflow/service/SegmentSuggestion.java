package com.example.clipflow.service;

import java.util.List;

/**
 * A clip proposed by content analysis, in milliseconds from the start of the source video.
 */
public record SegmentSuggestion(String title, long startMs, long endMs, List<String> tags) {

    public SegmentSuggestion {
        if (endMs <= startMs) {
            throw new IllegalArgumentException("Segment end must be after start: " + startMs + ".." + endMs);
        }
        tags = tags != null ? List.copyOf(tags) : List.of();
    }
}
