package com.example.clipflow.domain;

import java.util.Arrays;
import java.util.List;

/**
 * Static, ordered table of pipeline stages. Each stage owns a sub-range of the
 * global 0-100 progress scale; a stage's local percentage is mapped into that range.
 */
public enum PipelineStage {

    TRANSFER_IN("transfer_in", 0, 50),
    MERGE("merge", 50, 55),
    CONVERT("convert", 55, 60),
    EXTRACT_AUDIO("extract_audio", 60, 70),
    SEGMENT_AUDIO("segment_audio", 70, 80),
    RECOGNITION("recognition", 80, 90),
    ANALYZE_CONTENT("analyze_content", 90, 95),
    EXTRACT_SEGMENTS("extract_segments", 95, 100);

    private static final List<PipelineStage> ORDERED = List.of(values());

    private final String stageName;
    private final int progressFloor;
    private final int progressCeiling;

    PipelineStage(String stageName, int progressFloor, int progressCeiling) {
        this.stageName = stageName;
        this.progressFloor = progressFloor;
        this.progressCeiling = progressCeiling;
    }

    public String getStageName() {
        return stageName;
    }

    public int getProgressFloor() {
        return progressFloor;
    }

    public int getProgressCeiling() {
        return progressCeiling;
    }

    /**
     * Maps a stage-local percentage onto the global progress scale.
     * Out-of-range local values are clamped to [0, 100].
     */
    public double globalProgress(double localPercent) {
        double local = Math.max(0.0, Math.min(100.0, localPercent));
        return progressFloor + (local / 100.0) * (progressCeiling - progressFloor);
    }

    public boolean precedes(PipelineStage other) {
        return other != null && this.ordinal() < other.ordinal();
    }

    public static List<PipelineStage> ordered() {
        return ORDERED;
    }

    public static PipelineStage fromStageName(String stageName) {
        return Arrays.stream(values())
                .filter(stage -> stage.stageName.equalsIgnoreCase(stageName) || stage.name().equalsIgnoreCase(stageName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown pipeline stage: " + stageName));
    }
}
