package com.example.clipflow.domain;

import java.util.List;

/**
 * Kind of background job. The kind decides which slice of the stage table a work unit runs.
 */
public enum WorkUnitKind {

    DOWNLOAD(List.of(PipelineStage.values())),
    EXTRACT_AUDIO(List.of(PipelineStage.EXTRACT_AUDIO, PipelineStage.SEGMENT_AUDIO)),
    GENERATE_TRANSCRIPT(List.of(PipelineStage.RECOGNITION, PipelineStage.ANALYZE_CONTENT)),
    SLICE_VIDEO(List.of(PipelineStage.EXTRACT_SEGMENTS));

    private final List<PipelineStage> stagePlan;

    WorkUnitKind(List<PipelineStage> stagePlan) {
        this.stagePlan = stagePlan;
    }

    public List<PipelineStage> getStagePlan() {
        return stagePlan;
    }

    public PipelineStage firstStage() {
        return stagePlan.get(0);
    }

    /**
     * Stages still to run, starting with {@code from} (inclusive).
     */
    public List<PipelineStage> remainingFrom(PipelineStage from) {
        if (from == null) {
            return stagePlan;
        }
        int index = stagePlan.indexOf(from);
        if (index < 0) {
            throw new IllegalArgumentException("Stage " + from + " is not part of the plan for " + this);
        }
        return stagePlan.subList(index, stagePlan.size());
    }

    /**
     * The stage following {@code stage} in this plan, or null if it is the last one.
     */
    public PipelineStage nextAfter(PipelineStage stage) {
        int index = stagePlan.indexOf(stage);
        if (index < 0 || index + 1 >= stagePlan.size()) {
            return null;
        }
        return stagePlan.get(index + 1);
    }
}
