package com.example.clipflow.pipeline;

/**
 * Keys used in a work unit's params and artifacts maps.
 */
public final class StageArtifacts {

    // params; an artifact key plus REF_SUFFIX names a param supplying that input directly
    public static final String SOURCE_URL = "sourceUrl";
    public static final String AUDIO_URL = "audioUrl";
    public static final String INSTRUCTIONS = "instructions";
    public static final String REF_SUFFIX = "Ref";

    // artifacts
    public static final String COMPLETED_STAGE = "completedStage";
    public static final String VIDEO = "video";
    public static final String AUDIO_TRACK = "audioTrack";
    public static final String AUDIO = "audio";
    public static final String DURATION_SECONDS = "durationSeconds";
    public static final String SEGMENTS = "segments";
    public static final String CORRELATION_ID = "correlationId";
    public static final String RECOGNITION_RESULT = "recognitionResult";
    public static final String TRANSCRIPT = "transcript";
    public static final String SUGGESTIONS = "suggestions";
    public static final String CLIPS = "clips";

    private StageArtifacts() {
    }
}
