package com.example.clipflow.service;

import com.example.clipflow.exceptions.MediaToolException;

import java.util.Map;

/**
 * Synchronous codec capability. Runs inside the calling worker slot.
 *
 * @param inputRef  blob reference, or an http(s) URL for {@link MediaOperation#DOWNLOAD}
 * @param outputKey blob key for the produced file; ignored by analysis-only operations
 */
public interface MediaTool {

    String OPTION_AUDIO_REF = "audioRef";
    String OPTION_START_MS = "startMs";
    String OPTION_END_MS = "endMs";
    String OPTION_SILENCE_THRESHOLD_DB = "silenceThresholdDb";
    String OPTION_MIN_SILENCE_MS = "minSilenceMs";
    String OPTION_MIN_SEGMENT_MS = "minSegmentMs";
    String OPTION_MAX_SEGMENT_MS = "maxSegmentMs";

    MediaToolResult invoke(MediaOperation operation, String inputRef, String outputKey, Map<String, String> options)
            throws MediaToolException;
}
