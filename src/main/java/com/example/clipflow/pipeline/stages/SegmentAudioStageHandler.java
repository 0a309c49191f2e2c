package com.example.clipflow.pipeline.stages;

import com.example.clipflow.config.PipelineSettings;
import com.example.clipflow.domain.PipelineStage;
import com.example.clipflow.exceptions.MediaToolException;
import com.example.clipflow.domain.ErrorClassification;
import com.example.clipflow.pipeline.AudioSegment;
import com.example.clipflow.pipeline.StageArtifacts;
import com.example.clipflow.pipeline.StageContext;
import com.example.clipflow.pipeline.StageHandler;
import com.example.clipflow.pipeline.StageOutcome;
import com.example.clipflow.service.BlobStore;
import com.example.clipflow.service.MediaOperation;
import com.example.clipflow.service.MediaTool;
import com.example.clipflow.service.MediaToolResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Splits the extracted audio on silence into recognition-sized segments and stores the plan as JSON.
 */
@Component
public class SegmentAudioStageHandler implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(SegmentAudioStageHandler.class);

    private final MediaTool mediaTool;
    private final BlobStore blobStore;
    private final ObjectMapper objectMapper;

    public SegmentAudioStageHandler(MediaTool mediaTool, BlobStore blobStore, ObjectMapper objectMapper) {
        this.mediaTool = mediaTool;
        this.blobStore = blobStore;
        this.objectMapper = objectMapper;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.SEGMENT_AUDIO;
    }

    @Override
    public StageOutcome execute(StageContext context) throws JsonProcessingException {
        String audio = context.requireInput(StageArtifacts.AUDIO);
        PipelineSettings settings = context.settings();
        Map<String, String> options = Map.of(
                MediaTool.OPTION_SILENCE_THRESHOLD_DB, String.valueOf(settings.silenceThresholdDb()),
                MediaTool.OPTION_MIN_SILENCE_MS, String.valueOf(settings.minSilenceMs()),
                MediaTool.OPTION_MIN_SEGMENT_MS, String.valueOf(settings.minSegmentMs()),
                MediaTool.OPTION_MAX_SEGMENT_MS, String.valueOf(settings.maxSegmentMs()));
        MediaToolResult result = context.retryPolicy().execute("detect segments",
                () -> mediaTool.invoke(MediaOperation.DETECT_SEGMENTS, audio, null, options));
        List<AudioSegment> segments = segmentsOf(result);
        context.progress().report(80, "Detected " + segments.size() + " segments");

        byte[] json = objectMapper.writeValueAsBytes(segments);
        String ref = blobStore.put(context.blobKey("segments.json"), new ByteArrayInputStream(json));
        log.info("[Stage:{}] Work unit {} split into {} segments", stage(), context.unit().getId(), segments.size());
        return StageOutcome.completed(Map.of(StageArtifacts.SEGMENTS, ref));
    }

    private static List<AudioSegment> segmentsOf(MediaToolResult result) {
        Object raw = result.metrics().get(MediaToolResult.SEGMENTS);
        if (!(raw instanceof List<?> list)) {
            throw new MediaToolException(ErrorClassification.PERMANENT, "Segment detection returned no segments");
        }
        List<AudioSegment> segments = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item instanceof AudioSegment segment) {
                segments.add(segment);
            }
        }
        return segments;
    }
}
