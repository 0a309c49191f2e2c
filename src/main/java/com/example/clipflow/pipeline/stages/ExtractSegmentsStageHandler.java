package com.example.clipflow.pipeline.stages;

import com.example.clipflow.domain.PipelineStage;
import com.example.clipflow.exceptions.PermanentInputException;
import com.example.clipflow.pipeline.StageArtifacts;
import com.example.clipflow.pipeline.StageContext;
import com.example.clipflow.pipeline.StageHandler;
import com.example.clipflow.pipeline.StageOutcome;
import com.example.clipflow.service.BlobStore;
import com.example.clipflow.service.MediaOperation;
import com.example.clipflow.service.MediaTool;
import com.example.clipflow.service.MediaToolResult;
import com.example.clipflow.service.SegmentSuggestion;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Cuts one clip per suggestion out of the video.
 */
@Component
public class ExtractSegmentsStageHandler implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(ExtractSegmentsStageHandler.class);
    private static final TypeReference<List<SegmentSuggestion>> SUGGESTION_LIST = new TypeReference<>() {
    };

    private final MediaTool mediaTool;
    private final BlobStore blobStore;
    private final ObjectMapper objectMapper;

    public ExtractSegmentsStageHandler(MediaTool mediaTool, BlobStore blobStore, ObjectMapper objectMapper) {
        this.mediaTool = mediaTool;
        this.blobStore = blobStore;
        this.objectMapper = objectMapper;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.EXTRACT_SEGMENTS;
    }

    @Override
    public StageOutcome execute(StageContext context) throws IOException {
        String video = context.requireInput(StageArtifacts.VIDEO);
        List<SegmentSuggestion> suggestions = readSuggestions(context.requireInput(StageArtifacts.SUGGESTIONS));

        List<String> clips = new ArrayList<>(suggestions.size());
        for (int i = 0; i < suggestions.size(); i++) {
            SegmentSuggestion suggestion = suggestions.get(i);
            Map<String, String> options = Map.of(
                    MediaTool.OPTION_START_MS, String.valueOf(suggestion.startMs()),
                    MediaTool.OPTION_END_MS, String.valueOf(suggestion.endMs()));
            String key = context.blobKey(String.format("clips/clip-%03d.mp4", i + 1));
            MediaToolResult clip = context.retryPolicy().execute("cut clip " + (i + 1),
                    () -> mediaTool.invoke(MediaOperation.CUT, video, key, options));
            clips.add(clip.outputRef());
            context.progress().report((i + 1) * 100.0 / suggestions.size(),
                    "Extracted clip " + (i + 1) + " of " + suggestions.size());
        }
        String clipsRef = blobStore.put(context.blobKey("clips.json"),
                new ByteArrayInputStream(objectMapper.writeValueAsBytes(clips)));
        log.info("[Stage:{}] Work unit {} produced {} clips", stage(), context.unit().getId(), clips.size());
        return StageOutcome.completed(Map.of(StageArtifacts.CLIPS, clipsRef));
    }

    private List<SegmentSuggestion> readSuggestions(String ref) throws IOException {
        try (InputStream in = blobStore.open(ref)) {
            List<SegmentSuggestion> suggestions = objectMapper.readValue(in, SUGGESTION_LIST);
            if (suggestions == null) {
                throw new PermanentInputException("Suggestion list is empty: " + ref);
            }
            return suggestions;
        }
    }
}
