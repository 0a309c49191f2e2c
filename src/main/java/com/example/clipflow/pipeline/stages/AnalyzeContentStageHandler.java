package com.example.clipflow.pipeline.stages;

import com.example.clipflow.domain.PipelineStage;
import com.example.clipflow.pipeline.StageArtifacts;
import com.example.clipflow.pipeline.StageContext;
import com.example.clipflow.pipeline.StageHandler;
import com.example.clipflow.pipeline.StageOutcome;
import com.example.clipflow.service.BlobStore;
import com.example.clipflow.service.ContentClassifier;
import com.example.clipflow.service.RecognitionClient;
import com.example.clipflow.service.SegmentSuggestion;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches the transcript the recognition callback pointed at and asks the classifier for clips.
 */
@Component
public class AnalyzeContentStageHandler implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeContentStageHandler.class);

    private final RecognitionClient recognitionClient;
    private final ContentClassifier contentClassifier;
    private final BlobStore blobStore;
    private final ObjectMapper objectMapper;

    public AnalyzeContentStageHandler(RecognitionClient recognitionClient,
                                      ContentClassifier contentClassifier,
                                      BlobStore blobStore,
                                      ObjectMapper objectMapper) {
        this.recognitionClient = recognitionClient;
        this.contentClassifier = contentClassifier;
        this.blobStore = blobStore;
        this.objectMapper = objectMapper;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.ANALYZE_CONTENT;
    }

    @Override
    public StageOutcome execute(StageContext context) throws JsonProcessingException {
        String resultRef = context.requireInput(StageArtifacts.RECOGNITION_RESULT);
        String transcript = recognitionClient.fetchResult(resultRef, context.retryPolicy());
        String transcriptRef = blobStore.put(context.blobKey("transcript.srt"),
                new ByteArrayInputStream(transcript.getBytes(StandardCharsets.UTF_8)));
        context.progress().report(30, "Transcript received");

        Map<String, String> options = new HashMap<>();
        String instructions = context.param(StageArtifacts.INSTRUCTIONS);
        if (instructions != null) {
            options.put(ContentClassifier.OPTION_INSTRUCTIONS, instructions);
        }
        List<SegmentSuggestion> suggestions = context.retryPolicy().execute("classify content",
                () -> contentClassifier.classify(transcript, options));
        String suggestionsRef = blobStore.put(context.blobKey("suggestions.json"),
                new ByteArrayInputStream(objectMapper.writeValueAsBytes(suggestions)));
        log.info("[Stage:{}] Work unit {} got {} clip suggestions", stage(), context.unit().getId(), suggestions.size());
        return StageOutcome.completed(Map.of(
                StageArtifacts.TRANSCRIPT, transcriptRef,
                StageArtifacts.SUGGESTIONS, suggestionsRef));
    }
}
