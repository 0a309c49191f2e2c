package com.example.clipflow.pipeline.stages;

import com.example.clipflow.domain.PipelineStage;
import com.example.clipflow.pipeline.StageArtifacts;
import com.example.clipflow.pipeline.StageContext;
import com.example.clipflow.pipeline.StageHandler;
import com.example.clipflow.pipeline.StageOutcome;
import com.example.clipflow.service.MediaOperation;
import com.example.clipflow.service.MediaTool;
import com.example.clipflow.service.MediaToolResult;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Produces the mono 16 kHz WAV the recognition service expects.
 */
@Component
public class ExtractAudioStageHandler implements StageHandler {

    private final MediaTool mediaTool;

    public ExtractAudioStageHandler(MediaTool mediaTool) {
        this.mediaTool = mediaTool;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.EXTRACT_AUDIO;
    }

    @Override
    public StageOutcome execute(StageContext context) {
        String video = context.requireInput(StageArtifacts.VIDEO);
        MediaToolResult audio = context.retryPolicy().execute("extract audio",
                () -> mediaTool.invoke(MediaOperation.EXTRACT_AUDIO, video, context.blobKey("audio.wav"), Map.of()));
        Map<String, String> artifacts = new HashMap<>();
        artifacts.put(StageArtifacts.AUDIO, audio.outputRef());
        if (audio.durationSeconds() != null && context.artifact(StageArtifacts.DURATION_SECONDS) == null) {
            artifacts.put(StageArtifacts.DURATION_SECONDS, String.valueOf(audio.durationSeconds()));
        }
        return StageOutcome.completed(artifacts);
    }
}
