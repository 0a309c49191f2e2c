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
 * Muxes a separately downloaded audio stream into the video. Without one the stage is a no-op.
 */
@Component
public class MergeStageHandler implements StageHandler {

    private final MediaTool mediaTool;

    public MergeStageHandler(MediaTool mediaTool) {
        this.mediaTool = mediaTool;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.MERGE;
    }

    @Override
    public StageOutcome execute(StageContext context) {
        String audioTrack = context.artifact(StageArtifacts.AUDIO_TRACK);
        if (audioTrack == null) {
            return StageOutcome.completed(Map.of());
        }
        String video = context.requireInput(StageArtifacts.VIDEO);
        Map<String, String> options = new HashMap<>();
        options.put(MediaTool.OPTION_AUDIO_REF, audioTrack);
        MediaToolResult merged = context.retryPolicy().execute("merge audio",
                () -> mediaTool.invoke(MediaOperation.MERGE, video, context.blobKey("merged.mp4"), options));
        return StageOutcome.completed(Map.of(StageArtifacts.VIDEO, merged.outputRef()));
    }
}
