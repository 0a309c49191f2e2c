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

import java.util.Map;

@Component
public class ConvertStageHandler implements StageHandler {

    private final MediaTool mediaTool;

    public ConvertStageHandler(MediaTool mediaTool) {
        this.mediaTool = mediaTool;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.CONVERT;
    }

    @Override
    public StageOutcome execute(StageContext context) {
        String video = context.requireInput(StageArtifacts.VIDEO);
        MediaToolResult converted = context.retryPolicy().execute("convert video",
                () -> mediaTool.invoke(MediaOperation.CONVERT, video, context.blobKey("video.mp4"), Map.of()));
        return StageOutcome.completed(Map.of(StageArtifacts.VIDEO, converted.outputRef()));
    }
}
