package com.example.clipflow.pipeline.stages;

import com.example.clipflow.domain.PipelineStage;
import com.example.clipflow.exceptions.PermanentInputException;
import com.example.clipflow.pipeline.StageArtifacts;
import com.example.clipflow.pipeline.StageContext;
import com.example.clipflow.pipeline.StageHandler;
import com.example.clipflow.pipeline.StageOutcome;
import com.example.clipflow.service.MediaOperation;
import com.example.clipflow.service.MediaTool;
import com.example.clipflow.service.MediaToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Downloads the source video (and a separate audio stream when the source provides one).
 */
@Component
public class TransferInStageHandler implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(TransferInStageHandler.class);

    private final MediaTool mediaTool;

    public TransferInStageHandler(MediaTool mediaTool) {
        this.mediaTool = mediaTool;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.TRANSFER_IN;
    }

    @Override
    public StageOutcome execute(StageContext context) {
        String sourceUrl = context.param(StageArtifacts.SOURCE_URL);
        if (sourceUrl == null || sourceUrl.isBlank()) {
            throw new PermanentInputException("Work unit has no '" + StageArtifacts.SOURCE_URL + "' parameter");
        }
        String audioUrl = context.param(StageArtifacts.AUDIO_URL);
        boolean separateAudio = audioUrl != null && !audioUrl.isBlank();

        context.progress().report(1, "Downloading video");
        MediaToolResult video = context.retryPolicy().execute("download video",
                () -> mediaTool.invoke(MediaOperation.DOWNLOAD, sourceUrl, context.blobKey("source.mp4"), Map.of()));
        checkDuration(video, context.settings().maxInputDurationSeconds());

        Map<String, String> artifacts = new HashMap<>();
        artifacts.put(StageArtifacts.VIDEO, video.outputRef());
        if (video.durationSeconds() != null) {
            artifacts.put(StageArtifacts.DURATION_SECONDS, String.valueOf(video.durationSeconds()));
        }

        if (separateAudio) {
            context.progress().report(80, "Downloading audio");
            MediaToolResult audio = context.retryPolicy().execute("download audio",
                    () -> mediaTool.invoke(MediaOperation.DOWNLOAD, audioUrl, context.blobKey("source-audio.mp4"), Map.of()));
            artifacts.put(StageArtifacts.AUDIO_TRACK, audio.outputRef());
        }
        log.info("[Stage:{}] Work unit {} downloaded {} ({}s)", stage(), context.unit().getId(),
                video.outputRef(), video.durationSeconds());
        return StageOutcome.completed(artifacts);
    }

    private static void checkDuration(MediaToolResult video, long maxSeconds) {
        Double duration = video.durationSeconds();
        if (duration != null && duration > maxSeconds) {
            throw new PermanentInputException(String.format(
                    "Video is %.0f minutes long; the limit is %d minutes", duration / 60.0, maxSeconds / 60));
        }
    }
}
