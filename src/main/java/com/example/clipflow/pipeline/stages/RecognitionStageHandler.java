package com.example.clipflow.pipeline.stages;

import com.example.clipflow.config.PipelineSettings;
import com.example.clipflow.domain.CallbackCorrelation;
import com.example.clipflow.domain.PipelineStage;
import com.example.clipflow.pipeline.StageArtifacts;
import com.example.clipflow.pipeline.StageContext;
import com.example.clipflow.pipeline.StageHandler;
import com.example.clipflow.pipeline.StageOutcome;
import com.example.clipflow.service.RecognitionClient;
import com.example.clipflow.service.RecognitionCorrelationService;
import com.example.clipflow.service.RecognitionRequest;
import com.example.clipflow.service.RecognitionSubmission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Submits the audio for recognition and parks the unit. The worker slot is released as soon as the
 * upload finishes; the result comes back through the callback receiver and the result poller.
 */
@Component
public class RecognitionStageHandler implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(RecognitionStageHandler.class);

    private final RecognitionClient recognitionClient;
    private final RecognitionCorrelationService correlationService;

    public RecognitionStageHandler(RecognitionClient recognitionClient,
                                   RecognitionCorrelationService correlationService) {
        this.recognitionClient = recognitionClient;
        this.correlationService = correlationService;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.RECOGNITION;
    }

    @Override
    public StageOutcome execute(StageContext context) {
        String audio = context.requireInput(StageArtifacts.AUDIO);
        PipelineSettings settings = context.settings();
        Long workUnitId = context.unit().getId();

        CallbackCorrelation correlation = correlationService.open(workUnitId, settings.recognitionExpiry());
        String correlationId = correlation.getCorrelationId();
        try {
            RecognitionRequest request = new RecognitionRequest(correlationId, audio,
                    "work-unit-" + workUnitId + ".wav",
                    settings.recognitionLanguage(), settings.recognitionModel(), settings.uploadChunkSize());
            RecognitionSubmission submission = recognitionClient.submit(request, context.retryPolicy(),
                    (uploaded, total) -> context.progress().report(uploaded * 90.0 / total, "Uploading audio for recognition"));
            correlationService.recordRemoteTask(correlationId, submission.remoteTaskId());
            log.info("[Stage:{}] Work unit {} submitted as remote task {}; parking on {}",
                    stage(), workUnitId, submission.remoteTaskId(), correlationId);
            return StageOutcome.parked(correlationId);
        } catch (RuntimeException e) {
            correlationService.discard(correlationId);
            throw e;
        }
    }
}
