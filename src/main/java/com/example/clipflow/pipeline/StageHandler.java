package com.example.clipflow.pipeline;

import com.example.clipflow.domain.PipelineStage;

/**
 * Executes one pipeline stage for a claimed work unit. Implementations throw on failure; the worker
 * classifies the exception and decides between retry and failure.
 */
public interface StageHandler {

    PipelineStage stage();

    StageOutcome execute(StageContext context) throws Exception;
}
