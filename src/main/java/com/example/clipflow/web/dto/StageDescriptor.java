package com.example.clipflow.web.dto;

import com.example.clipflow.domain.PipelineStage;

import java.util.List;

public record StageDescriptor(String name, int floor, int ceiling) {

    public static StageDescriptor from(PipelineStage stage) {
        return new StageDescriptor(stage.getStageName(), stage.getProgressFloor(), stage.getProgressCeiling());
    }

    public static List<StageDescriptor> all() {
        return PipelineStage.ordered().stream().map(StageDescriptor::from).toList();
    }
}
