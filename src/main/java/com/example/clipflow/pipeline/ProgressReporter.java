package com.example.clipflow.pipeline;

import com.example.clipflow.config.PipelineSettings;
import com.example.clipflow.domain.PipelineStage;
import com.example.clipflow.domain.WorkUnit;
import com.example.clipflow.events.ProgressEvent;
import com.example.clipflow.service.ProgressBroadcastService;
import com.example.clipflow.service.WorkUnitStatusUpdater;

import java.time.Clock;

/**
 * Turns stage-local percentages into global progress. Updates the coalescer lets through are
 * broadcast and persisted; the rest are dropped.
 */
public class ProgressReporter {

    private final WorkUnitStatusUpdater statusUpdater;
    private final ProgressBroadcastService broadcastService;
    private final PipelineSettings settings;
    private final Clock clock;
    private final WorkUnit unit;
    private final PipelineStage stage;
    private final String leaseToken;
    private double lastReported;

    public ProgressReporter(WorkUnitStatusUpdater statusUpdater, ProgressBroadcastService broadcastService,
                            PipelineSettings settings, Clock clock, WorkUnit unit, PipelineStage stage,
                            String leaseToken) {
        this.statusUpdater = statusUpdater;
        this.broadcastService = broadcastService;
        this.settings = settings;
        this.clock = clock;
        this.unit = unit;
        this.stage = stage;
        this.leaseToken = leaseToken;
        this.lastReported = unit.getProgress();
    }

    /**
     * @param localPercent 0-100 within the current stage
     * @return true if the update was published
     */
    public synchronized boolean report(double localPercent, String message) {
        double global = stage.globalProgress(localPercent);
        if (global <= lastReported) {
            return false;
        }
        ProgressEvent event = ProgressEvent.of(unit, clock.instant()).withProgress(global, message, clock.instant());
        if (!broadcastService.offerProgress(event, settings)) {
            return false;
        }
        lastReported = global;
        statusUpdater.recordProgress(unit.getId(), leaseToken, global, message);
        return true;
    }

    public double lastReported() {
        return lastReported;
    }
}
