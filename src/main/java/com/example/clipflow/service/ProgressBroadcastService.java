package com.example.clipflow.service;

import com.example.clipflow.config.PipelineSettings;
import com.example.clipflow.events.ProgressEvent;

public interface ProgressBroadcastService {

    /**
     * Publishes a durable transition. Never coalesced.
     */
    void publishTransition(ProgressEvent event);

    /**
     * Offers a sub-stage progress update. Returns true if it was published, false if it was
     * coalesced away.
     */
    boolean offerProgress(ProgressEvent event, PipelineSettings settings);
}
