package com.example.clipflow.service.impl;

import com.example.clipflow.broadcast.BroadcastChannel;
import com.example.clipflow.broadcast.ProgressCoalescer;
import com.example.clipflow.config.PipelineSettings;
import com.example.clipflow.events.ProgressEvent;
import com.example.clipflow.service.ProgressBroadcastService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

@Service
public class ProgressBroadcastServiceImpl implements ProgressBroadcastService {

    private static final Logger log = LoggerFactory.getLogger(ProgressBroadcastServiceImpl.class);

    private final BroadcastChannel broadcastChannel;
    private final ProgressCoalescer coalescer;
    private final Clock clock;

    public ProgressBroadcastServiceImpl(BroadcastChannel broadcastChannel, ProgressCoalescer coalescer, Clock clock) {
        this.broadcastChannel = broadcastChannel;
        this.coalescer = coalescer;
        this.clock = clock;
    }

    @Override
    public void publishTransition(ProgressEvent event) {
        coalescer.tryEmit(event.targetId(), event, true, Duration.ZERO, 0.0, clock.instant());
        log.debug("[Broadcast] Transition for target {}: unit={} status={} stage={} progress={}",
                event.targetId(), event.workUnitId(), event.status(), event.stage(), event.progress());
        broadcastChannel.publish(event.targetId(), event);
    }

    @Override
    public boolean offerProgress(ProgressEvent event, PipelineSettings settings) {
        boolean emit = coalescer.tryEmit(event.targetId(), event, false,
                settings.coalesceInterval(), settings.coalesceDelta(), clock.instant());
        if (emit) {
            log.trace("[Broadcast] Progress for target {}: {}", event.targetId(), event.progress());
            broadcastChannel.publish(event.targetId(), event);
        }
        return emit;
    }
}
