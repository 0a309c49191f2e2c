package com.example.clipflow.broadcast;

import com.example.clipflow.events.ProgressEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-channel burst filter for sub-stage progress. A plain progress update passes only when both
 * the minimum interval has elapsed and progress moved by at least the minimum delta since the last
 * emitted event. Transitions, stage or status changes and a new attempt always pass. Within one
 * attempt, progress lower than what was already emitted never passes.
 */
public class ProgressCoalescer {

    private record Emitted(Long workUnitId, int attempt, String stage, String status, double progress, Instant at) {
        static Emitted of(ProgressEvent event, Instant at) {
            return new Emitted(event.workUnitId(), event.attempt(), event.stage(), event.status(), event.progress(), at);
        }
    }

    private final Map<String, Emitted> lastEmitted = new ConcurrentHashMap<>();

    public boolean tryEmit(String channel, ProgressEvent event, boolean transition,
                           Duration minInterval, double minDelta, Instant now) {
        AtomicBoolean accepted = new AtomicBoolean(false);
        lastEmitted.compute(channel, (key, previous) -> {
            if (decide(previous, event, transition, minInterval, minDelta, now)) {
                accepted.set(true);
                return Emitted.of(event, now);
            }
            return previous;
        });
        if (accepted.get() && event.isTerminal()) {
            lastEmitted.remove(channel);
        }
        return accepted.get();
    }

    private static boolean decide(Emitted previous, ProgressEvent event, boolean transition,
                                  Duration minInterval, double minDelta, Instant now) {
        if (previous == null) {
            return true;
        }
        if (!Objects.equals(previous.workUnitId(), event.workUnitId())) {
            return true;
        }
        if (event.attempt() != previous.attempt()) {
            return event.attempt() > previous.attempt();
        }
        if (event.progress() < previous.progress()) {
            return false;
        }
        if (transition
                || !Objects.equals(previous.stage(), event.stage())
                || !Objects.equals(previous.status(), event.status())) {
            return true;
        }
        boolean intervalElapsed = !now.isBefore(previous.at().plus(minInterval));
        boolean movedEnough = event.progress() - previous.progress() >= minDelta;
        return intervalElapsed && movedEnough;
    }

    int trackedChannels() {
        return lastEmitted.size();
    }
}
