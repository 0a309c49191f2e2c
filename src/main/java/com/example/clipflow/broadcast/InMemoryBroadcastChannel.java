package com.example.clipflow.broadcast;

import com.example.clipflow.events.ProgressEvent;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local fan-out. Also used as the local delivery stage of {@link RedisBroadcastChannel}.
 */
public class InMemoryBroadcastChannel implements BroadcastChannel {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBroadcastChannel.class);
    private final Map<String, CopyOnWriteArrayList<BroadcastListener>> channelListeners = new ConcurrentHashMap<>();

    @Override
    public BroadcastSubscription subscribe(String channel, BroadcastListener listener) {
        if (channel == null || listener == null) {
            throw new IllegalArgumentException("Channel and listener are required");
        }
        CopyOnWriteArrayList<BroadcastListener> listeners = channelListeners.compute(channel, (key, existing) -> {
            CopyOnWriteArrayList<BroadcastListener> list = existing != null ? existing : new CopyOnWriteArrayList<>();
            list.add(listener);
            return list;
        });
        log.debug("Added listener for channel: {}. Total listeners: {}", channel, listeners.size());
        return () -> removeListener(channel, listener);
    }

    @Override
    public void publish(String channel, ProgressEvent event) {
        List<BroadcastListener> listeners = channelListeners.get(channel);
        if (listeners == null || listeners.isEmpty()) {
            log.trace("No listeners for channel {} when publishing {}", channel, event.status());
            return;
        }
        for (BroadcastListener listener : List.copyOf(listeners)) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.error("Listener failed for channel {}. Removing listener.", channel, e);
                removeListener(channel, listener);
            }
        }
    }

    @Override
    public int subscriberCount(String channel) {
        List<BroadcastListener> listeners = channelListeners.get(channel);
        return listeners == null ? 0 : listeners.size();
    }

    void removeListener(String channel, BroadcastListener listener) {
        channelListeners.computeIfPresent(channel, (key, listeners) -> {
            if (listeners.remove(listener)) {
                log.debug("Removed listener for channel: {}. Remaining: {}", channel, listeners.size());
            }
            return listeners.isEmpty() ? null : listeners;
        });
    }

    @PreDestroy
    public void shutdown() {
        int channels = channelListeners.size();
        channelListeners.clear();
        log.info("Broadcast channel shut down. Dropped listeners on {} channels.", channels);
    }
}
