package com.example.clipflow.gateway;

import com.example.clipflow.broadcast.BroadcastSubscription;
import com.example.clipflow.events.ProgressEvent;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Per-connection state: the user, the open subscriptions and the newest progress seen per target.
 * Lives only as long as the socket.
 */
class GatewayConnection {

    private record Seen(Long workUnitId, int attempt, double progress) {
    }

    /**
     * Progress stream of one subscribed target. Until the bootstrap is sent, events are held in
     * {@code pending}; afterwards {@code pending} is null and events go straight out.
     */
    private static final class TargetStream {

        private Seen seen;
        private List<ProgressEvent> pending = new ArrayList<>();

        synchronized void offer(ProgressEvent event, Consumer<ProgressEvent> sender) {
            if (pending != null) {
                pending.add(event);
            } else if (acceptIfNewer(event)) {
                sender.accept(event);
            }
        }

        synchronized void bootstrap(ProgressEvent snapshot, Runnable sendBootstrap, Consumer<ProgressEvent> sender) {
            if (pending == null) {
                return;
            }
            if (snapshot != null) {
                acceptIfNewer(snapshot);
            }
            sendBootstrap.run();
            List<ProgressEvent> held = pending;
            pending = null;
            for (ProgressEvent event : held) {
                if (acceptIfNewer(event)) {
                    sender.accept(event);
                }
            }
        }

        /**
         * @return false if the event is older than what was already sent for the same work unit attempt
         */
        private boolean acceptIfNewer(ProgressEvent event) {
            if (seen != null && seen.workUnitId().equals(event.workUnitId())
                    && (event.attempt() < seen.attempt()
                    || (event.attempt() == seen.attempt() && event.progress() < seen.progress()))) {
                return false;
            }
            seen = new Seen(event.workUnitId(), event.attempt(), event.progress());
            return true;
        }
    }

    private final WebSocketSession session;
    private final String username;
    private final Map<String, BroadcastSubscription> subscriptions = new ConcurrentHashMap<>();
    private final Map<String, TargetStream> streams = new ConcurrentHashMap<>();
    private volatile Instant lastActivity;

    GatewayConnection(WebSocketSession session, String username, Instant now) {
        this.session = session;
        this.username = username;
        this.lastActivity = now;
    }

    WebSocketSession session() {
        return session;
    }

    String username() {
        return username;
    }

    Instant lastActivity() {
        return lastActivity;
    }

    void touch(Instant now) {
        this.lastActivity = now;
    }

    /**
     * Starts holding back events for {@code targetId} until {@link #completeBootstrap} runs.
     */
    void openStream(String targetId) {
        streams.put(targetId, new TargetStream());
    }

    void addSubscription(String targetId, BroadcastSubscription subscription) {
        BroadcastSubscription previous = subscriptions.put(targetId, subscription);
        if (previous != null) {
            previous.cancel();
        }
    }

    boolean removeSubscription(String targetId) {
        BroadcastSubscription subscription = subscriptions.remove(targetId);
        streams.remove(targetId);
        if (subscription == null) {
            return false;
        }
        subscription.cancel();
        return true;
    }

    int subscriptionCount() {
        return subscriptions.size();
    }

    void cancelAll() {
        List.copyOf(subscriptions.keySet()).forEach(this::removeSubscription);
    }

    /**
     * Hands {@code event} to {@code sender} unless it is stale. Held back while the target's bootstrap
     * is outstanding; dropped if the target is not subscribed.
     */
    void offer(ProgressEvent event, Consumer<ProgressEvent> sender) {
        TargetStream stream = streams.get(event.targetId());
        if (stream != null) {
            stream.offer(event, sender);
        }
    }

    /**
     * Sends the bootstrap for {@code targetId}, then whatever was held back that is newer than
     * {@code snapshot}. No-op if the target was unsubscribed in the meantime.
     *
     * @param snapshot the state the bootstrap carries, or null if the target has no work unit
     */
    void completeBootstrap(String targetId, ProgressEvent snapshot, Runnable sendBootstrap,
                           Consumer<ProgressEvent> sender) {
        TargetStream stream = streams.get(targetId);
        if (stream != null) {
            stream.bootstrap(snapshot, sendBootstrap, sender);
        }
    }
}
