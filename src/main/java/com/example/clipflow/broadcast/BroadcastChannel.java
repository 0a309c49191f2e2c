package com.example.clipflow.broadcast;

import com.example.clipflow.events.ProgressEvent;

/**
 * Publish/fan-out keyed by channel (the target id). Delivery is at-least-once to listeners
 * registered at publish time; nothing is replayed to later subscribers.
 */
public interface BroadcastChannel {

    void publish(String channel, ProgressEvent event);

    BroadcastSubscription subscribe(String channel, BroadcastListener listener);

    int subscriberCount(String channel);
}
