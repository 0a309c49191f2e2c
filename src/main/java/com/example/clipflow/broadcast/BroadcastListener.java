package com.example.clipflow.broadcast;

import com.example.clipflow.events.ProgressEvent;

@FunctionalInterface
public interface BroadcastListener {
    void onEvent(ProgressEvent event);
}
