package com.example.clipflow.events;

import org.springframework.context.ApplicationEvent;

/**
 * Published inside the transaction that persisted a work unit transition.
 */
public class WorkUnitChangedEvent extends ApplicationEvent {

    private final ProgressEvent progress;

    public WorkUnitChangedEvent(Object source, ProgressEvent progress) {
        super(source);
        if (progress == null || progress.targetId() == null || progress.workUnitId() == null) {
            throw new IllegalArgumentException("Event details (targetId, workUnitId) cannot be null");
        }
        this.progress = progress;
    }

    public ProgressEvent getProgress() {
        return progress;
    }
}
