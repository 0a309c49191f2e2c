package com.example.clipflow.listeners;

import com.example.clipflow.events.ProgressEvent;
import com.example.clipflow.events.WorkUnitChangedEvent;
import com.example.clipflow.service.ProgressBroadcastService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class WorkUnitEventListener {

    private static final Logger log = LoggerFactory.getLogger(WorkUnitEventListener.class);

    private final ProgressBroadcastService broadcastService;

    public WorkUnitEventListener(ProgressBroadcastService broadcastService) {
        this.broadcastService = broadcastService;
    }

    /**
     * Broadcasts a committed transition. Runs on the committing thread so that transitions of one
     * unit reach the channel in commit order.
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleWorkUnitChange(WorkUnitChangedEvent event) {
        ProgressEvent progress = event.getProgress();
        try {
            broadcastService.publishTransition(progress);
            log.debug("Broadcast transition for event: [WorkUnit: {}, Target: {}, Status: {}, Progress: {}]",
                    progress.workUnitId(), progress.targetId(), progress.status(), progress.progress());
        } catch (Exception e) {
            log.error("Unexpected error in WorkUnitEventListener while broadcasting for target {}: {}",
                    progress.targetId(), e.getMessage(), e);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_ROLLBACK)
    public void handleWorkUnitChangeRollback(WorkUnitChangedEvent event) {
        ProgressEvent progress = event.getProgress();
        log.warn("Transaction rolled back for WorkUnitChangedEvent: [WorkUnit: {}, Target: {}, Status: {}]. Nothing broadcast.",
                progress.workUnitId(), progress.targetId(), progress.status());
    }
}
