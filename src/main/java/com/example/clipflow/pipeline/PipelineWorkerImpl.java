package com.example.clipflow.pipeline;

import com.example.clipflow.config.AsyncConfig;
import com.example.clipflow.config.PipelineSettings;
import com.example.clipflow.config.SettingsWatcher;
import com.example.clipflow.domain.ErrorClassification;
import com.example.clipflow.domain.PipelineStage;
import com.example.clipflow.domain.WorkUnit;
import com.example.clipflow.domain.WorkUnit.WorkUnitStatus;
import com.example.clipflow.exceptions.ConcurrencyConflictException;
import com.example.clipflow.exceptions.ErrorClassifier;
import com.example.clipflow.repository.WorkUnitRepository;
import com.example.clipflow.service.ProgressBroadcastService;
import com.example.clipflow.service.RetryPolicy;
import com.example.clipflow.service.WorkUnitStatusUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class PipelineWorkerImpl implements PipelineWorker {

    private static final Logger log = LoggerFactory.getLogger(PipelineWorkerImpl.class);

    private static final EnumSet<WorkUnitStatus> CLAIMABLE_STATUSES =
            EnumSet.of(WorkUnitStatus.PENDING, WorkUnitStatus.RETRY, WorkUnitStatus.RUNNING);

    private final WorkUnitRepository workUnitRepository;
    private final WorkUnitStatusUpdater statusUpdater;
    private final ProgressBroadcastService broadcastService;
    private final SettingsWatcher settingsWatcher;
    private final ThreadPoolTaskExecutor workerExecutor;
    private final Clock clock;
    private final Map<PipelineStage, StageHandler> handlers;
    private final boolean enabled;

    public PipelineWorkerImpl(WorkUnitRepository workUnitRepository,
                              WorkUnitStatusUpdater statusUpdater,
                              ProgressBroadcastService broadcastService,
                              SettingsWatcher settingsWatcher,
                              @Qualifier(AsyncConfig.PIPELINE_WORKER_EXECUTOR) ThreadPoolTaskExecutor workerExecutor,
                              Clock clock,
                              List<StageHandler> stageHandlers,
                              @Value("${clipflow.worker.enabled:true}") boolean enabled) {
        this.workUnitRepository = workUnitRepository;
        this.statusUpdater = statusUpdater;
        this.broadcastService = broadcastService;
        this.settingsWatcher = settingsWatcher;
        this.workerExecutor = workerExecutor;
        this.clock = clock;
        this.enabled = enabled;
        this.handlers = new EnumMap<>(PipelineStage.class);
        for (StageHandler handler : stageHandlers) {
            if (handlers.put(handler.stage(), handler) != null) {
                throw new IllegalStateException("Two handlers registered for stage " + handler.stage());
            }
        }
        for (PipelineStage stage : PipelineStage.values()) {
            if (!handlers.containsKey(stage)) {
                throw new IllegalStateException("No handler registered for stage " + stage);
            }
        }
    }

    @Scheduled(fixedDelayString = "${clipflow.worker.poll-interval-ms:1000}")
    public void scheduledPoll() {
        if (enabled) {
            pollQueue();
        }
    }

    @Override
    public int pollQueue() {
        int freeSlots = workerExecutor.getMaxPoolSize() - workerExecutor.getActiveCount() - workerExecutor.getQueueSize();
        if (freeSlots <= 0) {
            log.trace("[Worker] All {} slots busy", workerExecutor.getMaxPoolSize());
            return 0;
        }
        List<Long> candidates = workUnitRepository.findClaimableIds(CLAIMABLE_STATUSES, clock.instant(),
                PageRequest.of(0, freeSlots));
        int submitted = 0;
        for (Long workUnitId : candidates) {
            try {
                workerExecutor.execute(() -> claimAndRun(workUnitId));
                submitted++;
            } catch (TaskRejectedException e) {
                log.debug("[Worker] Pool full; work unit {} stays queued", workUnitId);
                break;
            }
        }
        if (submitted > 0) {
            log.debug("[Worker] Handed {} work units to the pool", submitted);
        }
        return submitted;
    }

    @Override
    public boolean claimAndRun(Long workUnitId) {
        Optional<String> lease;
        try {
            lease = statusUpdater.claim(workUnitId);
        } catch (Exception e) {
            log.error("[Worker] Claim of work unit {} failed", workUnitId, e);
            return false;
        }
        if (lease.isEmpty()) {
            return false;
        }
        runAttempt(workUnitId, lease.get());
        return true;
    }

    /**
     * Runs the stages of one claimed attempt. Settings are read once so a refresh never changes
     * values mid-attempt.
     */
    void runAttempt(Long workUnitId, String leaseToken) {
        PipelineSettings settings = settingsWatcher.current();
        RetryPolicy retryPolicy = RetryPolicy.from(settings);
        int attempt = 0;
        try {
            WorkUnit unit = reload(workUnitId);
            attempt = unit.getAttemptCount();
            PipelineStage start = resolveStart(unit);
            if (start == null) {
                statusUpdater.succeed(workUnitId, leaseToken);
                return;
            }
            log.info("[Worker] Running work unit {} attempt {} from stage {}", workUnitId, attempt, start);
            for (PipelineStage stage : unit.getKind().remainingFrom(start)) {
                WorkUnit current = reload(workUnitId);
                if (!current.isHeldBy(leaseToken)) {
                    log.info("[Worker] Lease on work unit {} revoked (status: {}). Stopping before {}.",
                            workUnitId, current.getStatus(), stage);
                    return;
                }
                WorkUnit entered = statusUpdater.advanceStage(workUnitId, leaseToken, stage);
                ProgressReporter reporter = new ProgressReporter(statusUpdater, broadcastService, settings, clock,
                        entered, stage, leaseToken);
                StageOutcome outcome = handlers.get(stage)
                        .execute(new StageContext(entered, leaseToken, settings, retryPolicy, reporter));
                if (outcome.isParked()) {
                    statusUpdater.park(workUnitId, leaseToken, outcome.correlationId());
                    log.info("[Worker] Work unit {} parked at {} on correlation {}",
                            workUnitId, stage, outcome.correlationId());
                    return;
                }
                statusUpdater.completeStage(workUnitId, leaseToken, stage, outcome.artifacts());
            }
            statusUpdater.succeed(workUnitId, leaseToken);
            log.info("[Worker] Work unit {} completed", workUnitId);
        } catch (ConcurrencyConflictException e) {
            log.info("[Worker] Work unit {} was taken over or cancelled: {}", workUnitId, e.getMessage());
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            handleFailure(workUnitId, leaseToken, attempt, e, retryPolicy);
        } catch (Error e) {
            handleFailure(workUnitId, leaseToken, attempt, e, retryPolicy);
            throw e;
        }
    }

    /**
     * Stage to start from: the one after the last completed stage, or the current stage when the
     * attempt has not completed any. Null when nothing is left.
     */
    static PipelineStage resolveStart(WorkUnit unit) {
        String completed = unit.getArtifacts().get(StageArtifacts.COMPLETED_STAGE);
        if (completed != null) {
            return unit.getKind().nextAfter(PipelineStage.valueOf(completed));
        }
        PipelineStage current = unit.getCurrentStage();
        return current != null ? current : unit.getKind().firstStage();
    }

    private void handleFailure(Long workUnitId, String leaseToken, int attempt, Throwable error, RetryPolicy retryPolicy) {
        ErrorClassification classification = ErrorClassifier.classify(error);
        String message = ErrorClassifier.describe(error);
        try {
            if (retryPolicy.shouldRetry(classification, attempt)) {
                Duration backoff = retryPolicy.backoffFor(attempt);
                log.warn("[Worker] Work unit {} attempt {} failed ({}); retrying in {}ms: {}",
                        workUnitId, attempt, classification, backoff.toMillis(), error.getMessage());
                statusUpdater.scheduleRetry(workUnitId, leaseToken, message, backoff);
            } else {
                log.error("[Worker] Work unit {} attempt {} failed ({})", workUnitId, attempt, classification, error);
                statusUpdater.fail(workUnitId, leaseToken, message,
                        classification == ErrorClassification.CONFLICT ? ErrorClassification.PERMANENT : classification);
            }
        } catch (ConcurrencyConflictException conflict) {
            log.info("[Worker] Work unit {} no longer held; failure of attempt {} not recorded", workUnitId, attempt);
        } catch (Exception updateEx) {
            log.error("[Worker] CRITICAL: Failed to record failure for work unit {}", workUnitId, updateEx);
        }
    }

    private WorkUnit reload(Long workUnitId) {
        return workUnitRepository.findById(workUnitId)
                .orElseThrow(() -> new ConcurrencyConflictException("Work unit " + workUnitId + " no longer exists"));
    }
}
