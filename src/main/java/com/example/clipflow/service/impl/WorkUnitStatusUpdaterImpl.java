package com.example.clipflow.service.impl;

import com.example.clipflow.domain.CallbackCorrelation.CorrelationStatus;
import com.example.clipflow.domain.ErrorClassification;
import com.example.clipflow.domain.PipelineStage;
import com.example.clipflow.domain.WorkUnit;
import com.example.clipflow.domain.WorkUnit.WorkUnitStatus;
import com.example.clipflow.domain.WorkUnitKind;
import com.example.clipflow.domain.WorkUnitLogEntry;
import com.example.clipflow.events.ProgressEvent;
import com.example.clipflow.events.WorkUnitChangedEvent;
import com.example.clipflow.exceptions.ConcurrencyConflictException;
import com.example.clipflow.exceptions.WorkUnitConflictException;
import com.example.clipflow.exceptions.WorkUnitNotFoundException;
import com.example.clipflow.pipeline.StageArtifacts;
import com.example.clipflow.repository.CallbackCorrelationRepository;
import com.example.clipflow.repository.WorkUnitLogRepository;
import com.example.clipflow.repository.WorkUnitRepository;
import com.example.clipflow.service.WorkUnitStatusUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

@Service
public class WorkUnitStatusUpdaterImpl implements WorkUnitStatusUpdater {

    private static final Logger log = LoggerFactory.getLogger(WorkUnitStatusUpdaterImpl.class);

    private static final EnumSet<WorkUnitStatus> CLAIMABLE_STATUSES =
            EnumSet.of(WorkUnitStatus.PENDING, WorkUnitStatus.RETRY, WorkUnitStatus.RUNNING);

    private final WorkUnitRepository workUnitRepository;
    private final WorkUnitLogRepository logRepository;
    private final CallbackCorrelationRepository correlationRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final int maxLogEntries;

    public WorkUnitStatusUpdaterImpl(WorkUnitRepository workUnitRepository,
                                     WorkUnitLogRepository logRepository,
                                     CallbackCorrelationRepository correlationRepository,
                                     ApplicationEventPublisher eventPublisher,
                                     Clock clock,
                                     @Value("${clipflow.worklog.max-entries:50}") int maxLogEntries) {
        this.workUnitRepository = workUnitRepository;
        this.logRepository = logRepository;
        this.correlationRepository = correlationRepository;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.maxLogEntries = Math.max(1, maxLogEntries);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public WorkUnit createLive(String ownerId, String targetId, WorkUnitKind kind, Map<String, String> params) {
        String txName = TransactionSynchronizationManager.getCurrentTransactionName();
        WorkUnit unit = workUnitRepository.saveAndFlush(new WorkUnit(ownerId, targetId, kind, params, clock.instant()));
        log.info("[StatusUpdater][TX:{}] Created work unit {} ({} for target {}, owner {})",
                txName, unit.getId(), kind, targetId, ownerId);
        appendLog(unit, null);
        publishEvent(unit);
        return unit;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<String> claim(Long workUnitId) {
        String txName = TransactionSynchronizationManager.getCurrentTransactionName();
        String token = UUID.randomUUID().toString();
        int updated = workUnitRepository.claim(workUnitId, token, WorkUnitStatus.RUNNING, CLAIMABLE_STATUSES,
                clock.instant());
        if (updated == 0) {
            log.debug("[StatusUpdater][TX:{}] Work unit {} was claimed elsewhere or is no longer claimable.",
                    txName, workUnitId);
            return Optional.empty();
        }
        WorkUnit unit = findOrThrow(workUnitId);
        log.info("[StatusUpdater][TX:{}] Claimed work unit {} (attempt {}, stage {})",
                txName, workUnitId, unit.getAttemptCount(), unit.getCurrentStage());
        appendLog(unit, null);
        publishEvent(unit);
        return Optional.of(token);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public WorkUnit advanceStage(Long workUnitId, String leaseToken, PipelineStage stage) {
        return mutateHeld(workUnitId, leaseToken, "advance to " + stage, true, unit -> {
            if (!unit.getKind().getStagePlan().contains(stage)) {
                throw new IllegalArgumentException("Stage " + stage + " is not part of the plan for " + unit.getKind());
            }
            if (stage.precedes(unit.getCurrentStage())) {
                throw new IllegalStateException("Cannot move work unit " + workUnitId + " back from "
                        + unit.getCurrentStage() + " to " + stage);
            }
            unit.setCurrentStage(stage);
            unit.setProgress(Math.max(unit.getProgress(), stage.getProgressFloor()));
            unit.setMessage("Running " + stage.getStageName());
        });
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordProgress(Long workUnitId, String leaseToken, double progress, String message) {
        mutateHeld(workUnitId, leaseToken, "record progress", false, unit -> {
            if (progress > unit.getProgress()) {
                unit.setProgress(progress);
            }
            if (message != null) {
                unit.setMessage(message);
            }
        });
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public WorkUnit completeStage(Long workUnitId, String leaseToken, PipelineStage stage,
                                  Map<String, String> artifacts) {
        return mutateHeld(workUnitId, leaseToken, "complete " + stage, true, unit -> {
            if (unit.getCurrentStage() != stage) {
                throw new IllegalStateException("Work unit " + workUnitId + " is at " + unit.getCurrentStage()
                        + ", not " + stage);
            }
            unit.putArtifacts(artifacts);
            unit.putArtifacts(Map.of(StageArtifacts.COMPLETED_STAGE, stage.name()));
            unit.setProgress(Math.max(unit.getProgress(), stage.getProgressCeiling()));
            unit.setMessage("Finished " + stage.getStageName());
        });
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void park(Long workUnitId, String leaseToken, String correlationId) {
        mutateHeld(workUnitId, leaseToken, "park", true, unit -> {
            unit.putArtifacts(Map.of(StageArtifacts.CORRELATION_ID, correlationId));
            unit.setLeaseToken(null);
            unit.setAwaitingCallback(true);
            unit.setMessage("Waiting for recognition result");
        });
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void succeed(Long workUnitId, String leaseToken) {
        mutateHeld(workUnitId, leaseToken, "succeed", true, unit -> {
            List<PipelineStage> plan = unit.getKind().getStagePlan();
            unit.setCurrentStage(plan.get(plan.size() - 1));
            unit.setProgress(100.0);
            unit.finish(WorkUnitStatus.SUCCESS, "Completed", null, clock.instant());
        });
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void fail(Long workUnitId, String leaseToken, String message, ErrorClassification classification) {
        mutateHeld(workUnitId, leaseToken, "fail", true,
                unit -> unit.finish(WorkUnitStatus.FAILURE, message, classification, clock.instant()));
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void scheduleRetry(Long workUnitId, String leaseToken, String message, Duration backoff) {
        mutateHeld(workUnitId, leaseToken, "schedule retry", true, unit -> {
            resetForNewAttempt(unit);
            unit.setErrorClassification(ErrorClassification.TRANSIENT);
            unit.setNextAttemptAt(clock.instant().plus(backoff));
            unit.setMessage("Retrying after error: " + message);
        });
    }

    @Override
    @Transactional
    public boolean resumeFromCallback(Long workUnitId, String correlationId, Map<String, String> artifacts) {
        String txName = TransactionSynchronizationManager.getCurrentTransactionName();
        WorkUnit unit = workUnitRepository.findById(workUnitId).orElse(null);
        if (!isParkedOn(unit, correlationId)) {
            log.warn("[StatusUpdater][TX:{}] Work unit {} is not parked on {} (status: {}). Recognition result dropped.",
                    txName, workUnitId, correlationId, unit != null ? unit.getStatus() : "missing");
            return false;
        }
        WorkUnitStatus oldStatus = unit.getStatus();
        unit.putArtifacts(artifacts);
        unit.putArtifacts(Map.of(StageArtifacts.COMPLETED_STAGE, PipelineStage.RECOGNITION.name()));
        unit.setAwaitingCallback(false);
        unit.setProgress(Math.max(unit.getProgress(), PipelineStage.RECOGNITION.getProgressCeiling()));
        unit.setMessage("Recognition result received");
        unit.setUpdatedAt(clock.instant());
        workUnitRepository.saveAndFlush(unit);
        log.info("[StatusUpdater][TX:{}] Resumed work unit {} after recognition callback", txName, workUnitId);
        appendLog(unit, oldStatus);
        publishEvent(unit);
        return true;
    }

    @Override
    @Transactional
    public boolean failParked(Long workUnitId, String correlationId, String message,
                              ErrorClassification classification) {
        String txName = TransactionSynchronizationManager.getCurrentTransactionName();
        WorkUnit unit = workUnitRepository.findById(workUnitId).orElse(null);
        if (!isParkedOn(unit, correlationId)) {
            log.warn("[StatusUpdater][TX:{}] Work unit {} is not parked on {}. Not failing it.",
                    txName, workUnitId, correlationId);
            return false;
        }
        WorkUnitStatus oldStatus = unit.getStatus();
        unit.finish(WorkUnitStatus.FAILURE, message, classification, clock.instant());
        workUnitRepository.saveAndFlush(unit);
        log.info("[StatusUpdater][TX:{}] Failed parked work unit {} ({}): {}", txName, workUnitId, classification, message);
        appendLog(unit, oldStatus);
        publishEvent(unit);
        return true;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public WorkUnit cancel(Long workUnitId, String reason) {
        String txName = TransactionSynchronizationManager.getCurrentTransactionName();
        WorkUnit unit = workUnitRepository.findById(workUnitId)
                .orElseThrow(() -> new WorkUnitNotFoundException(workUnitId));
        if (unit.isTerminal()) {
            log.info("[StatusUpdater][TX:{}] Work unit {} is already {}. Cancel is a no-op.",
                    txName, workUnitId, unit.getStatus());
            return unit;
        }
        WorkUnitStatus oldStatus = unit.getStatus();
        discardAwaitingCorrelation(unit);
        String message = reason == null || reason.isBlank() ? "Cancelled by user" : "Cancelled: " + reason;
        unit.finish(WorkUnitStatus.FAILURE, message, ErrorClassification.CANCELLED, clock.instant());
        WorkUnit saved = workUnitRepository.saveAndFlush(unit);
        log.info("[StatusUpdater][TX:{}] Cancelled work unit {} (was {})", txName, workUnitId, oldStatus);
        appendLog(saved, oldStatus);
        publishEvent(saved);
        return saved;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public WorkUnit retryFailed(Long workUnitId) {
        String txName = TransactionSynchronizationManager.getCurrentTransactionName();
        WorkUnit unit = workUnitRepository.findById(workUnitId)
                .orElseThrow(() -> new WorkUnitNotFoundException(workUnitId));
        if (unit.getStatus() != WorkUnitStatus.FAILURE) {
            log.warn("[StatusUpdater][TX:{}] Work unit {} cannot be retried from state {}.",
                    txName, workUnitId, unit.getStatus());
            throw new WorkUnitConflictException("Only failed work units can be retried (current: " + unit.getStatus() + ")");
        }
        WorkUnitStatus oldStatus = unit.getStatus();
        discardAwaitingCorrelation(unit);
        resetForNewAttempt(unit);
        unit.setLiveMarker(Boolean.TRUE);
        unit.setErrorClassification(null);
        unit.setMessage("Retry requested");
        WorkUnit saved;
        try {
            saved = workUnitRepository.saveAndFlush(unit);
        } catch (DataIntegrityViolationException e) {
            log.warn("[StatusUpdater][TX:{}] Another live work unit exists for target {} ({}).",
                    txName, unit.getTargetId(), unit.getKind());
            throw new WorkUnitConflictException("Another work unit is already active for this target");
        }
        log.info("[StatusUpdater][TX:{}] Work unit {} re-queued as attempt {}", txName, workUnitId, saved.getAttemptCount());
        appendLog(saved, oldStatus);
        publishEvent(saved);
        return saved;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean failIfStale(Long workUnitId, WorkUnitStatus expected, Instant threshold, String message,
                               ErrorClassification classification) {
        String txName = TransactionSynchronizationManager.getCurrentTransactionName();
        int updated = workUnitRepository.failIfStale(workUnitId, expected, threshold, WorkUnitStatus.FAILURE,
                message, classification, clock.instant());
        if (updated == 0) {
            log.debug("[StatusUpdater][TX:{}] Work unit {} changed since it was selected as stale. Skipped.",
                    txName, workUnitId);
            return false;
        }
        WorkUnit unit = findOrThrow(workUnitId);
        discardAwaitingCorrelation(unit);
        log.info("[StatusUpdater][TX:{}] Failed stale work unit {} (was {}): {}", txName, workUnitId, expected, message);
        appendLog(unit, expected);
        publishEvent(unit);
        return true;
    }

    // Helper methods

    private WorkUnit mutateHeld(Long workUnitId, String leaseToken, String action, boolean transition,
                                Consumer<WorkUnit> mutation) {
        String txName = TransactionSynchronizationManager.getCurrentTransactionName();
        WorkUnit unit = findOrThrow(workUnitId);
        if (!unit.isHeldBy(leaseToken)) {
            log.warn("[StatusUpdater][TX:{}] Lease lost on work unit {} before '{}' (status: {}).",
                    txName, workUnitId, action, unit.getStatus());
            throw new ConcurrencyConflictException("Work unit " + workUnitId + " is no longer held by this worker");
        }
        WorkUnitStatus oldStatus = unit.getStatus();
        mutation.accept(unit);
        unit.setUpdatedAt(clock.instant());
        WorkUnit saved;
        try {
            saved = workUnitRepository.saveAndFlush(unit);
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrencyConflictException("Work unit " + workUnitId + " was modified concurrently", e);
        }
        if (transition) {
            log.info("[StatusUpdater][TX:{}] Work unit {}: {} -> {} ({}, {}%)", txName, workUnitId, action,
                    saved.getStatus(), saved.getCurrentStage(), saved.getProgress());
            appendLog(saved, oldStatus);
            publishEvent(saved);
        }
        return saved;
    }

    private void resetForNewAttempt(WorkUnit unit) {
        unit.setStatus(WorkUnitStatus.RETRY);
        unit.setAttemptCount(unit.getAttemptCount() + 1);
        unit.setProgress(0.0);
        unit.setCurrentStage(unit.getKind().firstStage());
        unit.setLeaseToken(null);
        unit.setAwaitingCallback(false);
        unit.setNextAttemptAt(null);
        unit.clearArtifacts();
        unit.setUpdatedAt(clock.instant());
    }

    private static boolean isParkedOn(WorkUnit unit, String correlationId) {
        return unit != null
                && unit.getStatus() == WorkUnitStatus.RUNNING
                && unit.isAwaitingCallback()
                && correlationId != null
                && correlationId.equals(unit.getArtifacts().get(StageArtifacts.CORRELATION_ID));
    }

    /**
     * Deletes the awaiting correlation of the unit's last recognition submission. A late callback
     * for it is then answered as unknown.
     */
    private void discardAwaitingCorrelation(WorkUnit unit) {
        String correlationId = unit.getArtifacts().get(StageArtifacts.CORRELATION_ID);
        if (correlationId == null) {
            return;
        }
        int deleted = correlationRepository.deleteIfStatus(correlationId, CorrelationStatus.AWAITING);
        if (deleted > 0) {
            log.info("[StatusUpdater] Discarded awaiting correlation {} of work unit {}", correlationId, unit.getId());
        }
    }

    private WorkUnit findOrThrow(Long workUnitId) {
        return workUnitRepository.findById(workUnitId)
                .orElseThrow(() -> new WorkUnitNotFoundException(workUnitId));
    }

    /**
     * Appends a transition to the unit's log and drops entries beyond the newest {@code maxLogEntries}.
     */
    private void appendLog(WorkUnit unit, WorkUnitStatus oldStatus) {
        logRepository.save(new WorkUnitLogEntry(unit, oldStatus, clock.instant()));
        List<WorkUnitLogEntry> oldestKept = logRepository.findByWorkUnitIdOrderByIdDesc(
                unit.getId(), PageRequest.of(maxLogEntries - 1, 1));
        if (!oldestKept.isEmpty()) {
            logRepository.deleteOlderThan(unit.getId(), oldestKept.get(0).getId());
        }
    }

    private void publishEvent(WorkUnit unit) {
        try {
            eventPublisher.publishEvent(new WorkUnitChangedEvent(this, ProgressEvent.of(unit, clock.instant())));
        } catch (Exception e) {
            log.error("Failed to publish WorkUnitChangedEvent [WorkUnit: {}, Target: {}, Status: {}]: {}",
                    unit.getId(), unit.getTargetId(), unit.getStatus(), e.getMessage(), e);
        }
    }
}
