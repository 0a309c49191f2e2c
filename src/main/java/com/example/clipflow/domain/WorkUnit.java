package com.example.clipflow.domain;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Entity
@Table(name = "work_units",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_work_unit_live", columnNames = {"target_id", "kind", "live_marker"})
        },
        indexes = {
                @Index(name = "idx_work_unit_target_kind", columnList = "target_id, kind, created_at"),
                @Index(name = "idx_work_unit_status", columnList = "status, updated_at"),
                @Index(name = "idx_work_unit_owner", columnList = "owner_id")
        })
public class WorkUnit {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false, length = 100, updatable = false)
    private String ownerId;

    @Column(name = "target_id", nullable = false, length = 100, updatable = false)
    private String targetId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 30, updatable = false)
    private WorkUnitKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private WorkUnitStatus status = WorkUnitStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_stage", length = 30)
    private PipelineStage currentStage;

    @Column(name = "progress", nullable = false)
    private double progress;

    @Column(name = "message", length = 1000)
    private String message;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount = 1;

    // TRUE while the unit is live, NULL once terminal so historical rows never collide on the unique key
    @Column(name = "live_marker")
    private Boolean liveMarker = Boolean.TRUE;

    // Non-null only while a worker holds the current attempt
    @Column(name = "lease_token", length = 36)
    private String leaseToken;

    @Column(name = "awaiting_callback", nullable = false)
    private boolean awaitingCallback;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_classification", length = 20)
    private ErrorClassification errorClassification;

    @Convert(converter = StringMapConverter.class)
    @Column(name = "params", columnDefinition = "TEXT")
    private Map<String, String> params = new LinkedHashMap<>();

    @Convert(converter = StringMapConverter.class)
    @Column(name = "artifacts", columnDefinition = "TEXT")
    private Map<String, String> artifacts = new LinkedHashMap<>();

    @Version
    private Long version;

    public enum WorkUnitStatus {
        PENDING,
        RUNNING,
        SUCCESS,
        FAILURE,
        RETRY;

        public boolean isTerminal() {
            return this == SUCCESS || this == FAILURE;
        }
    }

    public WorkUnit() {
    }

    public WorkUnit(String ownerId, String targetId, WorkUnitKind kind, Map<String, String> params, Instant now) {
        this.ownerId = ownerId;
        this.targetId = targetId;
        this.kind = kind;
        this.params = params != null ? new LinkedHashMap<>(params) : new LinkedHashMap<>();
        this.currentStage = kind.firstStage();
        this.progress = 0.0;
        this.message = "Queued";
        this.createdAt = now;
        this.updatedAt = now;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isLive() {
        return Boolean.TRUE.equals(liveMarker);
    }

    public boolean isHeldBy(String token) {
        return token != null && token.equals(leaseToken) && status == WorkUnitStatus.RUNNING;
    }

    /**
     * Moves the unit into a terminal state and releases everything a live unit holds.
     */
    public void finish(WorkUnitStatus terminalStatus, String message, ErrorClassification classification, Instant now) {
        if (!terminalStatus.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminalStatus);
        }
        this.status = terminalStatus;
        this.message = message;
        this.errorClassification = classification;
        this.liveMarker = null;
        this.leaseToken = null;
        this.awaitingCallback = false;
        this.nextAttemptAt = null;
        this.completedAt = now;
        this.updatedAt = now;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getTargetId() {
        return targetId;
    }

    public WorkUnitKind getKind() {
        return kind;
    }

    public WorkUnitStatus getStatus() {
        return status;
    }

    public void setStatus(WorkUnitStatus status) {
        this.status = status;
    }

    public PipelineStage getCurrentStage() {
        return currentStage;
    }

    public void setCurrentStage(PipelineStage currentStage) {
        this.currentStage = currentStage;
    }

    public double getProgress() {
        return progress;
    }

    public void setProgress(double progress) {
        this.progress = progress;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public void setAttemptCount(int attemptCount) {
        this.attemptCount = attemptCount;
    }

    public Boolean getLiveMarker() {
        return liveMarker;
    }

    public void setLiveMarker(Boolean liveMarker) {
        this.liveMarker = liveMarker;
    }

    public String getLeaseToken() {
        return leaseToken;
    }

    public void setLeaseToken(String leaseToken) {
        this.leaseToken = leaseToken;
    }

    public boolean isAwaitingCallback() {
        return awaitingCallback;
    }

    public void setAwaitingCallback(boolean awaitingCallback) {
        this.awaitingCallback = awaitingCallback;
    }

    public Instant getNextAttemptAt() {
        return nextAttemptAt;
    }

    public void setNextAttemptAt(Instant nextAttemptAt) {
        this.nextAttemptAt = nextAttemptAt;
    }

    public ErrorClassification getErrorClassification() {
        return errorClassification;
    }

    public void setErrorClassification(ErrorClassification errorClassification) {
        this.errorClassification = errorClassification;
    }

    public Map<String, String> getParams() {
        return params;
    }

    public Map<String, String> getArtifacts() {
        return artifacts;
    }

    public void putArtifacts(Map<String, String> produced) {
        if (produced == null || produced.isEmpty()) {
            return;
        }
        Map<String, String> merged = new LinkedHashMap<>(this.artifacts);
        merged.putAll(produced);
        this.artifacts = merged;
    }

    public void clearArtifacts() {
        this.artifacts = new LinkedHashMap<>();
    }

    public Long getVersion() {
        return version;
    }
}
