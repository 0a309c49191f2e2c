package com.example.clipflow.domain;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "work_unit_log",
        indexes = @Index(name = "idx_work_unit_log_unit", columnList = "work_unit_id, id"))
public class WorkUnitLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "work_unit_id", nullable = false, updatable = false)
    private Long workUnitId;

    @Enumerated(EnumType.STRING)
    @Column(name = "old_status", length = 20)
    private WorkUnit.WorkUnitStatus oldStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status", nullable = false, length = 20)
    private WorkUnit.WorkUnitStatus newStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "stage", length = 30)
    private PipelineStage stage;

    @Column(name = "progress", nullable = false)
    private double progress;

    @Column(name = "attempt", nullable = false)
    private int attempt;

    @Column(name = "message", length = 1000)
    private String message;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public WorkUnitLogEntry() {
    }

    public WorkUnitLogEntry(WorkUnit unit, WorkUnit.WorkUnitStatus oldStatus, Instant createdAt) {
        this.workUnitId = unit.getId();
        this.oldStatus = oldStatus;
        this.newStatus = unit.getStatus();
        this.stage = unit.getCurrentStage();
        this.progress = unit.getProgress();
        this.attempt = unit.getAttemptCount();
        this.message = unit.getMessage();
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public Long getWorkUnitId() {
        return workUnitId;
    }

    public WorkUnit.WorkUnitStatus getOldStatus() {
        return oldStatus;
    }

    public WorkUnit.WorkUnitStatus getNewStatus() {
        return newStatus;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public double getProgress() {
        return progress;
    }

    public int getAttempt() {
        return attempt;
    }

    public String getMessage() {
        return message;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
