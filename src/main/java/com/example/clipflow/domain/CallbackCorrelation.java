package com.example.clipflow.domain;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Links an outbound recognition request to its asynchronous completion. Rows are created by the
 * worker before submission, moved to DELIVERED by the callback receiver, and removed by the result
 * poller when consumed or expired.
 */
@Entity
@Table(name = "callback_correlations",
        indexes = {
                @Index(name = "idx_correlation_status_expiry", columnList = "status, expires_at"),
                @Index(name = "idx_correlation_work_unit", columnList = "work_unit_id")
        })
public class CallbackCorrelation {

    @Id
    @Column(name = "correlation_id", length = 64, updatable = false)
    private String correlationId;

    @Column(name = "work_unit_id", nullable = false, updatable = false)
    private Long workUnitId;

    @Column(name = "remote_task_id", length = 100)
    private String remoteTaskId;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private Instant submittedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private CorrelationStatus status = CorrelationStatus.AWAITING;

    @Column(name = "result_ref", length = 1000)
    private String resultRef;

    @Column(name = "error", length = 1000)
    private String error;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    public enum CorrelationStatus {
        AWAITING,
        DELIVERED,
        EXPIRED
    }

    public CallbackCorrelation() {
    }

    public CallbackCorrelation(String correlationId, Long workUnitId, Instant submittedAt, Instant expiresAt) {
        this.correlationId = correlationId;
        this.workUnitId = workUnitId;
        this.submittedAt = submittedAt;
        this.expiresAt = expiresAt;
    }

    /**
     * True when the external service reported a usable result.
     */
    public boolean isSuccessful() {
        return status == CorrelationStatus.DELIVERED && resultRef != null && error == null;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Long getWorkUnitId() {
        return workUnitId;
    }

    public String getRemoteTaskId() {
        return remoteTaskId;
    }

    public void setRemoteTaskId(String remoteTaskId) {
        this.remoteTaskId = remoteTaskId;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public CorrelationStatus getStatus() {
        return status;
    }

    public void setStatus(CorrelationStatus status) {
        this.status = status;
    }

    public String getResultRef() {
        return resultRef;
    }

    public void setResultRef(String resultRef) {
        this.resultRef = resultRef;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public Instant getDeliveredAt() {
        return deliveredAt;
    }

    public void setDeliveredAt(Instant deliveredAt) {
        this.deliveredAt = deliveredAt;
    }
}
