package com.example.clipflow.domain;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Operator-editable override for a pipeline tunable, keyed by setting name.
 */
@Entity
@Table(name = "pipeline_settings")
public class PipelineSetting {

    @Id
    @Column(name = "setting_key", length = 100)
    private String key;

    @Column(name = "setting_value", nullable = false, length = 500)
    private String value;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public PipelineSetting() {
    }

    public PipelineSetting(String key, String value, Instant updatedAt) {
        this.key = key;
        this.value = value;
        this.updatedAt = updatedAt;
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
