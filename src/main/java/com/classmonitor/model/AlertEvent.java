package com.classmonitor.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Durable record of a raised alert (violation evidence and who was notified).
 */
@Table("alert_events")
public class AlertEvent {

    @Id
    private Long id;

    @Column("source_key")
    private String sourceKey;

    @Column("target_identifier")
    private String targetIdentifier;

    @Column("detail")
    private String detail;

    @Column("evidence_url")
    private String evidenceUrl;

    @Column("created_at")
    private LocalDateTime createdAt;

    public AlertEvent() {
        this.createdAt = LocalDateTime.now();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final AlertEvent event = new AlertEvent();

        public Builder sourceKey(String sourceKey) {
            event.sourceKey = sourceKey;
            return this;
        }

        public Builder targetIdentifier(String targetIdentifier) {
            event.targetIdentifier = targetIdentifier;
            return this;
        }

        public Builder detail(String detail) {
            event.detail = detail;
            return this;
        }

        public Builder evidenceUrl(String evidenceUrl) {
            event.evidenceUrl = evidenceUrl;
            return this;
        }

        public AlertEvent build() {
            return event;
        }
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getSourceKey() {
        return sourceKey;
    }

    public void setSourceKey(String sourceKey) {
        this.sourceKey = sourceKey;
    }

    public String getTargetIdentifier() {
        return targetIdentifier;
    }

    public void setTargetIdentifier(String targetIdentifier) {
        this.targetIdentifier = targetIdentifier;
    }

    public String getDetail() {
        return detail;
    }

    public void setDetail(String detail) {
        this.detail = detail;
    }

    public String getEvidenceUrl() {
        return evidenceUrl;
    }

    public void setEvidenceUrl(String evidenceUrl) {
        this.evidenceUrl = evidenceUrl;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }
}
