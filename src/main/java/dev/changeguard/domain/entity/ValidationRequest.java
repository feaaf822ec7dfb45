package dev.changeguard.domain.entity;

import dev.changeguard.domain.enums.ValidationStatus;
import dev.changeguard.domain.valueobject.Verdict;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * One inbound change validation and its lifecycle.
 *
 * Status only moves forward: RECEIVED -> PROCESSING -> COMPLETED | FAILED.
 * A FAILED row may re-enter PROCESSING through a fresh processing attempt, which
 * bumps the retry count. Terminal states are absorbing for the attempt that reached them,
 * so late or duplicate completions are ignored rather than rejected.
 */
@Entity
@Table(name = "change_validations", indexes = {
        @Index(name = "idx_validation_status_created", columnList = "status, created_at"),
        @Index(name = "idx_validation_component_type", columnList = "component_type, created_at")
})
public class ValidationRequest {

    private static final int MAX_REASON_LENGTH = 2000;

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "change_id", unique = true, nullable = false, length = 64)
    private String changeId;

    @Column(name = "change_number", nullable = false, length = 64)
    private String changeNumber;

    @Column(name = "component_type", nullable = false, length = 100)
    private String componentType;

    @Column(name = "component_id", length = 64)
    private String componentId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw_payload", nullable = false, updatable = false, columnDefinition = "jsonb")
    private String rawPayload;

    @Column(name = "request_signature", length = 512)
    private String requestSignature;

    @Column(name = "requested_by")
    private String requestedBy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ValidationStatus status;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Verdict verdict;

    @Column(name = "failure_reason", length = MAX_REASON_LENGTH)
    private String failureReason;

    @Column(name = "processing_duration_ms")
    private Long processingDurationMs;

    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    protected ValidationRequest() {
    }

    public static ValidationRequest receive(String changeId, String changeNumber, String componentType,
                                            String componentId, String rawPayload,
                                            String requestSignature, String requestedBy) {
        ValidationRequest r = new ValidationRequest();
        r.id = UUID.randomUUID();
        r.changeId = changeId;
        r.changeNumber = changeNumber;
        r.componentType = componentType;
        r.componentId = componentId;
        r.rawPayload = rawPayload;
        r.requestSignature = requestSignature;
        r.requestedBy = requestedBy;
        r.status = ValidationStatus.RECEIVED;
        r.createdAt = Instant.now();
        r.updatedAt = r.createdAt;
        return r;
    }

    /**
     * Begins a processing attempt. A FAILED row starts a retry; PROCESSING and COMPLETED rows
     * are left untouched.
     *
     * @return true if this call changed the status
     */
    public boolean markProcessing() {
        switch (status) {
            case RECEIVED -> {
                status = ValidationStatus.PROCESSING;
                touch();
                return true;
            }
            case FAILED -> {
                status = ValidationStatus.PROCESSING;
                retryCount++;
                failureReason = null;
                processedAt = null;
                processingDurationMs = null;
                touch();
                return true;
            }
            default -> {
                return false;
            }
        }
    }

    public boolean markCompleted(Verdict verdict, long durationMs) {
        if (status.isTerminal()) return false;
        requireProcessing();
        if (verdict == null) throw new IllegalArgumentException("A completed validation needs a verdict");
        this.status = ValidationStatus.COMPLETED;
        this.verdict = verdict;
        this.failureReason = null;
        finish(durationMs);
        return true;
    }

    public boolean markFailed(String reason, long durationMs) {
        if (status.isTerminal()) return false;
        requireProcessing();
        this.status = ValidationStatus.FAILED;
        this.verdict = null;
        this.failureReason = truncate(reason == null || reason.isBlank() ? "Unknown failure" : reason);
        finish(durationMs);
        return true;
    }

    private void requireProcessing() {
        if (status != ValidationStatus.PROCESSING)
            throw new IllegalStateException("Expected %s but was %s".formatted(ValidationStatus.PROCESSING, status));
    }

    private void finish(long durationMs) {
        this.processingDurationMs = durationMs;
        this.processedAt = Instant.now();
        touch();
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }

    private static String truncate(String s) {
        return s.length() <= MAX_REASON_LENGTH ? s : s.substring(0, MAX_REASON_LENGTH);
    }

    public UUID getId() {
        return id;
    }

    public String getChangeId() {
        return changeId;
    }

    public String getChangeNumber() {
        return changeNumber;
    }

    public String getComponentType() {
        return componentType;
    }

    public String getComponentId() {
        return componentId;
    }

    public String getRawPayload() {
        return rawPayload;
    }

    public String getRequestSignature() {
        return requestSignature;
    }

    public String getRequestedBy() {
        return requestedBy;
    }

    public ValidationStatus getStatus() {
        return status;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public Long getProcessingDurationMs() {
        return processingDurationMs;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public Long getVersion() {
        return version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }
}
