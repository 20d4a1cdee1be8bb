package com.faultline.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One accepted signal, linked to the aggregated record it was folded into.
 *
 * <p>
 * Occurrences back the time-ranged counts used by baselines and the
 * co-occurrence scan used by cascade detection.
 * </p>
 *
 * <p>
 * {@code occurredAt} is the time reported by the application;
 * {@code recordedAt} is when the pipeline stored the occurrence. They differ
 * for late or replayed signals.
 * </p>
 *
 * @since 1.0.0
 */
public final class ErrorOccurrence implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long errorId;
    private final String tenantId;
    private final String errorType;
    private final String platform;
    private final Instant occurredAt;
    private final String userId;
    private final Instant recordedAt;

    /**
     * Occurrence recorded at the time it occurred.
     */
    public ErrorOccurrence(long errorId, String tenantId, String errorType, String platform,
            Instant occurredAt, String userId) {
        this(errorId, tenantId, errorType, platform, occurredAt, userId, occurredAt);
    }

    public ErrorOccurrence(long errorId, String tenantId, String errorType, String platform,
            Instant occurredAt, String userId, Instant recordedAt) {
        this.errorId = errorId;
        this.tenantId = tenantId;
        this.errorType = Objects.requireNonNull(errorType, "errorType must not be null");
        this.platform = platform;
        this.occurredAt = Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        this.userId = userId;
        this.recordedAt = Objects.requireNonNull(recordedAt, "recordedAt must not be null");
    }

    public long getErrorId() {
        return errorId;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getErrorType() {
        return errorType;
    }

    public String getPlatform() {
        return platform;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public String getUserId() {
        return userId;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ErrorOccurrence that))
            return false;
        return errorId == that.errorId
                && Objects.equals(occurredAt, that.occurredAt)
                && Objects.equals(userId, that.userId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(errorId, occurredAt, userId);
    }

    @Override
    public String toString() {
        return "ErrorOccurrence{errorId=" + errorId + ", errorType='" + errorType
                + "', occurredAt=" + occurredAt + '}';
    }
}
