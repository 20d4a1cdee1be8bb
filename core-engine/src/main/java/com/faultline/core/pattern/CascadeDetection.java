package com.faultline.core.pattern;

import java.time.Instant;

/**
 * One observation of a child error following a parent error.
 *
 * @since 1.0.0
 */
public final class CascadeDetection {

    private final long parentErrorId;
    private final long childErrorId;
    private final double delaySeconds;
    private final Instant parentOccurredAt;
    private final Instant parentRecordedAt;

    public CascadeDetection(long parentErrorId, long childErrorId, double delaySeconds, Instant parentOccurredAt) {
        this(parentErrorId, childErrorId, delaySeconds, parentOccurredAt, parentOccurredAt);
    }

    /**
     * @param parentRecordedAt when the parent occurrence was stored
     */
    public CascadeDetection(long parentErrorId, long childErrorId, double delaySeconds, Instant parentOccurredAt,
            Instant parentRecordedAt) {
        this.parentErrorId = parentErrorId;
        this.childErrorId = childErrorId;
        this.delaySeconds = delaySeconds;
        this.parentOccurredAt = parentOccurredAt;
        this.parentRecordedAt = parentRecordedAt;
    }

    public long getParentErrorId() {
        return parentErrorId;
    }

    public long getChildErrorId() {
        return childErrorId;
    }

    public double getDelaySeconds() {
        return delaySeconds;
    }

    public Instant getParentOccurredAt() {
        return parentOccurredAt;
    }

    public Instant getParentRecordedAt() {
        return parentRecordedAt;
    }

    @Override
    public String toString() {
        return "CascadeDetection{" + parentErrorId + " -> " + childErrorId + ", delay=" + delaySeconds + "s}";
    }
}
