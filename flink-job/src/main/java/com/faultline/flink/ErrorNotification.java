package com.faultline.flink;

import com.faultline.core.model.AggregatedError;
import com.faultline.core.model.AnomalyInfo;

import java.io.Serializable;
import java.time.Instant;

/**
 * Notification request published to the notifications topic. Channel
 * delivery (Slack, webhooks, paging) consumes this topic outside the job.
 */
public class ErrorNotification implements Serializable {

    private static final long serialVersionUID = 1L;

    private final AggregatedError error;
    private final AnomalyInfo anomaly;
    private final Instant createdAt;

    public ErrorNotification(AggregatedError error, AnomalyInfo anomaly, Instant createdAt) {
        this.error = error;
        this.anomaly = anomaly;
        this.createdAt = createdAt;
    }

    public AggregatedError getError() {
        return error;
    }

    /** {@code null} unless a baseline anomaly accompanies the notification. */
    public AnomalyInfo getAnomaly() {
        return anomaly;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "ErrorNotification{error=" + error + ", anomaly=" + anomaly + '}';
    }
}
