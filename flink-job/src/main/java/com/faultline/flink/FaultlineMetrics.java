package com.faultline.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Flink metrics for the aggregation operator, exposed through the cluster's
 * metric reporters.
 *
 * <ul>
 *   <li>{@code signals_processed_total}</li>
 *   <li>{@code errors_created_total}</li>
 *   <li>{@code errors_reopened_total}</li>
 *   <li>{@code notifications_total}</li>
 *   <li>{@code processing_latency_ms}: histogram over the last 350 signals</li>
 * </ul>
 */
public class FaultlineMetrics {

    private final Counter signalsProcessed;
    private final Counter errorsCreated;
    private final Counter errorsReopened;
    private final Counter notifications;
    private final Histogram processingLatency;

    public FaultlineMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("faultline");
        this.signalsProcessed = group.counter("signals_processed_total");
        this.errorsCreated = group.counter("errors_created_total");
        this.errorsReopened = group.counter("errors_reopened_total");
        this.notifications = group.counter("notifications_total");
        this.processingLatency = group.histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementSignalsProcessed() {
        signalsProcessed.inc();
    }

    public void incrementErrorsCreated() {
        errorsCreated.inc();
    }

    public void incrementErrorsReopened() {
        errorsReopened.inc();
    }

    public void incrementNotifications(long count) {
        notifications.inc(count);
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}
