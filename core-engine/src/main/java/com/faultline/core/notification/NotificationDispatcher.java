package com.faultline.core.notification;

import com.faultline.core.model.AggregatedError;
import com.faultline.core.model.AnomalyInfo;

import java.util.Optional;

/**
 * Delivery side of notifications: builds channel payloads and sends them.
 *
 * <p>
 * Implementations may throw; the pipeline catches and logs every failure.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface NotificationDispatcher {

    /**
     * @param error   snapshot of the aggregated error
     * @param anomaly baseline anomaly that accompanies the notification, if any
     * @throws Exception if delivery fails
     */
    void dispatch(AggregatedError error, Optional<AnomalyInfo> anomaly) throws Exception;
}
