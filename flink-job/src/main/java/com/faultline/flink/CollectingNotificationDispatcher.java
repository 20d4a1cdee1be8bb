package com.faultline.flink;

import com.faultline.core.model.AggregatedError;
import com.faultline.core.model.AnomalyInfo;
import com.faultline.core.notification.NotificationDispatcher;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Buffers notifications so the process function can emit them to a side
 * output after each element. Used from the task thread only.
 */
class CollectingNotificationDispatcher implements NotificationDispatcher {

    private final List<ErrorNotification> pending = new ArrayList<>();
    private final Clock clock;

    CollectingNotificationDispatcher(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void dispatch(AggregatedError error, Optional<AnomalyInfo> anomaly) {
        pending.add(new ErrorNotification(error, anomaly.orElse(null), clock.instant()));
    }

    /**
     * @return the buffered notifications, leaving the buffer empty
     */
    List<ErrorNotification> drain() {
        List<ErrorNotification> drained = new ArrayList<>(pending);
        pending.clear();
        return drained;
    }
}
