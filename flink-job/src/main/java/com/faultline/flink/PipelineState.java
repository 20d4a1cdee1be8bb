package com.faultline.flink;

import com.faultline.core.aggregation.InMemoryErrorStore;
import com.faultline.core.pipeline.AnalysisScheduler;
import com.faultline.core.pipeline.ErrorPipeline;

import java.io.Serializable;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Checkpointed form of everything an {@link ErrorPipeline} remembers: the
 * store contents, both cooldown tables and the cascade watermark.
 */
final class PipelineState implements Serializable {

    private static final long serialVersionUID = 1L;

    private final InMemoryErrorStore.Snapshot store;
    private final HashMap<String, Instant> notificationCooldowns;
    private final HashMap<String, Instant> baselineAlertCooldowns;
    private final Instant cascadeWatermark;

    private PipelineState(InMemoryErrorStore.Snapshot store, Map<String, Instant> notificationCooldowns,
            Map<String, Instant> baselineAlertCooldowns, Instant cascadeWatermark) {
        this.store = store;
        this.notificationCooldowns = new HashMap<>(notificationCooldowns);
        this.baselineAlertCooldowns = new HashMap<>(baselineAlertCooldowns);
        this.cascadeWatermark = cascadeWatermark;
    }

    static PipelineState capture(InMemoryErrorStore store, ErrorPipeline pipeline, AnalysisScheduler scheduler) {
        return new PipelineState(store.snapshot(),
                pipeline.getThrottler().snapshot(),
                pipeline.getBaselineAlertThrottler().snapshot(),
                scheduler.getCascadeWatermark().orElse(null));
    }

    /**
     * Load the store contents. Must run before the pipeline starts using the
     * store.
     */
    void restoreStore(InMemoryErrorStore target) {
        Objects.requireNonNull(target, "target must not be null").restore(store);
    }

    void restorePipeline(ErrorPipeline pipeline, AnalysisScheduler scheduler) {
        pipeline.getThrottler().restore(notificationCooldowns);
        pipeline.getBaselineAlertThrottler().restore(baselineAlertCooldowns);
        if (cascadeWatermark != null) {
            scheduler.resumeFrom(cascadeWatermark);
        }
    }

    @Override
    public String toString() {
        return "PipelineState{records=" + store.recordCount()
                + ", occurrences=" + store.occurrenceCount()
                + ", cooldowns=" + notificationCooldowns.size()
                + ", cascadeWatermark=" + cascadeWatermark + '}';
    }
}
