package com.faultline.core.pattern;

import com.faultline.core.aggregation.ErrorStore;
import com.faultline.core.model.AggregatedError;
import com.faultline.core.model.CascadePattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Folds cascade detections into {@link CascadePattern} edges.
 *
 * <p>
 * Each edge is updated under the store lock for its key. The first detection
 * sets frequency 1 and the observed delay; later ones increment the frequency
 * and update the running mean of the delay. The probability is the frequency
 * divided by the parent record's lifetime occurrence count, rounded to 3
 * decimals, and is left unchanged when the parent record is missing or has no
 * occurrences. Pruned occurrence rows do not lower the divisor.
 * </p>
 *
 * @since 1.0.0
 */
public class CascadeTracker {

    private static final Logger LOG = LoggerFactory.getLogger(CascadeTracker.class);

    private final ErrorStore store;
    private final Clock clock;

    public CascadeTracker(ErrorStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public CascadePattern record(CascadeDetection detection) {
        Objects.requireNonNull(detection, "detection must not be null");
        long parent = detection.getParentErrorId();
        long child = detection.getChildErrorId();
        return store.withLock(CascadePattern.keyOf(parent, child), () -> {
            CascadePattern pattern = store.findCascade(parent, child)
                    .orElseGet(() -> new CascadePattern(parent, child));
            int frequency = pattern.getFrequency() + 1;
            pattern.setAvgDelaySeconds(frequency == 1
                    ? detection.getDelaySeconds()
                    : runningMean(pattern.getAvgDelaySeconds(), frequency, detection.getDelaySeconds()));
            pattern.setFrequency(frequency);
            pattern.setLastDetectedAt(clock.instant());

            long parentOccurrences = store.findById(parent)
                    .map(AggregatedError::getOccurrenceCount)
                    .orElse(0L);
            if (parentOccurrences > 0) {
                pattern.setCascadeProbability(probability(frequency, parentOccurrences));
            }
            LOG.trace("Cascade {} updated: {}", pattern.getKey(), pattern);
            return store.upsertCascade(pattern);
        });
    }

    /**
     * @return number of detections recorded
     */
    public int recordAll(List<CascadeDetection> detections) {
        detections.forEach(this::record);
        return detections.size();
    }

    /**
     * {@code (oldAvg * (frequency - 1) + delay) / frequency}.
     *
     * @param frequency frequency including the new detection
     */
    static double runningMean(double oldAvg, int frequency, double delay) {
        return (oldAvg * (frequency - 1) + delay) / frequency;
    }

    static double probability(int frequency, long parentOccurrences) {
        return Math.round((double) frequency / parentOccurrences * 1000) / 1000.0;
    }
}
