package com.faultline.core.pattern;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds bursts: maximal runs of occurrences whose consecutive gaps are at
 * most {@value #MAX_GAP_SECONDS} seconds and that contain at least
 * {@value #MIN_EVENTS} events.
 *
 * @since 1.0.0
 */
public final class BurstDetector {

    static final int MIN_EVENTS = 5;
    static final long MAX_GAP_SECONDS = 60;

    private static final Duration MAX_GAP = Duration.ofSeconds(MAX_GAP_SECONDS);

    private BurstDetector() {
    }

    /**
     * @param timestamps occurrence times, in any order
     * @return bursts in chronological order
     */
    public static List<Burst> detect(List<Instant> timestamps) {
        Objects.requireNonNull(timestamps, "timestamps must not be null");
        List<Burst> bursts = new ArrayList<>();
        if (timestamps.size() < MIN_EVENTS) {
            return bursts;
        }
        List<Instant> sorted = new ArrayList<>(timestamps);
        sorted.sort(null);

        int runStart = 0;
        for (int i = 1; i <= sorted.size(); i++) {
            boolean continues = i < sorted.size()
                    && Duration.between(sorted.get(i - 1), sorted.get(i)).compareTo(MAX_GAP) <= 0;
            if (!continues) {
                int runLength = i - runStart;
                if (runLength >= MIN_EVENTS) {
                    bursts.add(new Burst(sorted.get(runStart), sorted.get(i - 1), runLength));
                }
                runStart = i;
            }
        }
        return bursts;
    }
}
