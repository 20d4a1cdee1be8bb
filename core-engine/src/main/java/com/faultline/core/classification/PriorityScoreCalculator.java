package com.faultline.core.classification;

import com.faultline.core.aggregation.ErrorStore;
import com.faultline.core.model.AggregatedError;
import com.faultline.core.model.Severity;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Computes a 0-100 priority score for an aggregated record.
 *
 * <p>
 * Weighted sum of four components, each on a 0-100 scale:
 * severity (40%), frequency (25%), recency (20%) and user impact (15%).
 * The component functions are pure and exposed for testing; only
 * {@link #compute(AggregatedError)} reads the store, to count distinct
 * affected users.
 * </p>
 *
 * @since 1.0.0
 */
public class PriorityScoreCalculator {

    static final double SEVERITY_WEIGHT = 0.40;
    static final double FREQUENCY_WEIGHT = 0.25;
    static final double RECENCY_WEIGHT = 0.20;
    static final double IMPACT_WEIGHT = 0.15;

    private final SeverityClassifier severityClassifier;
    private final ErrorStore store;
    private final Clock clock;

    public PriorityScoreCalculator(SeverityClassifier severityClassifier, ErrorStore store, Clock clock) {
        this.severityClassifier = Objects.requireNonNull(severityClassifier, "severityClassifier must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param record post-aggregation snapshot
     * @return score clamped to [0, 100]
     */
    public int compute(AggregatedError record) {
        Objects.requireNonNull(record, "record must not be null");
        long users = record.getUserId() == null
                ? 0
                : store.countDistinctUsers(record.getTenantId(), record.getErrorType());
        return score(severityClassifier.classify(record.getErrorType()),
                record.getOccurrenceCount(), record.getLastSeenAt(), clock.instant(),
                record.getUserId() != null, users);
    }

    /**
     * Pure form of {@link #compute(AggregatedError)}.
     */
    public static int score(Severity severity, long occurrenceCount, Instant lastSeenAt, Instant now,
            boolean hasUser, long distinctUsers) {
        double weighted = severityComponent(severity) * SEVERITY_WEIGHT
                + frequencyComponent(occurrenceCount) * FREQUENCY_WEIGHT
                + recencyComponent(lastSeenAt, now) * RECENCY_WEIGHT
                + impactComponent(hasUser, distinctUsers) * IMPACT_WEIGHT;
        return clamp((int) Math.round(weighted), 0, 100);
    }

    public static int severityComponent(Severity severity) {
        if (severity == null) {
            return 10;
        }
        return switch (severity) {
            case CRITICAL -> 100;
            case HIGH -> 75;
            case MEDIUM -> 50;
            case LOW -> 25;
        };
    }

    /** 1 occurrence scores 10, 10 scores 40, 100 scores 70, 1000+ scores 100. */
    public static int frequencyComponent(long count) {
        if (count <= 1) {
            return 10;
        }
        if (count >= 1000) {
            return 100;
        }
        return clamp((int) Math.round(10 + 30 * Math.log10(count)), 10, 100);
    }

    public static int recencyComponent(Instant lastSeenAt, Instant now) {
        if (lastSeenAt == null) {
            return 10;
        }
        long hoursAgo = Duration.between(lastSeenAt, now).toHours();
        if (hoursAgo < 1) {
            return 100;
        }
        if (hoursAgo < 24) {
            return 80;
        }
        if (hoursAgo < 24 * 7) {
            return 50;
        }
        if (hoursAgo < 24 * 30) {
            return 20;
        }
        return 10;
    }

    public static int impactComponent(boolean hasUser, long distinctUsers) {
        if (!hasUser || distinctUsers <= 0) {
            return 0;
        }
        return clamp((int) Math.round(10 + 30 * Math.log10(distinctUsers + 1)), 0, 100);
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
