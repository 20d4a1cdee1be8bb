package com.faultline.core.model;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Bucket granularity used for baselines and grouped occurrence counts.
 *
 * <p>
 * Each period type knows how to align an instant to the start of its bucket
 * and how far back a baseline computed at that granularity looks.
 * </p>
 *
 * @since 1.0.0
 */
public enum PeriodType {

    HOURLY(Duration.ofDays(7)),
    DAILY(Duration.ofDays(30)),
    WEEKLY(Duration.ofDays(7L * 12));

    private final Duration lookback;

    PeriodType(Duration lookback) {
        this.lookback = lookback;
    }

    /**
     * @return how much history a baseline of this type is computed from
     */
    public Duration getLookback() {
        return lookback;
    }

    /**
     * Align an instant to the start of the bucket containing it.
     *
     * <p>
     * Weekly buckets start on Monday.
     * </p>
     *
     * @param instant the instant to align
     * @param zone    zone in which day and week boundaries are evaluated
     * @return start of the enclosing bucket
     */
    public Instant bucketStart(Instant instant, ZoneId zone) {
        ZonedDateTime zoned = instant.atZone(zone);
        return switch (this) {
            case HOURLY -> zoned.truncatedTo(ChronoUnit.HOURS).toInstant();
            case DAILY -> zoned.truncatedTo(ChronoUnit.DAYS).toInstant();
            case WEEKLY -> zoned.truncatedTo(ChronoUnit.DAYS)
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                    .toInstant();
        };
    }

    /**
     * @param bucketStart an aligned bucket start
     * @param zone        zone in which day and week boundaries are evaluated
     * @return start of the following bucket
     */
    public Instant nextBucket(Instant bucketStart, ZoneId zone) {
        ZonedDateTime zoned = bucketStart.atZone(zone);
        return switch (this) {
            case HOURLY -> zoned.plusHours(1).toInstant();
            case DAILY -> zoned.plusDays(1).toInstant();
            case WEEKLY -> zoned.plusWeeks(1).toInstant();
        };
    }
}
