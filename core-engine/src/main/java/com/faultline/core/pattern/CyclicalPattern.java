package com.faultline.core.pattern;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Result of {@link CyclicalPatternDetector#analyze(List)}.
 *
 * <p>
 * Weekday keys run from 0 (Sunday) to 6 (Saturday). Distributions only
 * contain buckets with at least one occurrence.
 * </p>
 *
 * @since 1.0.0
 */
public final class CyclicalPattern {

    static final CyclicalPattern EMPTY = new CyclicalPattern(PatternType.NONE, List.of(),
            new TreeMap<>(), new TreeMap<>(), 0.0, 0);

    private final PatternType type;
    private final List<Integer> peakHours;
    private final SortedMap<Integer, Long> hourlyDistribution;
    private final SortedMap<Integer, Long> weekdayDistribution;
    private final double strength;
    private final long totalCount;

    CyclicalPattern(PatternType type, List<Integer> peakHours, SortedMap<Integer, Long> hourlyDistribution,
            SortedMap<Integer, Long> weekdayDistribution, double strength, long totalCount) {
        this.type = type;
        this.peakHours = List.copyOf(peakHours);
        this.hourlyDistribution = Collections.unmodifiableSortedMap(new TreeMap<>(hourlyDistribution));
        this.weekdayDistribution = Collections.unmodifiableSortedMap(new TreeMap<>(weekdayDistribution));
        this.strength = strength;
        this.totalCount = totalCount;
    }

    public PatternType getType() {
        return type;
    }

    public List<Integer> getPeakHours() {
        return peakHours;
    }

    public SortedMap<Integer, Long> getHourlyDistribution() {
        return hourlyDistribution;
    }

    public SortedMap<Integer, Long> getWeekdayDistribution() {
        return weekdayDistribution;
    }

    /** Coefficient of variation of the hourly histogram, in [0, 1]. */
    public double getStrength() {
        return strength;
    }

    public long getTotalCount() {
        return totalCount;
    }

    @Override
    public String toString() {
        return "CyclicalPattern{type=" + type + ", peakHours=" + peakHours
                + ", strength=" + strength + ", total=" + totalCount + '}';
    }
}
