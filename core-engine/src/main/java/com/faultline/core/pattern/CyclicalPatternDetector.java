package com.faultline.core.pattern;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Classifies when an error tends to happen during the day and week.
 *
 * <h3>Algorithm</h3>
 * <p>
 * Occurrences are bucketed by hour of day and day of week in the configured
 * zone. A peak hour has more than twice the average hourly count (total / 24).
 * Rules are checked in order: business hours, night, weekend, uniform.
 * </p>
 *
 * @since 1.0.0
 */
public class CyclicalPatternDetector {

    private static final int HOURS_PER_DAY = 24;
    private static final int MIN_BUSINESS_PEAKS = 3;
    private static final int MIN_NIGHT_PEAKS = 2;

    private final ZoneId zone;

    public CyclicalPatternDetector(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public CyclicalPattern analyze(List<Instant> timestamps) {
        Objects.requireNonNull(timestamps, "timestamps must not be null");
        if (timestamps.isEmpty()) {
            return CyclicalPattern.EMPTY;
        }

        SortedMap<Integer, Long> hourly = new TreeMap<>();
        SortedMap<Integer, Long> weekday = new TreeMap<>();
        for (Instant ts : timestamps) {
            ZonedDateTime local = ts.atZone(zone);
            hourly.merge(local.getHour(), 1L, Long::sum);
            // DayOfWeek is 1 (Monday) .. 7 (Sunday); shift so Sunday is 0
            weekday.merge(local.getDayOfWeek().getValue() % 7, 1L, Long::sum);
        }

        long total = timestamps.size();
        List<Integer> peaks = peakHours(hourly, total);
        PatternType type = classify(peaks, weekday, total);
        return new CyclicalPattern(type, peaks, hourly, weekday, strength(hourly, total), total);
    }

    static List<Integer> peakHours(Map<Integer, Long> hourly, long total) {
        double average = (double) total / HOURS_PER_DAY;
        List<Integer> peaks = new ArrayList<>();
        hourly.forEach((hour, count) -> {
            if (count > average * 2) {
                peaks.add(hour);
            }
        });
        peaks.sort(null);
        return peaks;
    }

    private static PatternType classify(List<Integer> peaks, Map<Integer, Long> weekday, long total) {
        long businessPeaks = peaks.stream().filter(h -> h >= 9 && h <= 17).count();
        if (businessPeaks >= MIN_BUSINESS_PEAKS) {
            return PatternType.BUSINESS_HOURS;
        }
        long nightPeaks = peaks.stream().filter(h -> h >= 0 && h <= 6).count();
        if (nightPeaks >= MIN_NIGHT_PEAKS) {
            return PatternType.NIGHT;
        }
        long weekend = weekday.getOrDefault(0, 0L) + weekday.getOrDefault(6, 0L);
        if (weekend > total * 0.5) {
            return PatternType.WEEKEND;
        }
        return PatternType.UNIFORM;
    }

    /**
     * Coefficient of variation over all 24 hours, rounded to 2 decimals and
     * capped at 1.0.
     */
    static double strength(Map<Integer, Long> hourly, long total) {
        if (total == 0) {
            return 0.0;
        }
        double mean = (double) total / HOURS_PER_DAY;
        double variance = 0;
        for (int hour = 0; hour < HOURS_PER_DAY; hour++) {
            double diff = hourly.getOrDefault(hour, 0L) - mean;
            variance += diff * diff;
        }
        double cv = Math.sqrt(variance / HOURS_PER_DAY) / mean;
        return Math.min(Math.round(cv * 100) / 100.0, 1.0);
    }
}
