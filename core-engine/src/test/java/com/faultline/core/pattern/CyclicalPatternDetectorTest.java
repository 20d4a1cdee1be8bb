package com.faultline.core.pattern;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CyclicalPatternDetector}.
 */
class CyclicalPatternDetectorTest {

    // A Wednesday
    private static final Instant WEDNESDAY = Instant.parse("2024-03-06T00:00:00Z");
    // A Saturday
    private static final Instant SATURDAY = Instant.parse("2024-03-02T00:00:00Z");

    private final CyclicalPatternDetector detector = new CyclicalPatternDetector(ZoneOffset.UTC);

    @Test
    @DisplayName("Should detect business-hours errors")
    void shouldDetectBusinessHours() {
        List<Instant> ts = new ArrayList<>();
        for (int hour = 9; hour <= 12; hour++) {
            addAtHour(ts, WEDNESDAY, hour, 5);
        }
        addAtHour(ts, WEDNESDAY, 20, 1);

        CyclicalPattern pattern = detector.analyze(ts);

        assertThat(pattern.getType()).isEqualTo(PatternType.BUSINESS_HOURS);
        assertThat(pattern.getPeakHours()).containsExactly(9, 10, 11, 12);
        assertThat(pattern.getTotalCount()).isEqualTo(21);
        assertThat(pattern.getStrength()).isBetween(0.0, 1.0);
    }

    @Test
    @DisplayName("Should detect night-time errors")
    void shouldDetectNight() {
        List<Instant> ts = new ArrayList<>();
        addAtHour(ts, WEDNESDAY, 1, 5);
        addAtHour(ts, WEDNESDAY, 2, 5);
        addAtHour(ts, WEDNESDAY, 14, 1);

        assertThat(detector.analyze(ts).getType()).isEqualTo(PatternType.NIGHT);
    }

    @Test
    @DisplayName("Should detect weekend errors spread over the day")
    void shouldDetectWeekend() {
        List<Instant> ts = new ArrayList<>();
        for (int hour = 0; hour < 24; hour++) {
            addAtHour(ts, SATURDAY, hour, 1);
        }

        CyclicalPattern pattern = detector.analyze(ts);

        assertThat(pattern.getType()).isEqualTo(PatternType.WEEKEND);
        assertThat(pattern.getWeekdayDistribution()).containsEntry(6, 24L);
    }

    @Test
    @DisplayName("Should report a flat weekday distribution as uniform with zero strength")
    void shouldDetectUniform() {
        List<Instant> ts = new ArrayList<>();
        for (int hour = 0; hour < 24; hour++) {
            addAtHour(ts, WEDNESDAY, hour, 2);
        }

        CyclicalPattern pattern = detector.analyze(ts);

        assertThat(pattern.getType()).isEqualTo(PatternType.UNIFORM);
        assertThat(pattern.getPeakHours()).isEmpty();
        assertThat(pattern.getStrength()).isZero();
    }

    @Test
    @DisplayName("Should return an empty pattern for no data")
    void shouldHandleEmptyInput() {
        CyclicalPattern pattern = detector.analyze(List.of());

        assertThat(pattern.getType()).isEqualTo(PatternType.NONE);
        assertThat(pattern.getTotalCount()).isZero();
    }

    private static void addAtHour(List<Instant> ts, Instant day, int hour, int count) {
        for (int i = 0; i < count; i++) {
            ts.add(day.plus(Duration.ofHours(hour)).plusSeconds(i));
        }
    }
}
