package com.faultline.core.notification;

import com.faultline.core.classification.SeverityClassifier;
import com.faultline.core.model.AggregatedError;
import com.faultline.core.model.ErrorSignal;
import com.faultline.core.model.Severity;
import com.faultline.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link NotificationThrottler}.
 */
class NotificationThrottlerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private MutableClock clock;
    private NotificationThrottler throttler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        throttler = new NotificationThrottler(new SeverityClassifier(), Severity.MEDIUM,
                Duration.ofMinutes(5), List.of(10, 50, 100), clock);
    }

    @Test
    @DisplayName("Should suppress within the cooldown and allow after it")
    void shouldApplyCooldown() {
        AggregatedError record = record("NoMethodError", "fp1", 1);

        assertThat(throttler.shouldNotify(record)).isTrue();
        throttler.recordNotification(record);

        clock.advance(Duration.ofMinutes(4));
        assertThat(throttler.shouldNotify(record)).isFalse();

        clock.advance(Duration.ofMinutes(2));
        assertThat(throttler.shouldNotify(record)).isTrue();
    }

    @Test
    @DisplayName("Cooldown should be tracked per fingerprint")
    void shouldTrackFingerprintsIndependently() {
        throttler.recordNotification(record("NoMethodError", "fp1", 1));

        assertThat(throttler.shouldNotify(record("NoMethodError", "fp2", 1))).isTrue();
    }

    @Test
    @DisplayName("Should block severities below the minimum")
    void shouldEnforceMinimumSeverity() {
        assertThat(throttler.shouldNotify(record("com.acme.Whatever", "fp1", 1))).isFalse();
        assertThat(throttler.shouldNotify(record("Net::ReadTimeout", "fp2", 1))).isTrue();
    }

    @Test
    @DisplayName("Should report only exact occurrence milestones")
    void shouldDetectThresholds() {
        assertThat(throttler.thresholdReached(record("TypeError", "fp1", 10))).isTrue();
        assertThat(throttler.thresholdReached(record("TypeError", "fp1", 11))).isFalse();
        assertThat(throttler.thresholdReached(record("TypeError", "fp1", 100))).isTrue();
    }

    @Test
    @DisplayName("Should fail open when the check itself breaks")
    void shouldFailOpen() {
        SeverityClassifier broken = new SeverityClassifier() {
            @Override
            public Severity classify(String errorType) {
                throw new IllegalStateException("classifier down");
            }
        };
        NotificationThrottler failing = new NotificationThrottler(broken, Severity.CRITICAL,
                Duration.ofMinutes(5), List.of(), clock);

        assertThat(failing.shouldNotify(record("TypeError", "fp1", 1))).isTrue();
    }

    @Test
    @DisplayName("A zero cooldown should never suppress")
    void shouldIgnoreZeroCooldown() {
        NotificationThrottler noCooldown = new NotificationThrottler(new SeverityClassifier(), Severity.LOW,
                Duration.ZERO, List.of(), clock);
        AggregatedError record = record("TypeError", "fp1", 1);
        noCooldown.recordNotification(record);

        assertThat(noCooldown.shouldNotify(record)).isTrue();
    }

    @Test
    @DisplayName("Prune should forget old entries and clear should forget all")
    void shouldPruneAndClear() {
        throttler.recordNotification(record("TypeError", "old", 1));
        clock.advance(Duration.ofHours(2));
        throttler.recordNotification(record("TypeError", "new", 1));

        assertThat(throttler.prune(Duration.ofHours(1))).isEqualTo(1);
        assertThat(throttler.trackedCount()).isEqualTo(1);

        throttler.clear();
        assertThat(throttler.trackedCount()).isZero();
    }

    @Test
    @DisplayName("Restored cooldowns should keep suppressing notifications")
    void shouldRestoreCooldowns() {
        AggregatedError record = record("NoMethodError", "fp1", 1);
        throttler.recordNotification(record);
        Map<String, Instant> saved = throttler.snapshot();
        throttler.clear();

        throttler.restore(saved);

        assertThat(throttler.trackedCount()).isEqualTo(1);
        assertThat(throttler.shouldNotify(record)).isFalse();
        assertThat(throttler.shouldNotify(record("NoMethodError", "fp2", 1))).isTrue();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static AggregatedError record(String type, String fingerprint, long count) {
        ErrorSignal signal = ErrorSignal.builder().type(type).message("m").build();
        AggregatedError record = AggregatedError.firstOccurrence(fingerprint, signal, "API", T0);
        record.setOccurrenceCount(count);
        return record;
    }
}
