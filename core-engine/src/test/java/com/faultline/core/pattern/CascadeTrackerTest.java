package com.faultline.core.pattern;

import com.faultline.core.aggregation.InMemoryErrorStore;
import com.faultline.core.model.AggregatedError;
import com.faultline.core.model.CascadePattern;
import com.faultline.core.model.ErrorOccurrence;
import com.faultline.core.model.ErrorSignal;
import com.faultline.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link CascadeTracker}.
 */
class CascadeTrackerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private InMemoryErrorStore store;
    private CascadeTracker tracker;

    @BeforeEach
    void setUp() {
        store = new InMemoryErrorStore();
        tracker = new CascadeTracker(store, new MutableClock(T0));
    }

    @Test
    @DisplayName("First detection should set frequency 1 and the observed delay")
    void shouldCreateEdge() {
        CascadePattern pattern = tracker.record(new CascadeDetection(1, 2, 12.5, T0));

        assertThat(pattern.getFrequency()).isEqualTo(1);
        assertThat(pattern.getAvgDelaySeconds()).isEqualTo(12.5);
        assertThat(pattern.getLastDetectedAt()).isEqualTo(T0);
        assertThat(pattern.getCascadeProbability()).isNull();
    }

    @Test
    @DisplayName("Should update the running mean of the delay")
    void shouldUpdateRunningMean() {
        CascadePattern existing = new CascadePattern(1, 2);
        existing.setFrequency(3);
        existing.setAvgDelaySeconds(15.0);
        store.upsertCascade(existing);

        CascadePattern updated = tracker.record(new CascadeDetection(1, 2, 27.0, T0));

        assertThat(updated.getFrequency()).isEqualTo(4);
        assertThat(updated.getAvgDelaySeconds()).isCloseTo(18.0, within(1e-9));
        assertThat(store.findCascade(1, 2)).get().extracting(CascadePattern::getFrequency).isEqualTo(4);
    }

    @Test
    @DisplayName("Probability should be frequency over the parent's occurrence count")
    void shouldComputeProbability() {
        long parent = insertParent(8);

        int recorded = tracker.recordAll(List.of(
                new CascadeDetection(parent, 99, 5, T0),
                new CascadeDetection(parent, 99, 5, T0.plusSeconds(1)),
                new CascadeDetection(parent, 99, 5, T0.plusSeconds(2))));

        assertThat(recorded).isEqualTo(3);
        assertThat(store.findCascade(parent, 99).orElseThrow().getCascadeProbability()).isEqualTo(0.375);
    }

    @Test
    @DisplayName("Pruning old occurrences should not inflate the probability")
    void shouldIgnorePrunedOccurrences() {
        long parent = insertParent(4);
        for (int i = 0; i < 4; i++) {
            store.recordOccurrence(new ErrorOccurrence(parent, "acme", "E1", "API", T0.plusSeconds(i), null));
        }
        tracker.recordAll(List.of(
                new CascadeDetection(parent, 99, 5, T0),
                new CascadeDetection(parent, 99, 5, T0.plusSeconds(1)),
                new CascadeDetection(parent, 99, 5, T0.plusSeconds(2))));
        store.pruneOccurrences(T0.plusSeconds(3));

        CascadePattern pattern = tracker.record(new CascadeDetection(parent, 99, 5, T0.plusSeconds(3)));

        assertThat(store.countOccurrences(parent)).isEqualTo(1);
        assertThat(pattern.getFrequency()).isEqualTo(4);
        assertThat(pattern.getCascadeProbability()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Probability should stay unset when the parent record is unknown")
    void shouldSkipProbabilityForUnknownParent() {
        store.recordOccurrence(new ErrorOccurrence(42, "acme", "E1", "API", T0, null));

        CascadePattern pattern = tracker.record(new CascadeDetection(42, 99, 5, T0));

        assertThat(pattern.getCascadeProbability()).isNull();
    }

    @Test
    @DisplayName("Probability should round to three decimals")
    void shouldRoundProbability() {
        assertThat(CascadeTracker.probability(1, 3)).isEqualTo(0.333);
        assertThat(CascadeTracker.runningMean(10.0, 2, 20.0)).isEqualTo(15.0);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private long insertParent(long occurrenceCount) {
        AggregatedError parent = AggregatedError.firstOccurrence("fp-parent",
                ErrorSignal.builder().type("E1").message("boom").tenantId("acme").build(), "API", T0);
        parent.setOccurrenceCount(occurrenceCount);
        return store.insert(parent).getId();
    }
}
