package com.faultline.core.pattern;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link BurstDetector}.
 */
class BurstDetectorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    @DisplayName("Five events 30s apart should form one LOW burst")
    void shouldDetectSingleBurst() {
        List<Burst> bursts = BurstDetector.detect(spaced(T0, 5, 30));

        assertThat(bursts).hasSize(1);
        Burst burst = bursts.get(0);
        assertThat(burst.getCount()).isEqualTo(5);
        assertThat(burst.getStart()).isEqualTo(T0);
        assertThat(burst.getEnd()).isEqualTo(T0.plusSeconds(120));
        assertThat(burst.getDurationSeconds()).isEqualTo(120.0);
        assertThat(burst.getIntensity()).isEqualTo(BurstIntensity.LOW);
    }

    @Test
    @DisplayName("Four events should not form a burst")
    void shouldIgnoreShortRuns() {
        assertThat(BurstDetector.detect(spaced(T0, 4, 30))).isEmpty();
    }

    @Test
    @DisplayName("A gap over 60 seconds should split runs")
    void shouldSplitOnLargeGap() {
        List<Instant> ts = new ArrayList<>(spaced(T0, 6, 60));
        ts.addAll(spaced(T0.plusSeconds(1000), 12, 5));

        List<Burst> bursts = BurstDetector.detect(ts);

        assertThat(bursts).extracting(Burst::getCount).containsExactly(6, 12);
        assertThat(bursts.get(1).getIntensity()).isEqualTo(BurstIntensity.MEDIUM);
    }

    @Test
    @DisplayName("Should sort unordered input")
    void shouldSortInput() {
        List<Instant> ts = new ArrayList<>(spaced(T0, 20, 1));
        Collections.reverse(ts);

        List<Burst> bursts = BurstDetector.detect(ts);

        assertThat(bursts).hasSize(1);
        assertThat(bursts.get(0).getIntensity()).isEqualTo(BurstIntensity.HIGH);
        assertThat(bursts.get(0).getStart()).isEqualTo(T0);
    }

    private static List<Instant> spaced(Instant start, int count, long gapSeconds) {
        List<Instant> ts = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            ts.add(start.plusSeconds(i * gapSeconds));
        }
        return ts;
    }
}
