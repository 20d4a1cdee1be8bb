package com.faultline.core.pipeline;

import com.faultline.core.aggregation.InMemoryErrorStore;
import com.faultline.core.config.ConfigLoader;
import com.faultline.core.config.FaultlineConfig;
import com.faultline.core.correlation.TrendDirection;
import com.faultline.core.model.CascadePattern;
import com.faultline.core.model.ErrorSignal;
import com.faultline.core.model.PeriodType;
import com.faultline.core.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalysisScheduler}.
 */
class AnalysisSchedulerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private MutableClock clock;
    private InMemoryErrorStore store;
    private ErrorPipeline pipeline;
    private AnalysisScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryErrorStore();
        FaultlineConfig config = ConfigLoader.defaults();
        pipeline = ErrorPipeline.create(config, store, (error, anomaly) -> {
        }, clock);
        scheduler = new AnalysisScheduler(pipeline, config, clock);

        pipeline.process(signal("Redis::ConnectionError", T0));
        pipeline.process(signal("ActiveRecord::StatementInvalid", T0.plusSeconds(10)));
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    @DisplayName("Should refresh baselines, record cascades and find correlations")
    void shouldRunAllAnalyses() {
        clock.advance(Duration.ofMinutes(5));

        AnalysisSummary summary = scheduler.runOnce();

        assertThat(summary.getBaselinesRefreshed()).isEqualTo(2);
        assertThat(summary.getCascadesRecorded()).isEqualTo(1);
        assertThat(summary.getStrongCorrelations()).hasSize(1);
        assertThat(summary.getTrends())
                .containsEntry("Redis::ConnectionError", TrendDirection.INCREASING_SIGNIFICANTLY)
                .containsEntry("ActiveRecord::StatementInvalid", TrendDirection.INCREASING_SIGNIFICANTLY);
        assertThat(store.findBaseline("Redis::ConnectionError", "API", PeriodType.DAILY)).isPresent();
        CascadePattern cascade = store.findCascade(1, 2).orElseThrow();
        assertThat(cascade.getAvgDelaySeconds()).isEqualTo(10.0);
        assertThat(cascade.getCascadeProbability()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should not count the same cascade twice across runs")
    void shouldNotDoubleCountCascades() {
        clock.advance(Duration.ofMinutes(5));
        scheduler.runOnce();
        clock.advance(Duration.ofMinutes(5));

        AnalysisSummary second = scheduler.runOnce();

        assertThat(second.getCascadesRecorded()).isZero();
        assertThat(store.findCascade(1, 2).orElseThrow().getFrequency()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should pair signals that arrive after an earlier run")
    void shouldPairLateSignals() {
        clock.advance(Duration.ofMinutes(5));
        scheduler.runOnce();

        Instant lateOccurrence = T0.minus(Duration.ofHours(1));
        pipeline.process(signal("Net::ReadTimeout", lateOccurrence));
        pipeline.process(signal("Faraday::TimeoutError", lateOccurrence.plusSeconds(10)));
        clock.advance(Duration.ofMinutes(10));

        AnalysisSummary summary = scheduler.runOnce();

        assertThat(summary.getCascadesRecorded()).isEqualTo(1);
        assertThat(store.findCascade(3, 4)).isPresent();
        assertThat(scheduler.runOnce().getCascadesRecorded()).isZero();
    }

    @Test
    @DisplayName("Should wait for the cascade delay before pairing recent parents")
    void shouldDeferRecentParents() {
        clock.advance(Duration.ofSeconds(30));

        assertThat(scheduler.runOnce().getCascadesRecorded()).isZero();
    }

    @Test
    @DisplayName("Should reject invalid intervals and double starts")
    void shouldGuardStart() {
        assertThatThrownBy(() -> scheduler.start(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);

        scheduler.start(Duration.ofMinutes(15));
        assertThatThrownBy(() -> scheduler.start(Duration.ofMinutes(15))).isInstanceOf(IllegalStateException.class);
    }

    private static ErrorSignal signal(String type, Instant at) {
        return ErrorSignal.builder().type(type).message("connection lost").occurredAt(at).build();
    }
}
