package com.faultline.flink;

import com.faultline.core.aggregation.InMemoryErrorStore;
import com.faultline.core.config.FaultlineConfig;
import com.faultline.core.model.AggregationResult;
import com.faultline.core.model.ErrorSignal;
import com.faultline.core.pipeline.AnalysisScheduler;
import com.faultline.core.pipeline.ErrorPipeline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PipelineState}.
 */
class PipelineStateTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private FaultlineConfig config;
    private Clock clock;
    private InMemoryErrorStore store;
    private CollectingNotificationDispatcher dispatcher;
    private ErrorPipeline pipeline;
    private AnalysisScheduler scheduler;

    @BeforeEach
    void setUp() {
        config = new FaultlineConfig();
        config.validate();
        clock = Clock.fixed(T0, ZoneOffset.UTC);
        store = new InMemoryErrorStore(config.activeWindow());
        dispatcher = new CollectingNotificationDispatcher(clock);
        pipeline = ErrorPipeline.create(config, store, dispatcher, clock);
        scheduler = new AnalysisScheduler(pipeline, config, clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    @DisplayName("Should continue counting after a restore without announcing the error again")
    void shouldContinueAfterRestore() throws Exception {
        AggregationResult created = pipeline.process(signal("NoMethodError")).orElseThrow();
        assertThat(dispatcher.drain()).hasSize(1);
        scheduler.resumeFrom(T0.minusSeconds(60));

        PipelineState restored = checkpointAndRead();
        InMemoryErrorStore freshStore = new InMemoryErrorStore(config.activeWindow());
        CollectingNotificationDispatcher freshDispatcher = new CollectingNotificationDispatcher(clock);
        restored.restoreStore(freshStore);
        ErrorPipeline freshPipeline = ErrorPipeline.create(config, freshStore, freshDispatcher, clock);
        AnalysisScheduler freshScheduler = new AnalysisScheduler(freshPipeline, config, clock);
        restored.restorePipeline(freshPipeline, freshScheduler);

        AggregationResult again = freshPipeline.process(signal("NoMethodError")).orElseThrow();
        AggregationResult other = freshPipeline.process(signal("TypeError")).orElseThrow();

        assertThat(again.getAction()).isEqualTo(AggregationResult.Action.INCREMENTED);
        assertThat(again.getError().getId()).isEqualTo(created.getError().getId());
        assertThat(again.getError().getOccurrenceCount()).isEqualTo(2);
        assertThat(other.getError().getId()).isGreaterThan(created.getError().getId());
        assertThat(freshDispatcher.drain())
                .extracting(n -> n.getError().getErrorType())
                .containsExactly("TypeError");
        assertThat(freshStore.snapshot().occurrenceCount()).isEqualTo(3);
        assertThat(freshPipeline.getThrottler().snapshot())
                .containsAllEntriesOf(pipeline.getThrottler().snapshot());
        assertThat(freshScheduler.getCascadeWatermark()).contains(T0.minusSeconds(60));
    }

    @Test
    @DisplayName("Should leave the watermark unset when none was checkpointed")
    void shouldKeepWatermarkUnset() throws Exception {
        PipelineState restored = checkpointAndRead();
        AnalysisScheduler freshScheduler = new AnalysisScheduler(pipeline, config, clock);

        restored.restorePipeline(pipeline, freshScheduler);

        assertThat(freshScheduler.getCascadeWatermark()).isEmpty();
    }

    @Test
    @DisplayName("Decoding an empty list state should yield nothing")
    void shouldDecodeEmptyState() throws Exception {
        assertThat(AggregationProcessFunction.decode(Collections.emptyList())).isNull();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private PipelineState checkpointAndRead() throws Exception {
        byte[] bytes = AggregationProcessFunction.encode(PipelineState.capture(store, pipeline, scheduler));
        return AggregationProcessFunction.decode(List.of(bytes));
    }

    private static ErrorSignal signal(String type) {
        return ErrorSignal.builder()
                .type(type)
                .message("undefined method 'total' for nil")
                .stackFrames("/app/models/order.rb:12:in `total'")
                .build();
    }
}
