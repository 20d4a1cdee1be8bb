package com.faultline.flink;

import com.faultline.core.aggregation.InMemoryErrorStore;
import com.faultline.core.config.FaultlineConfig;
import com.faultline.core.model.AggregationResult;
import com.faultline.core.model.ErrorSignal;
import com.faultline.core.pipeline.AnalysisScheduler;
import com.faultline.core.pipeline.ErrorPipeline;
import org.apache.flink.api.common.state.ListState;
import org.apache.flink.api.common.state.ListStateDescriptor;
import org.apache.flink.api.common.typeinfo.PrimitiveArrayTypeInfo;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.runtime.state.FunctionInitializationContext;
import org.apache.flink.runtime.state.FunctionSnapshotContext;
import org.apache.flink.streaming.api.checkpoint.CheckpointedFunction;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.InstantiationUtil;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs the Faultline ingestion pipeline for signals keyed by
 * {@code tenant|fingerprint}.
 *
 * <p>
 * The operator runs with parallelism 1: baselines, anomaly counts, distinct
 * users and cascades all span many keys, so one {@link ErrorPipeline} over
 * one {@link InMemoryErrorStore} sees every signal. Aggregation results go to
 * the main output; notifications go to {@link #NOTIFICATIONS}.
 * </p>
 *
 * <h3>State Management</h3>
 * <p>
 * The store, both cooldown tables and the cascade watermark are written to
 * operator list state on every checkpoint and restored before {@link #open}
 * builds the pipeline, so a restart neither forgets records nor re-announces
 * them as first occurrences.
 * </p>
 *
 * <h3>Background analysis</h3>
 * <p>
 * An {@link AnalysisScheduler} refreshes baselines, records cascades and
 * prunes throttler state at a fixed interval.
 * </p>
 *
 * @since 1.0.0
 */
public class AggregationProcessFunction
        extends KeyedProcessFunction<String, ErrorSignal, AggregationResult>
        implements CheckpointedFunction {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AggregationProcessFunction.class);

    /** Side output for notification requests. */
    public static final OutputTag<ErrorNotification> NOTIFICATIONS =
            new OutputTag<ErrorNotification>("notifications") {
                private static final long serialVersionUID = 1L;
            };

    private final FaultlineConfig config;
    private final int analysisIntervalMinutes;

    private transient ListState<byte[]> checkpointedState;
    private transient PipelineState restoredState;

    private transient InMemoryErrorStore store;
    private transient ErrorPipeline pipeline;
    private transient CollectingNotificationDispatcher dispatcher;
    private transient AnalysisScheduler scheduler;
    private transient FaultlineMetrics metrics;

    /**
     * @param config                  validated Faultline configuration
     * @param analysisIntervalMinutes delay between background analysis runs
     */
    public AggregationProcessFunction(FaultlineConfig config, int analysisIntervalMinutes) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        if (analysisIntervalMinutes < 1) {
            throw new IllegalArgumentException(
                    "analysisIntervalMinutes must be >= 1, got: " + analysisIntervalMinutes);
        }
        this.analysisIntervalMinutes = analysisIntervalMinutes;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void initializeState(FunctionInitializationContext context) throws Exception {
        ListStateDescriptor<byte[]> descriptor = new ListStateDescriptor<>(
                "faultline-pipeline-state", PrimitiveArrayTypeInfo.BYTE_PRIMITIVE_ARRAY_TYPE_INFO);
        checkpointedState = context.getOperatorStateStore().getListState(descriptor);
        if (context.isRestored()) {
            restoredState = decode(checkpointedState.get());
            LOG.info("Restoring {}", restoredState);
        }
    }

    @Override
    public void open(Configuration parameters) {
        Clock clock = Clock.systemUTC();
        dispatcher = new CollectingNotificationDispatcher(clock);
        store = new InMemoryErrorStore(config.activeWindow());
        if (restoredState != null) {
            restoredState.restoreStore(store);
        }
        pipeline = ErrorPipeline.create(config, store, dispatcher, clock);
        scheduler = new AnalysisScheduler(pipeline, config, clock);
        if (restoredState != null) {
            restoredState.restorePipeline(pipeline, scheduler);
            restoredState = null;
        }
        scheduler.start(Duration.ofMinutes(analysisIntervalMinutes));

        metrics = new FaultlineMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("AggregationProcessFunction opened, analysis every {} minute(s)", analysisIntervalMinutes);
    }

    @Override
    public void close() {
        LOG.info("AggregationProcessFunction closing");
        if (scheduler != null) {
            scheduler.close();
        }
    }

    @Override
    public void snapshotState(FunctionSnapshotContext context) throws Exception {
        PipelineState state = PipelineState.capture(store, pipeline, scheduler);
        checkpointedState.update(Collections.singletonList(encode(state)));
        LOG.debug("Checkpoint {}: {}", context.getCheckpointId(), state);
    }

    static byte[] encode(PipelineState state) throws IOException {
        return InstantiationUtil.serializeObject(state);
    }

    /**
     * @return the last stored state, or {@code null} if none was stored
     */
    static PipelineState decode(Iterable<byte[]> entries) throws IOException, ClassNotFoundException {
        PipelineState state = null;
        for (byte[] bytes : entries) {
            state = InstantiationUtil.deserializeObject(bytes, PipelineState.class.getClassLoader());
        }
        return state;
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(ErrorSignal signal,
            KeyedProcessFunction<String, ErrorSignal, AggregationResult>.Context ctx,
            Collector<AggregationResult> out) {
        long startNanos = System.nanoTime();

        Optional<AggregationResult> result = pipeline.process(signal);
        result.ifPresent(r -> {
            out.collect(r);
            if (r.isFirstOccurrence()) {
                metrics.incrementErrorsCreated();
            } else if (r.isJustReopened()) {
                metrics.incrementErrorsReopened();
            }
        });

        List<ErrorNotification> notifications = dispatcher.drain();
        for (ErrorNotification notification : notifications) {
            ctx.output(NOTIFICATIONS, notification);
        }
        if (!notifications.isEmpty()) {
            metrics.incrementNotifications(notifications.size());
            LOG.debug("Emitted {} notification(s) for key={}", notifications.size(), ctx.getCurrentKey());
        }

        metrics.incrementSignalsProcessed();
        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
    }
}
