package com.faultline.core.pipeline;

import com.faultline.core.aggregation.ErrorStore;
import com.faultline.core.config.FaultlineConfig;
import com.faultline.core.correlation.ErrorCorrelation;
import com.faultline.core.correlation.ErrorCorrelationAnalyzer;
import com.faultline.core.correlation.TrendDirection;
import com.faultline.core.model.ErrorOccurrence;
import com.faultline.core.model.PeriodType;
import com.faultline.core.pattern.CascadeDetection;
import com.faultline.core.pattern.CascadeDetector;
import com.faultline.core.pattern.CascadeTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Periodic history analysis, off the ingestion path.
 *
 * <h3>Each run</h3>
 * <ol>
 * <li>Refresh baselines for every (error type, platform) seen in the
 * look-back window.</li>
 * <li>Detect cascades among occurrences not yet analysed and record them.</li>
 * <li>Report strongly correlated error types with their day-over-day trend.</li>
 * <li>Prune throttle state and expired occurrences.</li>
 * </ol>
 *
 * <p>
 * A parent occurrence is only paired once it was stored more than the cascade
 * delay ago, so every child that could follow it is already visible; a
 * watermark on the storage time keeps later runs from counting it again.
 * Parents are looked up by occurrence time within the look-back window. A failing step is logged and the
 * remaining steps still run; the schedule is never cancelled by a failure.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisScheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisScheduler.class);

    static final double STRONG_CORRELATION = 0.8;
    private static final Duration MIN_THROTTLE_RETENTION = Duration.ofHours(24);
    private static final Duration TREND_PERIOD = Duration.ofDays(1);

    private final ErrorPipeline pipeline;
    private final ErrorStore store;
    private final CascadeTracker cascadeTracker;
    private final ErrorCorrelationAnalyzer correlationAnalyzer;
    private final Duration lookback;
    private final Duration cascadeMaxDelay;
    private final Duration throttleRetention;
    private final Duration baselineAlertRetention;
    private final Clock clock;

    private Instant cascadeWatermark;
    private ScheduledExecutorService executor;

    public AnalysisScheduler(ErrorPipeline pipeline, FaultlineConfig config, Clock clock) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.store = pipeline.getStore();
        this.cascadeTracker = new CascadeTracker(store, clock);
        this.correlationAnalyzer = new ErrorCorrelationAnalyzer(store, clock, config.zone());
        this.lookback = config.analysisLookback();
        this.cascadeMaxDelay = config.cascadeMaxDelay();
        this.throttleRetention = max(config.notificationCooldown(), MIN_THROTTLE_RETENTION);
        this.baselineAlertRetention = max(config.baselineAlertCooldown(), MIN_THROTTLE_RETENTION);
    }

    /**
     * Start running {@link #runOnce()} with a fixed delay between runs.
     *
     * @throws IllegalStateException if already started
     */
    public synchronized void start(Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive, got: " + interval);
        }
        if (executor != null) {
            throw new IllegalStateException("Analysis scheduler already started");
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "faultline-analysis");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleWithFixedDelay(this::runSafely, interval.toMillis(), interval.toMillis(),
                TimeUnit.MILLISECONDS);
        LOG.info("Analysis scheduler started, interval={}", interval);
    }

    private void runSafely() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            LOG.error("Analysis run failed: {}", e.toString(), e);
        }
    }

    /**
     * Perform one analysis pass synchronously.
     */
    public synchronized AnalysisSummary runOnce() {
        Instant now = clock.instant();
        Instant windowStart = now.minus(lookback);
        List<ErrorOccurrence> window = store.findOccurrences(windowStart, now.plusNanos(1));

        int baselines = refreshBaselines(window);
        int cascades = recordCascades(now, window);
        List<ErrorCorrelation> correlations = strongCorrelations();
        Map<String, TrendDirection> trends = trends(correlations);
        prune(now);

        AnalysisSummary summary = new AnalysisSummary(baselines, cascades, correlations, trends);
        LOG.info("Analysis run complete: {}", summary);
        return summary;
    }

    private int refreshBaselines(List<ErrorOccurrence> window) {
        Set<Map.Entry<String, String>> keys = window.stream()
                .map(o -> new AbstractMap.SimpleImmutableEntry<>(o.getErrorType(), o.getPlatform()))
                .collect(Collectors.toCollection(LinkedHashSet::new));
        int refreshed = 0;
        for (Map.Entry<String, String> key : keys) {
            try {
                pipeline.getBaselineService().refresh(key.getKey(), key.getValue());
                refreshed++;
            } catch (RuntimeException e) {
                LOG.warn("Baseline refresh failed for {} on {}: {}", key.getKey(), key.getValue(), e.toString());
            }
        }
        return refreshed;
    }

    /**
     * Pairs parents by the time they were stored rather than the time they
     * occurred, so late and replayed signals are still analysed once.
     */
    private int recordCascades(Instant now, List<ErrorOccurrence> window) {
        Instant from = cascadeWatermark;
        Instant parentsUntil = now.minus(cascadeMaxDelay);
        if (from != null && !parentsUntil.isAfter(from)) {
            return 0;
        }
        try {
            List<CascadeDetection> detections = new ArrayList<>();
            for (CascadeDetection d : CascadeDetector.detect(window, cascadeMaxDelay)) {
                Instant stored = d.getParentRecordedAt();
                if ((from == null || !stored.isBefore(from)) && stored.isBefore(parentsUntil)) {
                    detections.add(d);
                }
            }
            int recorded = cascadeTracker.recordAll(detections);
            cascadeWatermark = parentsUntil;
            return recorded;
        } catch (RuntimeException e) {
            LOG.error("Cascade detection failed: {}", e.toString(), e);
            return 0;
        }
    }

    private List<ErrorCorrelation> strongCorrelations() {
        try {
            List<ErrorCorrelation> strong = correlationAnalyzer.correlate(lookback, STRONG_CORRELATION);
            return strong;
        } catch (RuntimeException e) {
            LOG.warn("Correlation analysis failed: {}", e.toString());
            return List.of();
        }
    }

    private Map<String, TrendDirection> trends(List<ErrorCorrelation> correlations) {
        Map<String, TrendDirection> trends = new TreeMap<>();
        try {
            for (ErrorCorrelation c : correlations) {
                trends.computeIfAbsent(c.getErrorTypeA(), t -> correlationAnalyzer.trend(t, TREND_PERIOD));
                trends.computeIfAbsent(c.getErrorTypeB(), t -> correlationAnalyzer.trend(t, TREND_PERIOD));
                LOG.info("Correlated errors {} ({}) and {} ({}): r={}", c.getErrorTypeA(),
                        trends.get(c.getErrorTypeA()), c.getErrorTypeB(), trends.get(c.getErrorTypeB()),
                        c.getCoefficient());
            }
        } catch (RuntimeException e) {
            LOG.warn("Trend analysis failed: {}", e.toString());
        }
        return trends;
    }

    private void prune(Instant now) {
        try {
            pipeline.getThrottler().prune(throttleRetention);
            pipeline.getBaselineAlertThrottler().prune(baselineAlertRetention);
            Duration retention = max(lookback, PeriodType.WEEKLY.getLookback().plus(Duration.ofDays(7)));
            int removed = store.pruneOccurrences(now.minus(retention));
            if (removed > 0) {
                LOG.debug("Pruned {} expired occurrences", removed);
            }
        } catch (RuntimeException e) {
            LOG.warn("Pruning failed: {}", e.toString());
        }
    }

    /**
     * @return storage time up to which parents have been paired, empty before
     *         the first run
     */
    public synchronized Optional<Instant> getCascadeWatermark() {
        return Optional.ofNullable(cascadeWatermark);
    }

    /**
     * Continue cascade pairing from a watermark saved by an earlier instance.
     */
    public synchronized void resumeFrom(Instant watermark) {
        this.cascadeWatermark = watermark;
    }

    @Override
    public synchronized void close() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Analysis scheduler did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor = null;
        LOG.info("Analysis scheduler stopped");
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
