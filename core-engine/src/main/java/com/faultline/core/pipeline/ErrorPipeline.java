package com.faultline.core.pipeline;

import com.faultline.core.aggregation.AggregationEngine;
import com.faultline.core.aggregation.ErrorStore;
import com.faultline.core.baseline.BaselineAlertThrottler;
import com.faultline.core.baseline.BaselineService;
import com.faultline.core.classification.ExceptionFilter;
import com.faultline.core.classification.PriorityScoreCalculator;
import com.faultline.core.classification.SeverityClassifier;
import com.faultline.core.config.FaultlineConfig;
import com.faultline.core.fingerprint.FingerprintGenerator;
import com.faultline.core.fingerprint.FingerprintStrategy;
import com.faultline.core.model.AggregatedError;
import com.faultline.core.model.AggregationResult;
import com.faultline.core.model.AnomalyInfo;
import com.faultline.core.model.AnomalyLevel;
import com.faultline.core.model.ErrorSignal;
import com.faultline.core.notification.NotificationDispatcher;
import com.faultline.core.notification.NotificationThrottler;
import com.faultline.core.util.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Ingestion path for a single signal.
 *
 * <h3>Flow</h3>
 * <ol>
 * <li>Validate: signals without type or message are rejected.</li>
 * <li>Filter: ignore rules and sampling.</li>
 * <li>Fingerprint.</li>
 * <li>Aggregate.</li>
 * <li>On first occurrence or reopen: baseline anomaly check and throttled
 * notification. On a plain increment only occurrence milestones notify,
 * regardless of cooldown.</li>
 * </ol>
 *
 * <p>
 * {@link #process(ErrorSignal)} never throws. Every stage failure is logged
 * and the signal counts as not recorded, or, for the fan-out stage, the
 * notification is skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class ErrorPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(ErrorPipeline.class);

    private final ErrorStore store;
    private final ExceptionFilter filter;
    private final FingerprintGenerator fingerprints;
    private final AggregationEngine engine;
    private final NotificationThrottler throttler;
    private final BaselineService baselineService;
    private final BaselineAlertThrottler baselineAlertThrottler;
    private final NotificationDispatcher dispatcher;

    private final boolean baselineAlertsEnabled;
    private final double baselineSensitivity;
    private final Set<AnomalyLevel> baselineAlertLevels;

    public ErrorPipeline(FaultlineConfig config, ErrorStore store, ExceptionFilter filter,
            FingerprintGenerator fingerprints, AggregationEngine engine, NotificationThrottler throttler,
            BaselineService baselineService, BaselineAlertThrottler baselineAlertThrottler,
            NotificationDispatcher dispatcher) {
        Objects.requireNonNull(config, "config must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.filter = Objects.requireNonNull(filter, "filter must not be null");
        this.fingerprints = Objects.requireNonNull(fingerprints, "fingerprints must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.throttler = Objects.requireNonNull(throttler, "throttler must not be null");
        this.baselineService = Objects.requireNonNull(baselineService, "baselineService must not be null");
        this.baselineAlertThrottler = Objects.requireNonNull(baselineAlertThrottler,
                "baselineAlertThrottler must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.baselineAlertsEnabled = config.isEnableBaselineAlerts();
        this.baselineSensitivity = config.getBaselineAlertThresholdStdDevs();
        this.baselineAlertLevels = config.baselineAlertLevels();
    }

    /**
     * Wire a pipeline from a validated configuration.
     */
    public static ErrorPipeline create(FaultlineConfig config, ErrorStore store,
            NotificationDispatcher dispatcher, Clock clock) {
        return create(config, store, dispatcher, clock, null);
    }

    /**
     * @param fingerprintStrategy optional custom fingerprint, may be {@code null}
     */
    public static ErrorPipeline create(FaultlineConfig config, ErrorStore store,
            NotificationDispatcher dispatcher, Clock clock, FingerprintStrategy fingerprintStrategy) {
        SeverityClassifier severity = new SeverityClassifier(config.severityOverrideTable());
        ExceptionFilter filter = new ExceptionFilter(config.getIgnoredExceptions(), config.getSamplingRate(),
                severity);
        FingerprintGenerator fingerprints = new FingerprintGenerator(config.getLibraryPathMarkers(),
                fingerprintStrategy);
        PriorityScoreCalculator priority = new PriorityScoreCalculator(severity, store, clock);
        AggregationEngine engine = new AggregationEngine(store, priority, config.activeWindow(), clock);
        NotificationThrottler throttler = new NotificationThrottler(severity,
                config.minimumNotificationSeverity(), config.notificationCooldown(),
                config.getNotificationThresholdAlerts(), clock);
        BaselineService baselines = new BaselineService(store, clock, config.zone());
        BaselineAlertThrottler baselineThrottler = new BaselineAlertThrottler(config.baselineAlertCooldown(), clock);

        LOG.info("Error pipeline created (sampling={}, minSeverity={}, cooldown={}, baselineAlerts={})",
                config.getSamplingRate(), config.minimumNotificationSeverity(), config.notificationCooldown(),
                config.isEnableBaselineAlerts());
        return new ErrorPipeline(config, store, filter, fingerprints, engine, throttler, baselines,
                baselineThrottler, dispatcher);
    }

    /**
     * Run one signal through the pipeline.
     *
     * @return the aggregation result, or empty if the signal was rejected,
     *         filtered out or could not be recorded
     */
    public Optional<AggregationResult> process(ErrorSignal signal) {
        if (signal == null) {
            LOG.warn("Rejected null signal");
            return Optional.empty();
        }
        List<String> problems = signal.validate();
        if (!problems.isEmpty()) {
            LOG.warn("Rejected malformed signal {}: {}", signal, problems);
            return Optional.empty();
        }

        Outcome<Boolean> keep = Outcome.of(() -> filter.shouldKeep(signal));
        if (!keep.orElseGet(e -> {
            LOG.warn("Filter failed for {}, keeping signal: {}", signal.getType(), e.toString());
            return true;
        })) {
            return Optional.empty();
        }

        Outcome<String> fingerprint = Outcome.of(() -> fingerprints.generate(signal));
        if (!fingerprint.isOk()) {
            LOG.error("Could not fingerprint {}: {}", signal.getType(), fingerprint.getError().get().toString());
            return Optional.empty();
        }

        Outcome<AggregationResult> aggregated = engine.aggregate(fingerprint.get(), signal);
        if (!aggregated.isOk()) {
            return Optional.empty();
        }
        AggregationResult result = aggregated.get();
        Outcome.of(() -> {
            fanOut(result);
            return null;
        }).getError().ifPresent(e -> LOG.error("Post-aggregation processing failed for error {}: {}",
                result.getError().getId(), e.toString(), e));
        return Optional.of(result);
    }

    private void fanOut(AggregationResult result) {
        AggregatedError record = result.getError();
        if (result.isFirstOccurrence() || result.isJustReopened()) {
            Optional<AnomalyInfo> anomaly = baselineAnomaly(record);
            if (anomaly.isPresent() || throttler.shouldNotify(record)) {
                notify(record, anomaly);
            } else {
                LOG.debug("Notification for {} throttled", record.getFingerprint());
            }
        } else if (throttler.thresholdReached(record)) {
            LOG.info("Error id={} reached {} occurrences", record.getId(), record.getOccurrenceCount());
            notify(record, Optional.empty());
        }
    }

    /**
     * @return the anomaly if it should accompany a notification
     */
    private Optional<AnomalyInfo> baselineAnomaly(AggregatedError record) {
        if (!baselineAlertsEnabled) {
            return Optional.empty();
        }
        String type = record.getErrorType();
        String platform = record.getPlatform();
        Outcome<AnomalyInfo> checked = Outcome.of(() -> baselineService.checkAnomaly(type, platform,
                baselineService.currentDailyCount(type, platform), baselineSensitivity));
        AnomalyInfo info = checked.orElseGet(e -> {
            LOG.warn("Anomaly check failed for {} on {}: {}", type, platform, e.toString());
            return AnomalyInfo.neutral("Anomaly check failed");
        });
        if (!info.isAnomaly() || !baselineAlertLevels.contains(info.getLevel())) {
            return Optional.empty();
        }
        if (!baselineAlertThrottler.shouldAlert(type, platform)) {
            LOG.info("Baseline alert throttled for {} on {}", type, platform);
            return Optional.empty();
        }
        baselineAlertThrottler.recordAlert(type, platform);
        return Optional.of(info);
    }

    private void notify(AggregatedError record, Optional<AnomalyInfo> anomaly) {
        Outcome<Void> sent = Outcome.of(() -> {
            dispatcher.dispatch(record.copy(), anomaly);
            return null;
        });
        if (sent.isOk()) {
            throttler.recordNotification(record);
        } else {
            Exception e = sent.getError().get();
            LOG.error("Notification dispatch failed for error {}: {}", record.getId(), e.toString(), e);
        }
    }

    public ErrorStore getStore() {
        return store;
    }

    public NotificationThrottler getThrottler() {
        return throttler;
    }

    public BaselineService getBaselineService() {
        return baselineService;
    }

    public BaselineAlertThrottler getBaselineAlertThrottler() {
        return baselineAlertThrottler;
    }
}
