package com.faultline.core.baseline;

import com.faultline.core.aggregation.ErrorStore;
import com.faultline.core.model.AnomalyInfo;
import com.faultline.core.model.AnomalyLevel;
import com.faultline.core.model.Baseline;
import com.faultline.core.model.PeriodType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Maintains baselines from occurrence history and checks current counts
 * against them.
 *
 * <h3>Refresh</h3>
 * <p>
 * For each {@link PeriodType} the window ends at the start of the current
 * (incomplete) bucket and reaches back by the period type's look-back. Empty
 * buckets count as zero so quiet periods pull the mean down.
 * </p>
 *
 * <h3>Anomaly check</h3>
 * <p>
 * Uses the DAILY baseline. Missing or degenerate baselines (zero mean or zero
 * deviation) give a neutral result.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineService {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineService.class);

    private final ErrorStore store;
    private final Clock clock;
    private final ZoneId zone;

    public BaselineService(ErrorStore store, Clock clock, ZoneId zone) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    /**
     * Recompute and upsert the HOURLY, DAILY and WEEKLY baselines.
     *
     * @return the stored baselines
     */
    public List<Baseline> refresh(String errorType, String platform) {
        Objects.requireNonNull(errorType, "errorType must not be null");
        Instant now = clock.instant();
        List<Baseline> refreshed = new ArrayList<>();
        for (PeriodType periodType : PeriodType.values()) {
            Instant end = periodType.bucketStart(now, zone);
            Instant start = periodType.bucketStart(end.minus(periodType.getLookback()), zone);

            SortedMap<Instant, Long> counts = store.countOccurrences(errorType, platform, periodType,
                    start, end, zone);
            List<Long> series = new ArrayList<>();
            for (Instant bucket = start; bucket.isBefore(end); bucket = periodType.nextBucket(bucket, zone)) {
                series.add(counts.getOrDefault(bucket, 0L));
            }
            BaselineStats stats = BaselineCalculator.calculate(series);

            Baseline baseline = new Baseline(errorType, platform, periodType, start);
            baseline.setPeriodEnd(end);
            baseline.setCount(stats.getCount());
            baseline.setMean(stats.getMean());
            baseline.setStdDev(stats.getStdDev());
            baseline.setPercentile95(stats.getPercentile95());
            baseline.setPercentile99(stats.getPercentile99());
            baseline.setSampleSize(stats.getSampleSize());
            refreshed.add(store.upsertBaseline(baseline));
        }
        LOG.debug("Refreshed baselines for {} on {}", errorType, platform);
        return refreshed;
    }

    /**
     * @param sensitivity number of standard deviations above the mean that
     *                    counts as anomalous
     */
    public AnomalyInfo checkAnomaly(String errorType, String platform, long currentCount, double sensitivity) {
        Optional<Baseline> found = store.findBaseline(errorType, platform, PeriodType.DAILY);
        if (found.isEmpty()) {
            return AnomalyInfo.neutral("No baseline available");
        }
        Baseline baseline = found.get();
        double mean = baseline.getMean();
        double stdDev = baseline.getStdDev();
        if (mean <= 0 || stdDev <= 0) {
            return AnomalyInfo.neutral("Insufficient baseline variance");
        }

        double threshold = mean + sensitivity * stdDev;
        double stdDevsAbove = (currentCount - mean) / stdDev;
        double multiplier = currentCount / mean;
        boolean anomaly = currentCount > threshold;
        AnomalyLevel level = AnomalyLevel.fromMultiplier(multiplier);
        if (anomaly) {
            LOG.debug("Anomaly for {} on {}: count={} mean={} level={}", errorType, platform,
                    currentCount, mean, level);
        }
        return AnomalyInfo.evaluated(anomaly, level, currentCount, mean, stdDev, threshold,
                stdDevsAbove, multiplier);
    }

    /**
     * @return occurrences of the type on the platform in the current DAILY
     *         bucket so far
     */
    public long currentDailyCount(String errorType, String platform) {
        Instant now = clock.instant();
        Instant start = PeriodType.DAILY.bucketStart(now, zone);
        return store.countOccurrences(errorType, platform, PeriodType.DAILY, start,
                PeriodType.DAILY.nextBucket(start, zone), zone)
                .values().stream().mapToLong(Long::longValue).sum();
    }
}
