package com.faultline.core.correlation;

import com.faultline.core.aggregation.ErrorStore;
import com.faultline.core.model.ErrorOccurrence;
import com.faultline.core.model.PeriodType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Correlates error types by their daily occurrence counts and reports trends.
 *
 * @since 1.0.0
 */
public class ErrorCorrelationAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ErrorCorrelationAnalyzer.class);

    private final ErrorStore store;
    private final Clock clock;
    private final ZoneId zone;

    public ErrorCorrelationAnalyzer(ErrorStore store, Clock clock, ZoneId zone) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    /**
     * Correlate every pair of error types seen in the look-back window.
     *
     * @param lookback       window ending now
     * @param minCoefficient smallest |r| to report
     * @return pairs ordered by descending |r|
     */
    public List<ErrorCorrelation> correlate(Duration lookback, double minCoefficient) {
        Instant now = clock.instant();
        Instant start = PeriodType.DAILY.bucketStart(now.minus(lookback), zone);
        List<Instant> days = new ArrayList<>();
        for (Instant day = start; !day.isAfter(now); day = PeriodType.DAILY.nextBucket(day, zone)) {
            days.add(day);
        }

        Map<String, double[]> series = new TreeMap<>();
        for (ErrorOccurrence o : store.findOccurrences(start, now.plusNanos(1))) {
            double[] counts = series.computeIfAbsent(o.getErrorType(), t -> new double[days.size()]);
            int index = days.indexOf(PeriodType.DAILY.bucketStart(o.getOccurredAt(), zone));
            if (index >= 0) {
                counts[index]++;
            }
        }

        List<String> types = new ArrayList<>(series.keySet());
        List<ErrorCorrelation> result = new ArrayList<>();
        for (int i = 0; i < types.size(); i++) {
            for (int j = i + 1; j < types.size(); j++) {
                double r = PearsonCorrelation.coefficient(series.get(types.get(i)), series.get(types.get(j)));
                if (Math.abs(r) >= minCoefficient) {
                    result.add(new ErrorCorrelation(types.get(i), types.get(j), r));
                }
            }
        }
        result.sort(Comparator.comparingDouble((ErrorCorrelation c) -> Math.abs(c.getCoefficient())).reversed());
        LOG.debug("Correlated {} error types over {}: {} pairs above {}", types.size(), lookback,
                result.size(), minCoefficient);
        return result;
    }

    /**
     * Compare the last {@code period} with the one before it.
     */
    public TrendDirection trend(String errorType, Duration period) {
        Instant now = clock.instant();
        Instant mid = now.minus(period);
        long current = countType(errorType, mid, now.plusNanos(1));
        long previous = countType(errorType, mid.minus(period), mid);
        return StatisticalClassifier.trendDirection(changePercentage(previous, current));
    }

    static double changePercentage(long previous, long current) {
        if (previous == 0) {
            return current > 0 ? 100.0 : 0.0;
        }
        return (current - previous) * 100.0 / previous;
    }

    private long countType(String errorType, Instant from, Instant to) {
        return store.findOccurrences(from, to).stream()
                .filter(o -> errorType.equals(o.getErrorType()))
                .count();
    }
}
