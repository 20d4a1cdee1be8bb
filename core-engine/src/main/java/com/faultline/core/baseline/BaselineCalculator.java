package com.faultline.core.baseline;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Pure statistics over bucket counts.
 *
 * <p>
 * The standard deviation is the population form (divide by n). Percentiles
 * use linear interpolation between the closest ranks of the sorted series.
 * An empty series yields all zeros.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineCalculator {

    private BaselineCalculator() {
    }

    public static BaselineStats calculate(List<Long> bucketCounts) {
        Objects.requireNonNull(bucketCounts, "bucketCounts must not be null");
        if (bucketCounts.isEmpty()) {
            return BaselineStats.EMPTY;
        }
        int n = bucketCounts.size();
        double[] sorted = new double[n];
        long sum = 0;
        for (int i = 0; i < n; i++) {
            long value = bucketCounts.get(i) == null ? 0 : bucketCounts.get(i);
            sorted[i] = value;
            sum += value;
        }
        Arrays.sort(sorted);

        double mean = (double) sum / n;
        double sumSquaredDiff = 0;
        for (double v : sorted) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        double stdDev = Math.sqrt(sumSquaredDiff / n);

        return new BaselineStats(sum, mean, stdDev, percentile(sorted, 95), percentile(sorted, 99), n);
    }

    /**
     * @param sorted     ascending values, non-empty
     * @param percentile 0-100
     */
    static double percentile(double[] sorted, double percentile) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }
}
