package com.faultline.core.baseline;

/**
 * Summary statistics over a series of bucket counts.
 *
 * @since 1.0.0
 */
public final class BaselineStats {

    static final BaselineStats EMPTY = new BaselineStats(0, 0, 0, 0, 0, 0);

    private final long count;
    private final double mean;
    private final double stdDev;
    private final double percentile95;
    private final double percentile99;
    private final int sampleSize;

    public BaselineStats(long count, double mean, double stdDev, double percentile95,
            double percentile99, int sampleSize) {
        this.count = count;
        this.mean = mean;
        this.stdDev = stdDev;
        this.percentile95 = percentile95;
        this.percentile99 = percentile99;
        this.sampleSize = sampleSize;
    }

    /** Sum of all bucket counts. */
    public long getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getPercentile95() {
        return percentile95;
    }

    public double getPercentile99() {
        return percentile99;
    }

    /** Number of buckets, zero buckets included. */
    public int getSampleSize() {
        return sampleSize;
    }

    @Override
    public String toString() {
        return String.format("BaselineStats{count=%d, mean=%.3f, stdDev=%.3f, p95=%.3f, p99=%.3f, n=%d}",
                count, mean, stdDev, percentile95, percentile99, sampleSize);
    }
}
