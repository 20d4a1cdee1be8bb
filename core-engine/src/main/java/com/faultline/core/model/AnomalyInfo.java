package com.faultline.core.model;

import java.io.Serializable;

/**
 * Result of comparing a current error count against its baseline.
 *
 * <p>
 * Degenerate baselines (missing, zero mean, zero deviation) produce a
 * {@link #neutral(String) neutral} result rather than an error.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyInfo implements Serializable {

    private static final long serialVersionUID = 1L;

    private final boolean anomaly;
    private final AnomalyLevel level;
    private final long currentCount;
    private final double baselineMean;
    private final double baselineStdDev;
    private final double threshold;
    private final double stdDevsAbove;
    private final double multiplier;
    private final String message;

    private AnomalyInfo(boolean anomaly, AnomalyLevel level, long currentCount,
            double baselineMean, double baselineStdDev, double threshold,
            double stdDevsAbove, double multiplier, String message) {
        this.anomaly = anomaly;
        this.level = level;
        this.currentCount = currentCount;
        this.baselineMean = baselineMean;
        this.baselineStdDev = baselineStdDev;
        this.threshold = threshold;
        this.stdDevsAbove = stdDevsAbove;
        this.multiplier = multiplier;
        this.message = message;
    }

    /**
     * @param message why no signal could be derived
     * @return a non-anomalous result carrying no statistics
     */
    public static AnomalyInfo neutral(String message) {
        return new AnomalyInfo(false, AnomalyLevel.NORMAL, 0, 0, 0, 0, 0, 0, message);
    }

    public static AnomalyInfo evaluated(boolean anomaly, AnomalyLevel level, long currentCount,
            double baselineMean, double baselineStdDev, double threshold,
            double stdDevsAbove, double multiplier) {
        String message = anomaly
                ? String.format("%d occurrences, %.1f std devs above baseline mean %.2f",
                        currentCount, stdDevsAbove, baselineMean)
                : "Within baseline";
        return new AnomalyInfo(anomaly, level, currentCount, baselineMean, baselineStdDev,
                threshold, stdDevsAbove, multiplier, message);
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    public AnomalyLevel getLevel() {
        return level;
    }

    public long getCurrentCount() {
        return currentCount;
    }

    public double getBaselineMean() {
        return baselineMean;
    }

    public double getBaselineStdDev() {
        return baselineStdDev;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getStdDevsAbove() {
        return stdDevsAbove;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "AnomalyInfo{" +
                "anomaly=" + anomaly +
                ", level=" + level +
                ", currentCount=" + currentCount +
                ", stdDevsAbove=" + stdDevsAbove +
                ", multiplier=" + multiplier +
                '}';
    }
}
