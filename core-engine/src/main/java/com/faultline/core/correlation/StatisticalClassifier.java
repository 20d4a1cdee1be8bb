package com.faultline.core.correlation;

import com.faultline.core.model.AnomalyLevel;

/**
 * Threshold classification of statistical values.
 *
 * @since 1.0.0
 */
public final class StatisticalClassifier {

    private StatisticalClassifier() {
    }

    /**
     * |r| of 0.8 or more is STRONG, 0.5 or more MODERATE, otherwise WEAK.
     */
    public static CorrelationStrength correlationStrength(double coefficient) {
        double abs = Math.abs(coefficient);
        if (abs >= 0.8) {
            return CorrelationStrength.STRONG;
        }
        if (abs >= 0.5) {
            return CorrelationStrength.MODERATE;
        }
        return CorrelationStrength.WEAK;
    }

    /**
     * @param changePercentage change between two periods, in percent
     */
    public static TrendDirection trendDirection(double changePercentage) {
        if (changePercentage > 20) {
            return TrendDirection.INCREASING_SIGNIFICANTLY;
        }
        if (changePercentage > 5) {
            return TrendDirection.INCREASING;
        }
        if (changePercentage < -20) {
            return TrendDirection.DECREASING_SIGNIFICANTLY;
        }
        if (changePercentage < -5) {
            return TrendDirection.DECREASING;
        }
        return TrendDirection.STABLE;
    }

    public static AnomalyLevel spikeSeverity(double multiplier) {
        return AnomalyLevel.fromMultiplier(multiplier);
    }
}
