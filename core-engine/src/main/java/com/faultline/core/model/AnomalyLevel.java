package com.faultline.core.model;

import java.util.Locale;

/**
 * Spike severity, derived from how many times above its average an error
 * type is currently occurring.
 *
 * @since 1.0.0
 */
public enum AnomalyLevel {

    NORMAL,
    ELEVATED,
    HIGH,
    CRITICAL;

    /**
     * Classify a multiplier over the baseline average.
     *
     * <pre>
     *   multiplier &lt; 2        NORMAL
     *   2 &lt;= multiplier &lt; 5   ELEVATED
     *   5 &lt;= multiplier &lt; 10  HIGH
     *   multiplier &gt;= 10      CRITICAL
     * </pre>
     *
     * @param multiplier ratio of current count to average
     * @return the spike level
     */
    public static AnomalyLevel fromMultiplier(double multiplier) {
        if (multiplier < 2) {
            return NORMAL;
        }
        if (multiplier < 5) {
            return ELEVATED;
        }
        if (multiplier < 10) {
            return HIGH;
        }
        return CRITICAL;
    }

    /**
     * @param value level name, case-insensitive
     * @return the matching level
     * @throws IllegalArgumentException if the value is unknown
     */
    public static AnomalyLevel parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Anomaly level must not be blank");
        }
        try {
            return AnomalyLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown anomaly level: '" + value
                    + "'. Supported: normal, elevated, high, critical", e);
        }
    }
}
