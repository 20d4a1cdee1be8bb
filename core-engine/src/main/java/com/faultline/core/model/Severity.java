package com.faultline.core.model;

import java.util.Locale;

/**
 * Severity of an error type, ordered from least to most severe.
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW(0),
    MEDIUM(1),
    HIGH(2),
    CRITICAL(3);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    /**
     * @param other severity to compare against
     * @return {@code true} if this severity ranks at or above {@code other}
     */
    public boolean isAtLeast(Severity other) {
        return other == null || rank >= other.rank;
    }

    /**
     * Parse a configuration value such as {@code "high"} or {@code "CRITICAL"}.
     *
     * @param value severity name, case-insensitive
     * @return the matching severity
     * @throws IllegalArgumentException if the value is blank or unknown
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity must not be blank");
        }
        try {
            return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: '" + value
                    + "'. Supported: low, medium, high, critical", e);
        }
    }
}
