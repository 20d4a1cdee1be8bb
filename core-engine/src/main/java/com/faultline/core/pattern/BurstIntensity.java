package com.faultline.core.pattern;

/**
 * Size class of a {@link Burst}.
 *
 * @since 1.0.0
 */
public enum BurstIntensity {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * 20 or more events is HIGH, 10 or more is MEDIUM, anything smaller LOW.
     */
    public static BurstIntensity fromCount(int count) {
        if (count >= 20) {
            return HIGH;
        }
        if (count >= 10) {
            return MEDIUM;
        }
        return LOW;
    }
}
