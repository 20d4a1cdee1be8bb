package com.faultline.core.correlation;

/**
 * Direction of change between two consecutive periods.
 *
 * @since 1.0.0
 */
public enum TrendDirection {
    INCREASING_SIGNIFICANTLY,
    INCREASING,
    STABLE,
    DECREASING,
    DECREASING_SIGNIFICANTLY
}
