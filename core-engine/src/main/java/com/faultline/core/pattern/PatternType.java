package com.faultline.core.pattern;

/**
 * Shape of an error's daily and weekly rhythm.
 *
 * @since 1.0.0
 */
public enum PatternType {
    /** No occurrences to analyse. */
    NONE,
    /** At least three peak hours between 09:00 and 17:59. */
    BUSINESS_HOURS,
    /** At least two peak hours between 00:00 and 06:59. */
    NIGHT,
    /** More than half of the occurrences on Saturday or Sunday. */
    WEEKEND,
    UNIFORM
}
