package com.faultline.core.correlation;

/**
 * @since 1.0.0
 */
public enum CorrelationStrength {
    STRONG,
    MODERATE,
    WEAK
}
