package com.faultline.core.correlation;

/**
 * Correlation between the daily counts of two error types.
 *
 * @since 1.0.0
 */
public final class ErrorCorrelation {

    private final String errorTypeA;
    private final String errorTypeB;
    private final double coefficient;

    public ErrorCorrelation(String errorTypeA, String errorTypeB, double coefficient) {
        this.errorTypeA = errorTypeA;
        this.errorTypeB = errorTypeB;
        this.coefficient = coefficient;
    }

    public String getErrorTypeA() {
        return errorTypeA;
    }

    public String getErrorTypeB() {
        return errorTypeB;
    }

    public double getCoefficient() {
        return coefficient;
    }

    public CorrelationStrength getStrength() {
        return StatisticalClassifier.correlationStrength(coefficient);
    }

    @Override
    public String toString() {
        return errorTypeA + " ~ " + errorTypeB + " r=" + coefficient + " (" + getStrength() + ")";
    }
}
