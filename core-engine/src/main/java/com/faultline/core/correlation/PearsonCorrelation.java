package com.faultline.core.correlation;

import java.util.Objects;

/**
 * Pearson correlation coefficient between two equally long series.
 *
 * @since 1.0.0
 */
public final class PearsonCorrelation {

    private PearsonCorrelation() {
    }

    /**
     * @return coefficient in [-1, 1] rounded to 3 decimals; 0.0 when either
     *         series is empty, sums to zero or has no variance
     * @throws IllegalArgumentException if the series differ in length
     */
    public static double coefficient(double[] a, double[] b) {
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(b, "b must not be null");
        if (a.length != b.length) {
            throw new IllegalArgumentException("Series length mismatch: " + a.length + " vs " + b.length);
        }
        int n = a.length;
        if (n == 0) {
            return 0.0;
        }
        double sumA = 0;
        double sumB = 0;
        for (int i = 0; i < n; i++) {
            sumA += a[i];
            sumB += b[i];
        }
        if (sumA == 0 || sumB == 0) {
            return 0.0;
        }
        double meanA = sumA / n;
        double meanB = sumB / n;

        double covariance = 0;
        double varA = 0;
        double varB = 0;
        for (int i = 0; i < n; i++) {
            double da = a[i] - meanA;
            double db = b[i] - meanB;
            covariance += da * db;
            varA += da * da;
            varB += db * db;
        }
        double denominator = Math.sqrt(varA * varB);
        if (denominator == 0) {
            return 0.0;
        }
        return Math.round(covariance / denominator * 1000) / 1000.0;
    }
}
