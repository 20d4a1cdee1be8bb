package com.faultline.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Rolling statistical summary of error counts for one
 * (error type, platform, period type) over the window starting at
 * {@code periodStart}.
 *
 * @since 1.0.0
 */
public class Baseline implements Serializable {

    private static final long serialVersionUID = 1L;

    private String errorType;
    private String platform;
    private PeriodType periodType;
    private Instant periodStart;
    private Instant periodEnd;

    private long count;
    private double mean;
    private double stdDev;
    private double percentile95;
    private double percentile99;
    private int sampleSize;

    public Baseline() {
    }

    public Baseline(String errorType, String platform, PeriodType periodType, Instant periodStart) {
        this.errorType = Objects.requireNonNull(errorType, "errorType must not be null");
        this.platform = platform;
        this.periodType = Objects.requireNonNull(periodType, "periodType must not be null");
        this.periodStart = Objects.requireNonNull(periodStart, "periodStart must not be null");
    }

    public Baseline copy() {
        Baseline c = new Baseline(errorType, platform, periodType, periodStart);
        c.periodEnd = periodEnd;
        c.count = count;
        c.mean = mean;
        c.stdDev = stdDev;
        c.percentile95 = percentile95;
        c.percentile99 = percentile99;
        c.sampleSize = sampleSize;
        return c;
    }

    public String getErrorType() {
        return errorType;
    }

    public void setErrorType(String errorType) {
        this.errorType = errorType;
    }

    public String getPlatform() {
        return platform;
    }

    public void setPlatform(String platform) {
        this.platform = platform;
    }

    public PeriodType getPeriodType() {
        return periodType;
    }

    public void setPeriodType(PeriodType periodType) {
        this.periodType = periodType;
    }

    public Instant getPeriodStart() {
        return periodStart;
    }

    public void setPeriodStart(Instant periodStart) {
        this.periodStart = periodStart;
    }

    public Instant getPeriodEnd() {
        return periodEnd;
    }

    public void setPeriodEnd(Instant periodEnd) {
        this.periodEnd = periodEnd;
    }

    public long getCount() {
        return count;
    }

    public void setCount(long count) {
        this.count = count;
    }

    public double getMean() {
        return mean;
    }

    public void setMean(double mean) {
        this.mean = mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public void setStdDev(double stdDev) {
        this.stdDev = stdDev;
    }

    public double getPercentile95() {
        return percentile95;
    }

    public void setPercentile95(double percentile95) {
        this.percentile95 = percentile95;
    }

    public double getPercentile99() {
        return percentile99;
    }

    public void setPercentile99(double percentile99) {
        this.percentile99 = percentile99;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Baseline that))
            return false;
        return Objects.equals(errorType, that.errorType)
                && Objects.equals(platform, that.platform)
                && periodType == that.periodType
                && Objects.equals(periodStart, that.periodStart);
    }

    @Override
    public int hashCode() {
        return Objects.hash(errorType, platform, periodType, periodStart);
    }

    @Override
    public String toString() {
        return "Baseline{" +
                "errorType='" + errorType + '\'' +
                ", platform='" + platform + '\'' +
                ", periodType=" + periodType +
                ", periodStart=" + periodStart +
                ", mean=" + mean +
                ", stdDev=" + stdDev +
                ", sampleSize=" + sampleSize +
                '}';
    }
}
