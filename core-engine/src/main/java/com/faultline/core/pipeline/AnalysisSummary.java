package com.faultline.core.pipeline;

import com.faultline.core.correlation.ErrorCorrelation;
import com.faultline.core.correlation.TrendDirection;

import java.util.List;
import java.util.Map;

/**
 * What one {@link AnalysisScheduler#runOnce()} pass did.
 *
 * @since 1.0.0
 */
public final class AnalysisSummary {

    private final int baselinesRefreshed;
    private final int cascadesRecorded;
    private final List<ErrorCorrelation> strongCorrelations;
    private final Map<String, TrendDirection> trends;

    AnalysisSummary(int baselinesRefreshed, int cascadesRecorded, List<ErrorCorrelation> strongCorrelations,
            Map<String, TrendDirection> trends) {
        this.baselinesRefreshed = baselinesRefreshed;
        this.cascadesRecorded = cascadesRecorded;
        this.strongCorrelations = List.copyOf(strongCorrelations);
        this.trends = Map.copyOf(trends);
    }

    /** Number of (error type, platform) pairs whose baselines were refreshed. */
    public int getBaselinesRefreshed() {
        return baselinesRefreshed;
    }

    public int getCascadesRecorded() {
        return cascadesRecorded;
    }

    public List<ErrorCorrelation> getStrongCorrelations() {
        return strongCorrelations;
    }

    /** Day-over-day trend of every error type that appears in a strong correlation. */
    public Map<String, TrendDirection> getTrends() {
        return trends;
    }

    @Override
    public String toString() {
        return "AnalysisSummary{baselines=" + baselinesRefreshed + ", cascades=" + cascadesRecorded
                + ", strongCorrelations=" + strongCorrelations.size() + '}';
    }
}
