package com.metrics.insights.engine.anomaly;

import com.metrics.insights.engine.stats.SeasonalDecomposition;
import com.metrics.insights.engine.stats.StatisticalPrimitives;
import com.metrics.insights.model.Anomaly;
import com.metrics.insights.model.AnomalyDetectionConfig;
import com.metrics.insights.model.AnomalySeverity;
import com.metrics.insights.model.AnomalyType;
import com.metrics.insights.model.MetricDataPoint;
import com.metrics.insights.model.TimeInterval;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags decomposition residuals larger than the sensitivity's z threshold
 * times the residual standard deviation. Only positions where the centered
 * trend is defined are considered. Skipped, not failed, when the series is
 * shorter than {@code seasonalityWindow} or two full periods.
 */
class SeasonalResidualPass implements AnomalyPass {

    // residual spread at or below this is rounding noise from an exact fit
    static final double NEGLIGIBLE_RESIDUAL_STD = 1e-9;

    @Override
    public String getName() {
        return "seasonal";
    }

    @Override
    public boolean honoursWeekendExclusion() {
        return false;
    }

    @Override
    public List<Anomaly> detect(IndexedSeries series, TimeInterval interval, AnomalyDetectionConfig config) {
        List<Anomaly> anomalies = new ArrayList<>();
        int n = series.size();
        int period = interval.getSeasonalPeriod();
        if (n < config.getSeasonalityWindow() || n < 2 * period) {
            return anomalies;
        }

        SeasonalDecomposition decomposition = StatisticalPrimitives.seasonalDecompose(series.values(), period);
        double residualStd = StatisticalPrimitives.standardDeviation(decomposition.validResiduals());
        if (residualStd <= NEGLIGIBLE_RESIDUAL_STD) {
            return anomalies;
        }
        double zThreshold = config.getSensitivity().getZScoreThreshold();
        double threshold = zThreshold * residualStd;

        for (int i = decomposition.getValidFrom(); i <= decomposition.getValidTo(); i++) {
            double residual = decomposition.getResidual()[i];
            if (Math.abs(residual) <= threshold) continue;

            MetricDataPoint point = series.point(i);
            double expected = decomposition.getTrend()[i] + decomposition.getSeasonal()[i];
            AnomalySeverity severity = AnomalySeverity.classify(Math.abs(residual) / residualStd, zThreshold);
            anomalies.add(Anomaly.builder()
                    .id(getName() + "_" + series.metric() + "_" + series.originalIndex(i))
                    .timestamp(point.getTimestamp())
                    .metric(series.metric())
                    .value(point.getValue())
                    .expectedValue(expected)
                    .deviation(point.getValue() - expected)
                    .severity(severity)
                    .confidence(StatisticalPrimitives.clampUnit(Math.abs(residual) / (threshold * 2)))
                    .type(AnomalyType.SEASONAL_DEVIATION)
                    .description("Seasonal pattern deviation detected in " + series.metric())
                    .potentialCauses(AnomalyAnnotator.potentialCauses(series.metric(), AnomalyType.SEASONAL_DEVIATION))
                    .impactAssessment(AnomalyAnnotator.impactAssessment(severity))
                    .build());
        }
        return anomalies;
    }
}
