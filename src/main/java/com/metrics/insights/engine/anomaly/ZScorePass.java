package com.metrics.insights.engine.anomaly;

import com.metrics.insights.engine.stats.StatisticalPrimitives;
import com.metrics.insights.model.Anomaly;
import com.metrics.insights.model.AnomalyDetectionConfig;
import com.metrics.insights.model.AnomalySeverity;
import com.metrics.insights.model.AnomalyType;
import com.metrics.insights.model.MetricDataPoint;
import com.metrics.insights.model.TimeInterval;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Global z-score pass. The threshold is the sensitivity's z threshold, floored
 * at {@code minimumDeviation}; the expected value is the series mean.
 */
class ZScorePass implements AnomalyPass {

    @Override
    public String getName() {
        return "zscore";
    }

    @Override
    public boolean honoursWeekendExclusion() {
        return true;
    }

    @Override
    public List<Anomaly> detect(IndexedSeries series, TimeInterval interval, AnomalyDetectionConfig config) {
        List<Anomaly> anomalies = new ArrayList<>();
        double[] values = series.values();
        double mean = StatisticalPrimitives.mean(values);
        double std = StatisticalPrimitives.standardDeviation(values);
        if (std == 0) {
            return anomalies;
        }
        double threshold = Math.max(config.getSensitivity().getZScoreThreshold(), config.getMinimumDeviation());

        for (int i = 0; i < values.length; i++) {
            double z = Math.abs(values[i] - mean) / std;
            if (z <= threshold) continue;

            MetricDataPoint point = series.point(i);
            double deviation = values[i] - mean;
            AnomalyType type = deviation > 0 ? AnomalyType.SPIKE : AnomalyType.DROP;
            AnomalySeverity severity = AnomalySeverity.classify(z, threshold);
            anomalies.add(Anomaly.builder()
                    .id(getName() + "_" + series.metric() + "_" + series.originalIndex(i))
                    .timestamp(point.getTimestamp())
                    .metric(series.metric())
                    .value(values[i])
                    .expectedValue(mean)
                    .deviation(deviation)
                    .severity(severity)
                    .confidence(StatisticalPrimitives.clampUnit(z / (threshold * 2)))
                    .type(type)
                    .description(String.format(Locale.ROOT, "%s shows %s (%.2f from expected %.2f)",
                            series.metric(),
                            type == AnomalyType.SPIKE ? "unusual spike" : "significant drop",
                            Math.abs(deviation), mean))
                    .potentialCauses(AnomalyAnnotator.potentialCauses(series.metric(), type))
                    .impactAssessment(AnomalyAnnotator.impactAssessment(severity))
                    .build());
        }
        return anomalies;
    }
}
