package com.metrics.insights.engine.anomaly;

import com.metrics.insights.engine.stats.StatisticalPrimitives;
import com.metrics.insights.model.Anomaly;
import com.metrics.insights.model.AnomalyDetectionConfig;
import com.metrics.insights.model.AnomalySeverity;
import com.metrics.insights.model.AnomalyType;
import com.metrics.insights.model.TimeInterval;

import java.util.ArrayList;
import java.util.List;

/**
 * Sliding-window isolation pass. For a window half-width w = min(10, n / 4)
 * and each index i in [w, n - w), the score is the mean distance from x[i] to
 * the 2w + 1 values around it, divided by (window mean + 1). Series shorter
 * than 10 points are skipped.
 */
class WindowIsolationPass implements AnomalyPass {

    static final int MIN_POINTS = 10;
    static final int MAX_WINDOW = 10;

    @Override
    public String getName() {
        return "isolation";
    }

    @Override
    public boolean honoursWeekendExclusion() {
        return true;
    }

    @Override
    public List<Anomaly> detect(IndexedSeries series, TimeInterval interval, AnomalyDetectionConfig config) {
        List<Anomaly> anomalies = new ArrayList<>();
        double[] values = series.values();
        int n = values.length;
        if (n < MIN_POINTS) {
            return anomalies;
        }
        int window = Math.min(MAX_WINDOW, n / 4);
        double threshold = config.getSensitivity().getIsolationThreshold();

        for (int i = window; i < n - window; i++) {
            double current = values[i];
            double sum = 0.0;
            double distanceSum = 0.0;
            for (int j = i - window; j <= i + window; j++) {
                sum += values[j];
                distanceSum += Math.abs(values[j] - current);
            }
            int size = 2 * window + 1;
            double windowMean = sum / size;
            double denominator = windowMean + 1;
            if (denominator == 0) continue;
            double score = (distanceSum / size) / denominator;
            if (score <= threshold) continue;

            AnomalyType type = current > windowMean ? AnomalyType.SPIKE : AnomalyType.DROP;
            AnomalySeverity severity = AnomalySeverity.classify(score * 2, 2);
            anomalies.add(Anomaly.builder()
                    .id(getName() + "_" + series.metric() + "_" + series.originalIndex(i))
                    .timestamp(series.point(i).getTimestamp())
                    .metric(series.metric())
                    .value(current)
                    .expectedValue(windowMean)
                    .deviation(current - windowMean)
                    .severity(severity)
                    .confidence(StatisticalPrimitives.clampUnit(score))
                    .type(type)
                    .description("Isolated " + (type == AnomalyType.SPIKE ? "spike" : "drop")
                            + " detected in " + series.metric())
                    .potentialCauses(AnomalyAnnotator.potentialCauses(series.metric(), type))
                    .impactAssessment(AnomalyAnnotator.impactAssessment(severity))
                    .build());
        }
        return anomalies;
    }
}
