package com.metrics.insights.engine.anomaly;

import com.metrics.insights.model.AnomalySeverity;
import com.metrics.insights.model.AnomalyType;

import java.util.List;

/**
 * Canned narrative attached to every anomaly: candidate causes by metric
 * category and a severity-keyed impact sentence.
 */
final class AnomalyAnnotator {

    static final List<String> SEASONAL_CAUSES =
            List.of("Unusual external events", "Campaign changes", "Technical issues", "Market shifts");

    private AnomalyAnnotator() {}

    static List<String> potentialCauses(String metric, AnomalyType type) {
        return switch (type) {
            case SPIKE -> MetricCategory.of(metric).causes(true);
            case DROP -> MetricCategory.of(metric).causes(false);
            case SEASONAL_DEVIATION -> SEASONAL_CAUSES;
            case TREND_BREAK -> MetricCategory.FALLBACK_CAUSES;
        };
    }

    static String impactAssessment(AnomalySeverity severity) {
        return switch (severity) {
            case CRITICAL -> "High business impact - immediate attention required";
            case WARNING -> "Moderate impact - monitor closely and investigate";
            case INFO -> "Low impact - consider for future optimization";
        };
    }
}
