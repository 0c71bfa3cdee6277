package com.metrics.insights.model;

public enum AnomalySeverity {
    CRITICAL,
    WARNING,
    INFO;

    /**
     * Escalates a detector score against its threshold: above 1.5x is critical,
     * above 1.2x is a warning, anything else is informational.
     */
    public static AnomalySeverity classify(double score, double threshold) {
        if (score > threshold * 1.5) return CRITICAL;
        if (score > threshold * 1.2) return WARNING;
        return INFO;
    }

    public InsightSeverity toInsightSeverity() {
        return switch (this) {
            case CRITICAL -> InsightSeverity.CRITICAL;
            case WARNING -> InsightSeverity.WARNING;
            case INFO -> InsightSeverity.INFO;
        };
    }
}
