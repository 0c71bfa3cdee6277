package com.metrics.insights.model;

/**
 * Detector sensitivity. Higher sensitivity means lower thresholds and therefore
 * a superset of the flags raised at a lower sensitivity.
 */
public enum Sensitivity {
    LOW(3.0, 1.5),
    MEDIUM(2.5, 1.2),
    HIGH(2.0, 1.0);

    private final double zScoreThreshold;
    private final double isolationThreshold;

    Sensitivity(double zScoreThreshold, double isolationThreshold) {
        this.zScoreThreshold = zScoreThreshold;
        this.isolationThreshold = isolationThreshold;
    }

    public double getZScoreThreshold() {
        return zScoreThreshold;
    }

    public double getIsolationThreshold() {
        return isolationThreshold;
    }
}
