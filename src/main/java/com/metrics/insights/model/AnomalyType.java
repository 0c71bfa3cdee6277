package com.metrics.insights.model;

public enum AnomalyType {
    SPIKE("Spike"),
    DROP("Drop"),
    TREND_BREAK("Trend break"),
    SEASONAL_DEVIATION("Seasonal deviation");

    private final String label;

    AnomalyType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
