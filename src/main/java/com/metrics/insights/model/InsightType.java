package com.metrics.insights.model;

public enum InsightType {
    ANOMALY,
    TREND,
    PREDICTION,
    PATTERN,
    RECOMMENDATION
}
