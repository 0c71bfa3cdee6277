package com.metrics.insights.model;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE,
    VOLATILE
}
