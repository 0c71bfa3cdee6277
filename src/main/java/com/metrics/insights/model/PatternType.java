package com.metrics.insights.model;

public enum PatternType {
    DAILY,
    WEEKLY,
    MONTHLY,
    YEARLY
}
