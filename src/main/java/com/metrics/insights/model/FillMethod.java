package com.metrics.insights.model;

public enum FillMethod {
    FORWARD,
    BACKWARD,
    INTERPOLATE,
    MEAN
}
