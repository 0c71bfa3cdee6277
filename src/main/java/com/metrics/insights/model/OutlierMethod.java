package com.metrics.insights.model;

public enum OutlierMethod {
    ZSCORE,
    IQR,
    ISOLATION,
    LOF
}
