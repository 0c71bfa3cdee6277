package com.metrics.insights.engine.stats;

import lombok.Value;

/**
 * Ordinary least squares fit of value against integer index.
 */
@Value
public class RegressionResult {
    double slope;
    double intercept;
    double r2;
    double[] predictions;

    public double predictAt(double index) {
        return slope * index + intercept;
    }
}
