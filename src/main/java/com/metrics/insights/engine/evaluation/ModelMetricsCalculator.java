package com.metrics.insights.engine.evaluation;

import com.metrics.insights.model.ModelMetrics;

/**
 * Prediction-quality scores for paired actual/predicted values.
 *
 * <p>R² here is a goodness-of-fit statistic, not a confidence, and can be
 * negative for predictions worse than the mean.
 */
public final class ModelMetricsCalculator {

    private static final double EPSILON = 1e-10;

    private ModelMetricsCalculator() {}

    public static ModelMetrics calculate(double[] actual, double[] predicted) {
        return calculate(actual, predicted, null);
    }

    /**
     * @param parameterCount when non-null, adjusted R², AIC and BIC are added
     */
    public static ModelMetrics calculate(double[] actual, double[] predicted, Integer parameterCount) {
        if (actual == null || predicted == null || actual.length != predicted.length) {
            throw new IllegalArgumentException("Actual and predicted arrays must have the same length");
        }
        int n = actual.length;
        if (n == 0) {
            throw new IllegalArgumentException("Actual and predicted arrays must not be empty");
        }

        double sumSquared = 0, sumAbsolute = 0, sumPercent = 0, sumActual = 0;
        for (int i = 0; i < n; i++) {
            double error = actual[i] - predicted[i];
            sumSquared += error * error;
            sumAbsolute += Math.abs(error);
            // denominators at or below zero fall back to epsilon
            sumPercent += Math.abs(error / Math.max(actual[i], EPSILON)) * 100;
            sumActual += actual[i];
        }
        double mse = sumSquared / n;
        double mean = sumActual / n;
        double ssTot = 0;
        for (double a : actual) ssTot += (a - mean) * (a - mean);
        double r2 = ssTot == 0 ? 0.0 : 1 - sumSquared / ssTot;

        ModelMetrics.ModelMetricsBuilder builder = ModelMetrics.builder()
                .mse(mse)
                .rmse(Math.sqrt(mse))
                .mae(sumAbsolute / n)
                .mape(sumPercent / n)
                .r2(r2);

        if (parameterCount != null) {
            int p = parameterCount;
            double logMse = Math.log(Math.max(mse, EPSILON));
            int dof = n - p - 1;
            builder.adjustedR2(dof > 0 ? 1 - (1 - r2) * (n - 1) / dof : r2)
                    .aic(n * logMse + 2.0 * p)
                    .bic(n * logMse + p * Math.log(n));
        }
        return builder.build();
    }
}
