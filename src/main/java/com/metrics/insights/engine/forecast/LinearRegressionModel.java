package com.metrics.insights.engine.forecast;

import com.metrics.insights.engine.stats.StatisticalPrimitives;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Ordinary least squares over explicit x/y pairs, with normal-approximation
 * prediction intervals.
 */
public class LinearRegressionModel {

    private static final Map<Double, Double> Z_VALUES = Map.of(
            0.90, 1.645,
            0.95, 1.96,
            0.99, 2.576);
    private static final double DEFAULT_Z = 1.96;

    private Fit fit;

    public Fit train(double[] x, double[] y) {
        if (x == null || y == null || x.length != y.length || x.length < 2) {
            throw new IllegalArgumentException("Linear regression needs at least 2 paired observations");
        }
        int n = x.length;
        double sumX = 0, sumY = 0, sumXY = 0, sumXX = 0;
        for (int i = 0; i < n; i++) {
            sumX += x[i];
            sumY += y[i];
            sumXY += x[i] * y[i];
            sumXX += x[i] * x[i];
        }
        double denominator = n * sumXX - sumX * sumX;
        double slope = denominator == 0 ? 0.0 : (n * sumXY - sumX * sumY) / denominator;
        double intercept = (sumY - slope * sumX) / n;

        double yMean = sumY / n;
        double[] predictions = new double[n];
        double[] residuals = new double[n];
        double ssRes = 0, ssTot = 0;
        for (int i = 0; i < n; i++) {
            predictions[i] = slope * x[i] + intercept;
            residuals[i] = y[i] - predictions[i];
            ssRes += residuals[i] * residuals[i];
            ssTot += (y[i] - yMean) * (y[i] - yMean);
        }
        double rSquared = ssTot == 0 ? 0.0 : 1 - ssRes / ssTot;
        double standardError = n > 2 ? Math.sqrt(ssRes / (n - 2)) : 0.0;

        this.fit = new Fit(slope, intercept, rSquared, predictions, residuals,
                StatisticalPrimitives.clampUnit(rSquared), standardError);
        return fit;
    }

    public double[] predict(double[] x) {
        Fit trained = requireFit();
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            out[i] = trained.getSlope() * x[i] + trained.getIntercept();
        }
        return out;
    }

    /**
     * Symmetric intervals of z * standardError around each prediction. Levels
     * other than 0.90, 0.95 and 0.99 use the 0.95 multiplier.
     */
    public List<PredictionInterval> predictionIntervals(double[] x, double level) {
        Fit trained = requireFit();
        double margin = Z_VALUES.getOrDefault(level, DEFAULT_Z) * trained.getStandardError();
        List<PredictionInterval> intervals = new ArrayList<>(x.length);
        for (double prediction : predict(x)) {
            intervals.add(new PredictionInterval(prediction, prediction - margin, prediction + margin));
        }
        return intervals;
    }

    public Fit getFit() {
        return fit;
    }

    private Fit requireFit() {
        if (fit == null) {
            throw new IllegalStateException("Model not trained, call train() first");
        }
        return fit;
    }

    @Value
    public static class Fit {
        double slope;
        double intercept;
        double rSquared;
        double[] predictions;
        double[] residuals;
        double confidence;
        double standardError;
    }

    @Value
    public static class PredictionInterval {
        double value;
        double lower;
        double upper;
    }
}
