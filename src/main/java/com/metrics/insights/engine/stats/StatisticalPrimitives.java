package com.metrics.insights.engine.stats;

import com.metrics.insights.model.MetricDataPoint;

import java.util.List;

/**
 * Pure numeric building blocks shared by every analyzer.
 *
 * None of these methods return NaN: empty and degenerate inputs map to
 * documented fallbacks (0, an empty array, a zero slope).
 */
public final class StatisticalPrimitives {

    private StatisticalPrimitives() {}

    public static double mean(double[] data) {
        if (data.length == 0) return 0.0;
        double sum = 0.0;
        for (double v : data) sum += v;
        return sum / data.length;
    }

    /**
     * Trailing simple moving average. Indices before {@code window - 1} pass
     * the raw value through unchanged.
     */
    public static double[] movingAverage(double[] data, int window) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be >= 1, was " + window);
        }
        double[] result = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            if (i < window - 1) {
                result[i] = data[i];
                continue;
            }
            // summed per window so that window 1 reproduces the input exactly
            double sum = 0.0;
            for (int j = i - window + 1; j <= i; j++) sum += data[j];
            result[i] = sum / window;
        }
        return result;
    }

    /**
     * Exponential moving average seeded with the first element:
     * ema[i] = alpha * x[i] + (1 - alpha) * ema[i - 1].
     */
    public static double[] exponentialMovingAverage(double[] data, double alpha) {
        if (alpha <= 0 || alpha > 1) {
            throw new IllegalArgumentException("alpha must be in (0, 1], was " + alpha);
        }
        double[] result = new double[data.length];
        if (data.length == 0) return result;
        result[0] = data[0];
        for (int i = 1; i < data.length; i++) {
            result[i] = alpha * data[i] + (1 - alpha) * result[i - 1];
        }
        return result;
    }

    /**
     * Population standard deviation (divides by N). 0 for empty input.
     */
    public static double standardDeviation(double[] data) {
        if (data.length == 0) return 0.0;
        double mean = mean(data);
        double sumSq = 0.0;
        for (double v : data) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / data.length);
    }

    public static RegressionResult linearRegression(List<MetricDataPoint> points) {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        return linearRegression(values);
    }

    /**
     * OLS of value against index 0..n-1. A constant or single-point series
     * yields slope 0 and R² 0.
     */
    public static RegressionResult linearRegression(double[] values) {
        int n = values.length;
        if (n == 0) {
            return new RegressionResult(0.0, 0.0, 0.0, new double[0]);
        }
        double sumX = 0, sumY = 0, sumXY = 0, sumXX = 0;
        for (int i = 0; i < n; i++) {
            sumX += i;
            sumY += values[i];
            sumXY += i * values[i];
            sumXX += (double) i * i;
        }
        double denominator = n * sumXX - sumX * sumX;
        double slope = denominator == 0 ? 0.0 : (n * sumXY - sumX * sumY) / denominator;
        double intercept = (sumY - slope * sumX) / n;

        double yMean = sumY / n;
        double[] predictions = new double[n];
        double ssRes = 0, ssTot = 0;
        for (int i = 0; i < n; i++) {
            predictions[i] = slope * i + intercept;
            double res = values[i] - predictions[i];
            ssRes += res * res;
            double dev = values[i] - yMean;
            ssTot += dev * dev;
        }
        double r2 = ssTot == 0 ? 0.0 : clampUnit(1 - ssRes / ssTot);
        return new RegressionResult(slope, intercept, r2, predictions);
    }

    /**
     * Pearson correlation of two series aligned by index and truncated to the
     * shorter length. 0 when fewer than two pairs or either side is constant.
     */
    public static double pearsonCorrelation(double[] x, double[] y) {
        int n = Math.min(x.length, y.length);
        if (n < 2) return 0.0;
        double sumX = 0, sumY = 0, sumXY = 0, sumXX = 0, sumYY = 0;
        for (int i = 0; i < n; i++) {
            sumX += x[i];
            sumY += y[i];
            sumXY += x[i] * y[i];
            sumXX += x[i] * x[i];
            sumYY += y[i] * y[i];
        }
        double numerator = n * sumXY - sumX * sumY;
        double varianceProduct = (n * sumXX - sumX * sumX) * (n * sumYY - sumY * sumY);
        if (varianceProduct <= 0) return 0.0;
        double r = numerator / Math.sqrt(varianceProduct);
        return Math.max(-1.0, Math.min(1.0, r));
    }

    /**
     * Classical additive decomposition over {@code period}.
     *
     * @throws InsufficientDataException when fewer than {@code 2 * period} points are given
     */
    public static SeasonalDecomposition seasonalDecompose(double[] values, int period) {
        if (period < 2) {
            throw new IllegalArgumentException("period must be >= 2, was " + period);
        }
        int n = values.length;
        if (n < 2 * period) {
            throw new InsufficientDataException(
                    String.format("Seasonal decomposition with period %d needs at least %d points, got %d",
                            period, 2 * period, n),
                    2 * period, n);
        }

        double[] trend = centeredMovingAverage(values, period);
        int half = period / 2;
        int validFrom = half;
        int validTo = n - half - 1;
        for (int i = 0; i < validFrom; i++) trend[i] = trend[validFrom];
        for (int i = validTo + 1; i < n; i++) trend[i] = trend[validTo];

        double[] phaseSums = new double[period];
        int[] phaseCounts = new int[period];
        for (int i = validFrom; i <= validTo; i++) {
            phaseSums[i % period] += values[i] - trend[i];
            phaseCounts[i % period]++;
        }
        double[] phaseAverages = new double[period];
        double phaseMean = 0.0;
        for (int p = 0; p < period; p++) {
            phaseAverages[p] = phaseCounts[p] > 0 ? phaseSums[p] / phaseCounts[p] : 0.0;
            phaseMean += phaseAverages[p];
        }
        phaseMean /= period;
        for (int p = 0; p < period; p++) {
            phaseAverages[p] -= phaseMean;
        }

        double[] seasonal = new double[n];
        double[] residual = new double[n];
        for (int i = 0; i < n; i++) {
            seasonal[i] = phaseAverages[i % period];
            residual[i] = values[i] - trend[i] - seasonal[i];
        }
        return new SeasonalDecomposition(period, trend, seasonal, residual, validFrom, validTo);
    }

    /**
     * Centered moving average over {@code period}; even periods use the 2xm
     * form with half weights on both ends. Positions without a full window are 0.
     */
    public static double[] centeredMovingAverage(double[] values, int period) {
        int n = values.length;
        int half = period / 2;
        boolean even = period % 2 == 0;
        double[] trend = new double[n];
        for (int i = half; i < n - half; i++) {
            double sum = 0.0;
            if (even) {
                sum += 0.5 * values[i - half] + 0.5 * values[i + half];
                for (int j = i - half + 1; j <= i + half - 1; j++) sum += values[j];
            } else {
                for (int j = i - half; j <= i + half; j++) sum += values[j];
            }
            trend[i] = sum / period;
        }
        return trend;
    }

    /**
     * Clamps a confidence or score to [0, 1]; NaN maps to 0.
     */
    public static double clampUnit(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
