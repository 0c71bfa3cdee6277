package com.metrics.insights.engine.forecast;

import com.metrics.insights.engine.stats.InsufficientDataException;
import com.metrics.insights.engine.stats.SeasonalDecomposition;
import com.metrics.insights.engine.stats.StatisticalPrimitives;
import lombok.Value;

/**
 * Classical decomposition over a fixed period, additive or multiplicative, with
 * strength measures and a trend-plus-last-cycle forecast.
 *
 * <p>In the multiplicative form the seasonal component is a relative factor
 * (value / trend - 1) and the residual is value / (trend * (1 + seasonal)).
 */
public class SeasonalDecompositionModel {

    public enum Mode {
        ADDITIVE,
        MULTIPLICATIVE
    }

    private final int period;
    private final Mode mode;

    public SeasonalDecompositionModel(int period) {
        this(period, Mode.ADDITIVE);
    }

    public SeasonalDecompositionModel(int period, Mode mode) {
        if (period < 2) {
            throw new IllegalArgumentException("period must be >= 2, was " + period);
        }
        this.period = period;
        this.mode = mode != null ? mode : Mode.ADDITIVE;
    }

    /**
     * @throws InsufficientDataException when fewer than two full periods are given
     */
    public Result decompose(double[] data) {
        SeasonalDecomposition additive = StatisticalPrimitives.seasonalDecompose(data, period);
        double[] trend = additive.getTrend();
        int from = additive.getValidFrom();
        int to = additive.getValidTo();

        double[] seasonal;
        double[] residual;
        if (mode == Mode.ADDITIVE) {
            seasonal = additive.getSeasonal();
            residual = additive.getResidual();
        } else {
            seasonal = multiplicativeSeasonal(data, trend, from, to);
            residual = new double[data.length];
            for (int i = 0; i < data.length; i++) {
                double expected = trend[i] * (1 + seasonal[i]);
                residual[i] = expected == 0 ? 0.0 : data[i] / expected;
            }
        }

        double[] deseasonalised = new double[data.length];
        for (int i = 0; i < data.length; i++) deseasonalised[i] = data[i] - seasonal[i];
        double seasonalVariance = variance(seasonal, 0, data.length - 1);
        double seasonalityStrength = ratio(seasonalVariance, variance(deseasonalised, 0, data.length - 1));

        double[] detrended = new double[data.length];
        for (int i = 0; i < data.length; i++) detrended[i] = data[i] - trend[i];
        double trendStrength = ratio(variance(trend, from, to), variance(detrended, from, to));

        return new Result(trend, seasonal, residual, from, to, seasonalityStrength, trendStrength);
    }

    /**
     * Extrapolates the defined part of the trend with a linear fit and applies
     * the last full seasonal cycle on top.
     */
    public Forecast forecast(double[] data, int periods) {
        if (periods < 1) {
            throw new IllegalArgumentException("periods must be >= 1, was " + periods);
        }
        Result decomposition = decompose(data);
        int from = decomposition.getValidFrom();
        int length = decomposition.getValidTo() - from + 1;
        double[] trendX = new double[length];
        double[] trendY = new double[length];
        for (int i = 0; i < length; i++) {
            trendX[i] = i;
            trendY[i] = decomposition.getTrend()[from + i];
        }
        LinearRegressionModel trendModel = new LinearRegressionModel();
        trendModel.train(trendX, trendY);

        double[] futureX = new double[periods];
        for (int i = 0; i < periods; i++) futureX[i] = length + i;
        double[] trendForecast = trendModel.predict(futureX);

        double[] seasonal = decomposition.getSeasonal();
        int cycleStart = seasonal.length - period;
        double[] seasonalForecast = new double[periods];
        double[] forecast = new double[periods];
        for (int i = 0; i < periods; i++) {
            seasonalForecast[i] = seasonal[cycleStart + i % period];
            forecast[i] = mode == Mode.ADDITIVE
                    ? trendForecast[i] + seasonalForecast[i]
                    : trendForecast[i] * (1 + seasonalForecast[i]);
        }
        return new Forecast(forecast, trendForecast, seasonalForecast);
    }

    private double[] multiplicativeSeasonal(double[] data, double[] trend, int from, int to) {
        double[] sums = new double[period];
        int[] counts = new int[period];
        for (int i = from; i <= to; i++) {
            if (trend[i] == 0) continue;
            sums[i % period] += data[i] / trend[i] - 1;
            counts[i % period]++;
        }
        double[] factors = new double[period];
        double mean = 0.0;
        for (int p = 0; p < period; p++) {
            factors[p] = counts[p] > 0 ? sums[p] / counts[p] : 0.0;
            mean += factors[p];
        }
        mean /= period;
        double[] seasonal = new double[data.length];
        for (int i = 0; i < data.length; i++) seasonal[i] = factors[i % period] - mean;
        return seasonal;
    }

    private static double variance(double[] values, int from, int to) {
        int count = to - from + 1;
        if (count <= 0) return 0.0;
        double mean = 0.0;
        for (int i = from; i <= to; i++) mean += values[i];
        mean /= count;
        double sum = 0.0;
        for (int i = from; i <= to; i++) sum += (values[i] - mean) * (values[i] - mean);
        return sum / count;
    }

    private static double ratio(double part, double other) {
        double total = part + other;
        return total == 0 ? 0.0 : part / total;
    }

    public int getPeriod() {
        return period;
    }

    public Mode getMode() {
        return mode;
    }

    @Value
    public static class Result {
        double[] trend;
        double[] seasonal;
        double[] residual;
        int validFrom;
        int validTo;
        double seasonalityStrength;
        double trendStrength;
    }

    @Value
    public static class Forecast {
        double[] forecast;
        double[] trendForecast;
        double[] seasonalForecast;
    }
}
