package com.metrics.insights.engine.forecast;

import com.metrics.insights.engine.stats.StatisticalPrimitives;

import java.util.Arrays;

/**
 * Simple, exponential or linearly weighted moving average with a naive forecast.
 */
public class MovingAverageModel {

    public enum Type {
        SIMPLE,
        EXPONENTIAL,
        WEIGHTED
    }

    public static final double DEFAULT_ALPHA = 0.3;

    private final int window;
    private final Type type;
    private final double alpha;

    public MovingAverageModel(int window, Type type) {
        this(window, type, DEFAULT_ALPHA);
    }

    public MovingAverageModel(int window, Type type, double alpha) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be >= 1, was " + window);
        }
        this.window = window;
        this.type = type != null ? type : Type.SIMPLE;
        this.alpha = alpha > 0 && alpha <= 1 ? alpha : DEFAULT_ALPHA;
    }

    public double[] calculate(double[] data) {
        return switch (type) {
            case SIMPLE -> StatisticalPrimitives.movingAverage(data, window);
            case EXPONENTIAL -> StatisticalPrimitives.exponentialMovingAverage(data, alpha);
            case WEIGHTED -> weighted(data);
        };
    }

    /**
     * Simple and weighted averages repeat their last value. The exponential
     * variant continues the last smoothed step, damped by alpha^(i+1) per step.
     */
    public double[] forecast(double[] data, int periods) {
        if (periods < 0) {
            throw new IllegalArgumentException("periods must be >= 0, was " + periods);
        }
        if (data.length == 0) {
            return new double[periods];
        }
        double[] averaged = calculate(data);
        double last = averaged[averaged.length - 1];
        double[] forecast = new double[periods];
        if (type != Type.EXPONENTIAL) {
            Arrays.fill(forecast, last);
            return forecast;
        }
        double trend = averaged.length > 1 ? last - averaged[averaged.length - 2] : 0.0;
        double current = last;
        for (int i = 0; i < periods; i++) {
            forecast[i] = current;
            current += trend * Math.pow(alpha, i + 1);
        }
        return forecast;
    }

    private double[] weighted(double[] data) {
        double[] result = new double[data.length];
        double weightSum = window * (window + 1) / 2.0;
        for (int i = 0; i < data.length; i++) {
            if (i < window - 1) {
                result[i] = data[i];
                continue;
            }
            double weighted = 0.0;
            for (int j = 0; j < window; j++) {
                weighted += data[i - window + 1 + j] * (j + 1);
            }
            result[i] = weighted / weightSum;
        }
        return result;
    }

    public Type getType() {
        return type;
    }

    public int getWindow() {
        return window;
    }

    public double getAlpha() {
        return alpha;
    }
}
