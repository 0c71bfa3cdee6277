package com.metrics.insights.engine.forecast;

/**
 * A model already fitted to a history, able to continue it.
 */
@FunctionalInterface
public interface SeriesForecaster {

    /**
     * Values for the {@code steps} positions following the fitted history.
     */
    double[] forecast(int steps);
}
