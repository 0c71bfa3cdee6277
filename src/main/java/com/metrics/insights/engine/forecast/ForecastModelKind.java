package com.metrics.insights.engine.forecast;

import com.metrics.insights.model.ModelParameters;

/**
 * Forecasting models that can be fitted to a bare value history indexed 0..n-1.
 */
public enum ForecastModelKind {
    LINEAR,
    POLYNOMIAL,
    MOVING_AVERAGE,
    EXPONENTIAL_SMOOTHING,
    SEASONAL_DECOMPOSITION;

    public SeriesForecaster fit(double[] history, ModelParameters parameters) {
        int n = history.length;
        double[] index = new double[n];
        for (int i = 0; i < n; i++) index[i] = i;

        return switch (this) {
            case LINEAR -> {
                LinearRegressionModel model = new LinearRegressionModel();
                model.train(index, history);
                yield steps -> model.predict(futureIndex(n, steps));
            }
            case POLYNOMIAL -> {
                PolynomialRegressionModel model = new PolynomialRegressionModel(parameters.getDegree());
                model.train(index, history);
                yield steps -> model.predict(futureIndex(n, steps));
            }
            case MOVING_AVERAGE -> {
                MovingAverageModel model = new MovingAverageModel(parameters.getWindow(), MovingAverageModel.Type.SIMPLE);
                yield steps -> model.forecast(history, steps);
            }
            case EXPONENTIAL_SMOOTHING -> {
                MovingAverageModel model = new MovingAverageModel(
                        parameters.getWindow(), MovingAverageModel.Type.EXPONENTIAL, parameters.getAlpha());
                yield steps -> model.forecast(history, steps);
            }
            case SEASONAL_DECOMPOSITION -> {
                SeasonalDecompositionModel model = new SeasonalDecompositionModel(parameters.getPeriod());
                // fail at fit time rather than at the first forecast
                model.decompose(history);
                yield steps -> model.forecast(history, steps).getForecast();
            }
        };
    }

    private static double[] futureIndex(int n, int steps) {
        double[] x = new double[steps];
        for (int i = 0; i < steps; i++) x[i] = n + i;
        return x;
    }
}
