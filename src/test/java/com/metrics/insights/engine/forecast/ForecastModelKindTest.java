package com.metrics.insights.engine.forecast;

import com.metrics.insights.engine.stats.InsufficientDataException;
import com.metrics.insights.model.ModelParameters;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ForecastModelKindTest {

    private static final double[] LINE = {1, 3, 5, 7, 9, 11, 13, 15, 17, 19};

    @Test
    void fit_linear_forecastsPastTheHistory() {
        SeriesForecaster forecaster = ForecastModelKind.LINEAR.fit(LINE, ModelParameters.defaults());

        assertThat(forecaster.forecast(3)).containsExactly(new double[]{21, 23, 25}, within(1e-9));
    }

    @Test
    void fit_polynomial_usesConfiguredDegree() {
        SeriesForecaster forecaster = ForecastModelKind.POLYNOMIAL.fit(LINE,
                ModelParameters.builder().degree(1).build());

        assertThat(forecaster.forecast(1)).containsExactly(new double[]{21}, within(1e-6));
    }

    @Test
    void fit_movingAverage_repeatsLastWindowMean() {
        SeriesForecaster forecaster = ForecastModelKind.MOVING_AVERAGE.fit(LINE,
                ModelParameters.builder().window(2).build());

        assertThat(forecaster.forecast(2)).containsExactly(18.0, 18.0);
    }

    @Test
    void fit_exponentialSmoothing_producesRequestedSteps() {
        SeriesForecaster forecaster = ForecastModelKind.EXPONENTIAL_SMOOTHING.fit(LINE, ModelParameters.defaults());

        assertThat(forecaster.forecast(4)).hasSize(4);
    }

    @Test
    void fit_seasonalDecompositionOnShortHistory_failsAtFitTime() {
        assertThatThrownBy(() -> ForecastModelKind.SEASONAL_DECOMPOSITION.fit(LINE, ModelParameters.defaults()))
                .isInstanceOf(InsufficientDataException.class);
    }
}
