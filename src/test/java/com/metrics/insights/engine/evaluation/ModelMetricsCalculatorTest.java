package com.metrics.insights.engine.evaluation;

import com.metrics.insights.model.ModelMetrics;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ModelMetricsCalculatorTest {

    private static final double[] ACTUAL = {1, 2, 3, 4};
    private static final double[] PREDICTED = {1, 2, 3, 5};

    @Test
    void calculate_basicScores() {
        ModelMetrics metrics = ModelMetricsCalculator.calculate(ACTUAL, PREDICTED);

        assertThat(metrics.getMse()).isCloseTo(0.25, within(1e-9));
        assertThat(metrics.getRmse()).isCloseTo(0.5, within(1e-9));
        assertThat(metrics.getMae()).isCloseTo(0.25, within(1e-9));
        assertThat(metrics.getMape()).isCloseTo(6.25, within(1e-9));
        assertThat(metrics.getR2()).isCloseTo(0.8, within(1e-9));
        assertThat(metrics.getAdjustedR2()).isNull();
        assertThat(metrics.getAic()).isNull();
        assertThat(metrics.getBic()).isNull();
    }

    @Test
    void calculate_withParameterCount_addsInformationCriteria() {
        ModelMetrics metrics = ModelMetricsCalculator.calculate(ACTUAL, PREDICTED, 1);

        assertThat(metrics.getAdjustedR2()).isCloseTo(0.7, within(1e-9));
        assertThat(metrics.getAic()).isCloseTo(4 * Math.log(0.25) + 2, within(1e-9));
        assertThat(metrics.getBic()).isCloseTo(4 * Math.log(0.25) + Math.log(4), within(1e-9));
    }

    @Test
    void calculate_noDegreesOfFreedom_adjustedR2EqualsR2() {
        ModelMetrics metrics = ModelMetricsCalculator.calculate(ACTUAL, PREDICTED, 3);

        assertThat(metrics.getAdjustedR2()).isEqualTo(metrics.getR2());
    }

    @Test
    void calculate_perfectPrediction_staysFinite() {
        ModelMetrics metrics = ModelMetricsCalculator.calculate(ACTUAL, ACTUAL, 2);

        assertThat(metrics.getMse()).isEqualTo(0.0);
        assertThat(metrics.getR2()).isCloseTo(1.0, within(1e-9));
        assertThat(metrics.getAic()).isFinite();
        assertThat(metrics.getBic()).isFinite();
    }

    @Test
    void calculate_zeroActual_usesEpsilonDenominator() {
        ModelMetrics metrics = ModelMetricsCalculator.calculate(new double[]{0, 1}, new double[]{1, 1});

        assertThat(metrics.getMape()).isFinite().isGreaterThan(1e9);
    }

    @Test
    void calculate_constantActual_hasZeroR2() {
        ModelMetrics metrics = ModelMetricsCalculator.calculate(new double[]{5, 5, 5}, new double[]{4, 5, 6});

        assertThat(metrics.getR2()).isEqualTo(0.0);
    }

    @Test
    void calculate_predictionsWorseThanMean_giveNegativeR2() {
        ModelMetrics metrics = ModelMetricsCalculator.calculate(new double[]{1, 2, 3}, new double[]{3, 2, 1});

        assertThat(metrics.getR2()).isNegative();
    }

    @Test
    void calculate_mismatchedOrEmptyInput_throws() {
        assertThatThrownBy(() -> ModelMetricsCalculator.calculate(new double[]{1, 2}, new double[]{1}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ModelMetricsCalculator.calculate(new double[0], new double[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
