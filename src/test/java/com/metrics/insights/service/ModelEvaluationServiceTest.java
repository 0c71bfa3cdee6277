package com.metrics.insights.service;

import com.metrics.insights.engine.evaluation.TimeSeriesCrossValidator;
import com.metrics.insights.engine.forecast.ForecastModelKind;
import com.metrics.insights.engine.forecast.SeriesForecaster;
import com.metrics.insights.model.CrossValidationRequest;
import com.metrics.insights.model.CrossValidationResult;
import com.metrics.insights.model.MetricsRequest;
import com.metrics.insights.model.ModelMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ModelEvaluationServiceTest {

    private ModelEvaluationService service;

    @BeforeEach
    void setUp() {
        service = new ModelEvaluationService(new TimeSeriesCrossValidator());
    }

    private static List<Double> line(int n) {
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < n; i++) values.add(3.0 * i + 2);
        return values;
    }

    @Test
    void score_withParameterCount_returnsFullMetrics() {
        MetricsRequest request = MetricsRequest.builder()
                .actual(List.of(1.0, 2.0, 3.0, 4.0))
                .predicted(List.of(1.0, 2.0, 3.0, 5.0))
                .parameterCount(1)
                .build();

        ModelMetrics metrics = service.score(request);

        assertThat(metrics.getR2()).isCloseTo(0.8, within(1e-9));
        assertThat(metrics.getAic()).isNotNull();
    }

    @Test
    void score_missingPredictions_throws() {
        MetricsRequest request = MetricsRequest.builder().actual(List.of(1.0)).build();

        assertThatThrownBy(() -> service.score(request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("predicted");
    }

    @Test
    void score_nullEntry_throws() {
        MetricsRequest request = MetricsRequest.builder()
                .actual(Arrays.asList(1.0, null))
                .predicted(List.of(1.0, 2.0))
                .build();

        assertThatThrownBy(() -> service.score(request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("actual[1]");
    }

    @Test
    void crossValidate_linearModelOnLine_scoresPerfectly() {
        CrossValidationRequest request = CrossValidationRequest.builder()
                .values(line(25))
                .model(ForecastModelKind.LINEAR)
                .build();

        CrossValidationResult<SeriesForecaster> result = service.crossValidate(request);

        assertThat(request.getFolds()).isEqualTo(5);
        assertThat(result.getScores()).isNotEmpty()
                .allSatisfy(score -> assertThat(score).isCloseTo(1.0, within(1e-9)));
        assertThat(result.getBestModel()).isNotNull();
    }

    @Test
    void crossValidate_seasonalModelOnShortFolds_skipsFailures() {
        CrossValidationRequest request = CrossValidationRequest.builder()
                .values(line(20))
                .model(ForecastModelKind.SEASONAL_DECOMPOSITION)
                .folds(4)
                .build();

        CrossValidationResult<SeriesForecaster> result = service.crossValidate(request);

        // folds train on 6, 11 and 16 values; period 7 needs 14
        assertThat(result.getScores()).hasSize(1);
    }

    @Test
    void crossValidate_missingModel_throws() {
        CrossValidationRequest request = CrossValidationRequest.builder().values(line(10)).build();

        assertThatThrownBy(() -> service.crossValidate(request))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
