package com.metrics.insights.service;

import com.metrics.insights.engine.evaluation.ModelMetricsCalculator;
import com.metrics.insights.engine.evaluation.TimeSeriesCrossValidator;
import com.metrics.insights.engine.forecast.SeriesForecaster;
import com.metrics.insights.model.CrossValidationRequest;
import com.metrics.insights.model.CrossValidationResult;
import com.metrics.insights.model.MetricsRequest;
import com.metrics.insights.model.ModelMetrics;
import com.metrics.insights.model.ModelParameters;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ModelEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(ModelEvaluationService.class);

    private final TimeSeriesCrossValidator crossValidator;

    public ModelEvaluationService(TimeSeriesCrossValidator crossValidator) {
        this.crossValidator = crossValidator;
    }

    public ModelMetrics score(MetricsRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        return ModelMetricsCalculator.calculate(
                toArray(request.getActual(), "actual"),
                toArray(request.getPredicted(), "predicted"),
                request.getParameterCount());
    }

    @Observed(name = "models.cross_validate", contextualName = "cross-validate-model")
    public CrossValidationResult<SeriesForecaster> crossValidate(CrossValidationRequest request) {
        if (request == null || request.getModel() == null) {
            throw new IllegalArgumentException("model is required");
        }
        double[] values = toArray(request.getValues(), "values");
        ModelParameters parameters = request.getParameters() != null
                ? request.getParameters()
                : ModelParameters.defaults();

        CrossValidationResult<SeriesForecaster> result = crossValidator.crossValidate(
                values,
                history -> request.getModel().fit(history, parameters),
                SeriesForecaster::forecast,
                request.getFolds(),
                request.getMinTrainSize());
        log.info("Cross-validated {} over {} values: {} folds scored, mean R² {}",
                request.getModel(), values.length, result.getScores().size(), result.getMeanScore());
        return result;
    }

    private static double[] toArray(List<Double> values, String field) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException(field + " must be a non-empty list");
        }
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            Double v = values.get(i);
            if (v == null || v.isNaN() || v.isInfinite()) {
                throw new IllegalArgumentException(field + "[" + i + "] is not a finite number");
            }
            out[i] = v;
        }
        return out;
    }
}
