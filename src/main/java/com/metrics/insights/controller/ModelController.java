package com.metrics.insights.controller;

import com.metrics.insights.engine.forecast.SeriesForecaster;
import com.metrics.insights.model.CrossValidationRequest;
import com.metrics.insights.model.CrossValidationResult;
import com.metrics.insights.model.MetricsRequest;
import com.metrics.insights.service.ModelEvaluationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Prediction-quality scoring and rolling-origin cross-validation")
public class ModelController {

    private final ModelEvaluationService modelEvaluationService;

    public ModelController(ModelEvaluationService modelEvaluationService) {
        this.modelEvaluationService = modelEvaluationService;
    }

    @Operation(summary = "Score predictions against actual values",
            description = "Returns MSE, RMSE, MAE, MAPE and R². Supplying parameterCount adds adjusted R², AIC and BIC.")
    @PostMapping("/metrics")
    public ResponseEntity<?> metrics(@RequestBody MetricsRequest request) {
        if (request.getParameterCount() != null && request.getParameterCount() < 0) {
            return badRequest("parameterCount must be >= 0", "parameterCount");
        }
        return ResponseEntity.ok(modelEvaluationService.score(request));
    }

    @Operation(summary = "Cross-validate a forecasting model",
            description = "Fold i trains on the first minTrainSize + i * (n / folds) values and is scored by the R² " +
                    "of its forecast for the next n / folds values. Failed folds are skipped.")
    @PostMapping("/cross-validate")
    public ResponseEntity<?> crossValidate(@RequestBody CrossValidationRequest request) {
        if (request.getFolds() < 1) {
            return badRequest("folds must be >= 1", "folds");
        }
        if (request.getModel() == null) {
            return badRequest("model is required", "model");
        }
        CrossValidationResult<SeriesForecaster> result = modelEvaluationService.crossValidate(request);
        return ResponseEntity.ok(result);
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }
}
