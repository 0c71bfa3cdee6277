package com.metrics.insights.controller;

import com.metrics.insights.model.OutlierMethod;
import com.metrics.insights.model.OutlierResult;
import com.metrics.insights.model.PreprocessRequest;
import com.metrics.insights.model.ProcessedData;
import com.metrics.insights.service.DataPreparationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/data")
@Tag(name = "Data", description = "Preprocessing and single-series outlier detection")
public class DataController {

    private final DataPreparationService dataPreparationService;

    public DataController(DataPreparationService dataPreparationService) {
        this.dataPreparationService = dataPreparationService;
    }

    @Operation(summary = "Preprocess a raw series",
            description = "Imputes missing values, clamps outliers, smooths and normalizes, in that order. " +
                    "Statistics in the metadata describe the valid input values.")
    @PostMapping("/preprocess")
    public ResponseEntity<?> preprocess(@RequestBody PreprocessRequest request) {
        if (request.getValues() == null) {
            return badRequest("values must be a list", "values");
        }
        ProcessedData result = dataPreparationService.preprocess(request.getValues(), request.getConfig());
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Flag outliers in a series",
            description = "Strategies: ZSCORE, IQR (1.5 fences), ISOLATION (nearest-neighbour distance, threshold/10) " +
                    "and LOF (simplified local outlier factor).")
    @PostMapping("/outliers")
    public ResponseEntity<?> outliers(
            @RequestBody List<Double> values,
            @Parameter(description = "Detection strategy; defaults to analytics.outlier.method", example = "ZSCORE")
            @RequestParam(required = false) OutlierMethod method,
            @Parameter(description = "Threshold; defaults to analytics.outlier.threshold", example = "2.5")
            @RequestParam(required = false) Double threshold) {
        if (threshold != null && threshold <= 0) {
            return badRequest("threshold must be > 0", "threshold");
        }
        OutlierResult result = dataPreparationService.detectOutliers(values, method, threshold);
        return ResponseEntity.ok(result);
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }
}
