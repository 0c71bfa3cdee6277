package com.metrics.insights.controller;

import com.metrics.insights.model.Anomaly;
import com.metrics.insights.model.ForecastResult;
import com.metrics.insights.model.Insight;
import com.metrics.insights.model.Sensitivity;
import com.metrics.insights.model.TimeSeries;
import com.metrics.insights.model.TrendReport;
import com.metrics.insights.service.InsightService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/v1/insights")
@Tag(name = "Insights", description = "Anomalies, trends, patterns, forecasts and ranked insights for metric time series")
public class InsightController {

    private final InsightService insightService;

    public InsightController(InsightService insightService) {
        this.insightService = insightService;
    }

    @Operation(summary = "Generate ranked insights for a batch of series",
            description = "Runs anomaly detection, trend analysis, pattern discovery and forecasting per series, " +
                    "adds cross-metric correlation findings, and returns all insights ranked by severity weight x confidence. " +
                    "A series whose analysis fails is skipped rather than failing the batch.")
    @PostMapping("/generate")
    public CompletableFuture<List<Insight>> generate(@RequestBody List<TimeSeries> batch) {
        return insightService.generateInsightsAsync(batch);
    }

    @Operation(summary = "Detect anomalies in one series",
            description = "Z-score, sliding-window isolation and seasonal-residual passes, deduplicated so that " +
                    "one real event is reported once.")
    @PostMapping("/anomalies")
    public ResponseEntity<List<Anomaly>> anomalies(
            @RequestBody TimeSeries series,
            @Parameter(description = "Overrides the configured sensitivity", example = "HIGH")
            @RequestParam(required = false) Sensitivity sensitivity) {
        return ResponseEntity.ok(insightService.detectAnomalies(series, sensitivity));
    }

    @Operation(summary = "Analyse the trend and calendar patterns of one series")
    @PostMapping("/trend")
    public ResponseEntity<TrendReport> trend(@RequestBody TimeSeries series) {
        return ResponseEntity.ok(insightService.analyzeTrend(series));
    }

    @Operation(summary = "Forecast one series",
            description = "Regression extrapolation with seasonal adjustment. Per-step confidence decays as R² x e^(-i/horizon).")
    @PostMapping("/forecast")
    public ResponseEntity<?> forecast(
            @RequestBody TimeSeries series,
            @Parameter(description = "Number of interval steps; defaults to analytics.forecast-horizon", example = "7")
            @RequestParam(required = false) Integer horizon) {
        if (horizon != null && horizon < 1) {
            return badRequest("horizon must be >= 1", "horizon");
        }
        ForecastResult result = insightService.forecast(series, horizon);
        return ResponseEntity.ok(result);
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }
}
