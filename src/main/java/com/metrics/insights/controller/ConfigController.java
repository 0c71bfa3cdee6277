package com.metrics.insights.controller;

import com.metrics.insights.config.AnalyticsProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View the effective analytics configuration")
public class ConfigController {

    private final AnalyticsProperties properties;

    public ConfigController(AnalyticsProperties properties) {
        this.properties = properties;
    }

    @Operation(summary = "Get the effective analytics configuration",
            description = "Anomaly detection, preprocessing and outlier defaults, calendar zone and forecast horizon. Read-only.")
    @GetMapping("/analytics")
    public ResponseEntity<Map<String, Object>> getAnalyticsConfig() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("zoneId", properties.getZoneId());
        body.put("forecastHorizon", properties.getForecastHorizon());
        body.put("anomaly", properties.toAnomalyDetectionConfig());
        body.put("preprocessing", properties.toPreprocessingConfig());
        body.put("outlier", Map.of(
                "method", properties.getOutlier().getMethod(),
                "threshold", properties.getOutlier().getThreshold()));
        return ResponseEntity.ok(body);
    }
}
