package com.metrics.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@Schema(description = "A data point whose value deviates unexpectedly from its expected value")
public class Anomaly {

    @Schema(description = "Identifier: detector, metric and index", example = "zscore_sessions_15")
    String id;

    @Schema(description = "Timestamp of the anomalous observation", example = "2024-03-16T00:00:00Z")
    Instant timestamp;

    @Schema(description = "Metric name", example = "sessions")
    String metric;

    @Schema(description = "Observed value", example = "5000.0")
    double value;

    @Schema(description = "Value the detector expected", example = "1100.0")
    double expectedValue;

    @Schema(description = "Observed minus expected", example = "3900.0")
    double deviation;

    @Schema(description = "Severity", example = "CRITICAL")
    AnomalySeverity severity;

    @Schema(description = "Detector confidence (0-1)", example = "0.92")
    double confidence;

    @Schema(description = "Anomaly type", example = "SPIKE")
    AnomalyType type;

    @Schema(description = "Human-readable description")
    String description;

    @Schema(description = "Candidate causes for this kind of deviation on this kind of metric")
    List<String> potentialCauses;

    @Schema(description = "Severity-keyed impact statement",
            example = "High business impact - immediate attention required")
    String impactAssessment;
}
