package com.metrics.insights.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "A single observation of a metric")
public class MetricDataPoint {

    @Schema(description = "Observation time (ISO-8601)", example = "2024-03-01T00:00:00Z")
    Instant timestamp;

    @Schema(description = "Observed value", example = "1250.0")
    double value;

    @Schema(description = "Metric name", example = "sessions")
    String metric;

    @Schema(description = "Optional dimension tags", example = "{\"country\": \"DE\"}")
    Map<String, String> dimensions;

    @Schema(description = "Optional confidence of the observation or prediction (0-1)", example = "0.95")
    Double confidence;
}
