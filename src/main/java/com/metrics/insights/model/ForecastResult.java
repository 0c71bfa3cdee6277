package com.metrics.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Short-horizon forecast of a metric")
public class ForecastResult {

    @Schema(description = "Metric name", example = "sessions")
    String metric;

    @Schema(description = "Predicted points, one per future interval, each with a decaying confidence")
    List<MetricDataPoint> predictions;

    @Schema(description = "Aggregate confidence, equal to the regression R² (0-1)", example = "0.72")
    double confidence;

    @Schema(description = "How the forecast was produced",
            example = "Linear regression with seasonal adjustment")
    String methodology;

    @Schema(description = "Number of forecast steps", example = "7")
    int horizon;
}
