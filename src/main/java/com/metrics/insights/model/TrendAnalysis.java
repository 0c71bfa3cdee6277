package com.metrics.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@Schema(description = "Direction and strength of a metric's linear trend")
public class TrendAnalysis {

    @Schema(description = "Trend direction", example = "INCREASING")
    TrendDirection direction;

    @Schema(description = "Trend strength (0-1)", example = "0.87")
    double strength;

    @Schema(description = "Percentage change between first and last raw values", example = "23.5")
    double rate;

    @Schema(description = "Confidence, equal to the regression R² (0-1)", example = "0.87")
    double confidence;

    @Schema(description = "Start of the analysed range")
    Instant startDate;

    @Schema(description = "End of the analysed range")
    Instant endDate;

    @Schema(description = "Coefficient of determination of the fit", example = "0.87")
    double r2;
}
