package com.metrics.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Details of a forecast finding")
public class PredictiveInsight {

    String id;

    String metric;

    @Schema(description = "Value predicted for the end of the horizon", example = "1430.5")
    double value;

    @Schema(description = "Forecast confidence (0-1)", example = "0.72")
    double confidence;

    @Schema(description = "Lower bound of the predicted range (value - 20%)", example = "1144.4")
    double lower;

    @Schema(description = "Upper bound of the predicted range (value + 20%)", example = "1716.6")
    double upper;

    @Schema(description = "Forecast horizon", example = "7 days")
    String timeframe;

    String methodology;

    List<String> factors;

    @Schema(description = "Coarse business impact", example = "Significant")
    String businessImpact;

    /**
     * The complete predicted path behind this finding.
     */
    List<MetricDataPoint> predictions;
}
