package com.metrics.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Outliers flagged in a single series")
public class OutlierResult {

    @Schema(description = "Flagged entries in input order")
    List<Outlier> outliers;

    @Schema(description = "Input values that were not flagged, in input order")
    List<Double> cleanData;

    @Schema(description = "Detection strategy", example = "ZSCORE")
    OutlierMethod method;

    @Schema(description = "Threshold actually applied by the strategy", example = "2.5")
    double threshold;

    @Value
    @Builder
    public static class Outlier {

        @Schema(description = "Position in the input", example = "4")
        int index;

        @Schema(description = "Input value", example = "100.0")
        double value;

        @Schema(description = "Outlier score clamped to 0-1", example = "1.0")
        double score;

        @Schema(description = "Unclamped strategy statistic (z-score, IQR distance, isolation score or LOF)",
                example = "2.0")
        double statistic;
    }
}
