package com.metrics.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Result of preprocessing a raw series")
public class ProcessedData {

    @Schema(description = "Input values as supplied; missing entries are null")
    List<Double> original;

    @Schema(description = "Values after imputation, clamping, smoothing and normalization")
    List<Double> processed;

    Metadata metadata;

    @Value
    @Builder
    @Schema(description = "Statistics of the valid input values and counts of applied corrections")
    public static class Metadata {
        double mean;
        double std;
        double min;
        double max;
        int missingCount;
        int outlierCount;
    }
}
