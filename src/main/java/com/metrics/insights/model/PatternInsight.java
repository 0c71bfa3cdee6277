package com.metrics.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Details of a seasonal pattern finding")
public class PatternInsight {

    String id;

    @Schema(description = "Pattern type", example = "WEEKLY")
    PatternType pattern;

    String description;

    double frequency;

    double strength;

    @Schema(description = "Phase with the highest average", example = "Monday")
    String peak;

    @Schema(description = "Phase with the lowest average", example = "Sunday")
    String trough;

    List<String> implications;
}
