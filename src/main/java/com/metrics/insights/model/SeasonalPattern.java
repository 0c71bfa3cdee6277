package com.metrics.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "A repeating calendar pattern")
public class SeasonalPattern {

    @Schema(description = "Pattern type", example = "WEEKLY")
    PatternType type;

    @Schema(description = "(max - min) / max of the phase averages (0-1)", example = "0.64")
    double strength;

    @Schema(description = "Phase with the highest average", example = "Tuesday")
    String peak;

    @Schema(description = "Phase with the lowest average", example = "Sunday")
    String trough;
}
