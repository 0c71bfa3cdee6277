package com.metrics.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Hyper-parameters for the forecasting models; each model reads only its own")
public class ModelParameters {

    @Builder.Default
    @Schema(description = "Polynomial degree", example = "2")
    int degree = 2;

    @Builder.Default
    @Schema(description = "Moving-average window", example = "3")
    int window = 3;

    @Builder.Default
    @Schema(description = "Exponential smoothing factor", example = "0.3")
    double alpha = 0.3;

    @Builder.Default
    @Schema(description = "Seasonal period", example = "7")
    int period = 7;

    public static ModelParameters defaults() {
        return ModelParameters.builder().build();
    }
}
