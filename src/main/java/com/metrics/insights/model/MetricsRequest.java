package com.metrics.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@Schema(description = "Paired actual and predicted values to score")
public class MetricsRequest {

    @Schema(description = "Observed values", example = "[100.0, 110.0, 120.0]")
    List<Double> actual;

    @Schema(description = "Predicted values, same length as actual", example = "[98.0, 112.0, 119.0]")
    List<Double> predicted;

    @Schema(description = "Number of model parameters; enables adjusted R², AIC and BIC", example = "2")
    Integer parameterCount;
}
