package com.metrics.insights.model;

import com.metrics.insights.engine.forecast.ForecastModelKind;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@Schema(description = "Rolling-origin cross-validation of one forecasting model over a value history")
public class CrossValidationRequest {

    @Schema(description = "Value history, oldest first")
    List<Double> values;

    @Schema(description = "Model to evaluate", example = "LINEAR")
    ForecastModelKind model;

    @Builder.Default
    @Schema(description = "Number of folds", example = "5")
    int folds = 5;

    @Schema(description = "Minimum training length; defaults to 30% of the history", example = "10")
    Integer minTrainSize;

    @Schema(description = "Model hyper-parameters; defaults apply when omitted")
    ModelParameters parameters;
}
