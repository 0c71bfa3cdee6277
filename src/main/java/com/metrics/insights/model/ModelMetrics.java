package com.metrics.insights.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Prediction quality scores")
public class ModelMetrics {

    @Schema(description = "Mean squared error")
    double mse;

    @Schema(description = "Root mean squared error")
    double rmse;

    @Schema(description = "Mean absolute error")
    double mae;

    @Schema(description = "Mean absolute percentage error (%)")
    double mape;

    @Schema(description = "Coefficient of determination")
    double r2;

    @Schema(description = "Adjusted R², present when a parameter count is given")
    Double adjustedR2;

    @Schema(description = "Akaike information criterion, present when a parameter count is given")
    Double aic;

    @Schema(description = "Bayesian information criterion, present when a parameter count is given")
    Double bic;
}
