package com.metrics.insights.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Rolling-origin cross-validation outcome. {@code bestModel} is the trained
 * model of the fold with the highest R², or null when no fold completed.
 */
@Value
@Builder
@Schema(description = "Rolling-origin cross-validation scores (R² per fold)")
public class CrossValidationResult<M> {

    @Schema(description = "R² of each completed fold, in fold order")
    List<Double> scores;

    @Schema(description = "Mean of the fold scores", example = "0.81")
    double meanScore;

    @Schema(description = "Sample standard deviation of the fold scores", example = "0.05")
    double stdScore;

    @JsonIgnore
    M bestModel;
}
