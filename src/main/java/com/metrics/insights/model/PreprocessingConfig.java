package com.metrics.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Preprocessing options")
public class PreprocessingConfig {

    @Builder.Default
    @Schema(description = "Min-max scale the result to [0,1]", example = "false")
    boolean normalize = false;

    @Builder.Default
    @Schema(description = "How missing values are imputed", example = "INTERPOLATE")
    FillMethod fillMissing = FillMethod.INTERPOLATE;

    @Builder.Default
    @Schema(description = "Clamp values further than outlierThreshold standard deviations from the mean",
            example = "false")
    boolean removeOutliers = false;

    @Builder.Default
    @Schema(description = "Clamping distance in standard deviations", example = "3.0")
    double outlierThreshold = 3.0;

    @Builder.Default
    @Schema(description = "Apply a centered moving-average filter", example = "false")
    boolean smoothing = false;

    @Builder.Default
    @Schema(description = "Smoothing window size", example = "3")
    int smoothingWindow = 3;

    public static PreprocessingConfig defaults() {
        return PreprocessingConfig.builder().build();
    }
}
