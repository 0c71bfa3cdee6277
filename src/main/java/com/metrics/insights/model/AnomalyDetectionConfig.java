package com.metrics.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

@Value
@With
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Anomaly detector options")
public class AnomalyDetectionConfig {

    @Builder.Default
    @Schema(description = "Detector sensitivity", example = "MEDIUM")
    Sensitivity sensitivity = Sensitivity.MEDIUM;

    @Builder.Default
    @Schema(description = "History window in days the caller is expected to supply", example = "30")
    int lookbackPeriod = 30;

    @Builder.Default
    @Schema(description = "Minimum number of points before the seasonal-residual pass runs", example = "14")
    int seasonalityWindow = 14;

    @Builder.Default
    @Schema(description = "Floor, in standard deviations, for the z-score threshold", example = "2.0")
    double minimumDeviation = 2.0;

    @Builder.Default
    @Schema(description = "Ignore Saturday and Sunday points in the z-score and isolation passes", example = "false")
    boolean excludeWeekends = false;

    public static AnomalyDetectionConfig defaults() {
        return AnomalyDetectionConfig.builder().build();
    }
}
