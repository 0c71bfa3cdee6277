package com.metrics.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@Schema(description = "Raw values to preprocess; null entries are treated as missing")
public class PreprocessRequest {

    @Schema(description = "Raw values in series order", example = "[10.0, null, 12.0, 11.5]")
    List<Double> values;

    @Schema(description = "Preprocessing options; server defaults apply when omitted")
    PreprocessingConfig config;
}
