package com.metrics.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Trend characterisation and significant calendar patterns of one series")
public class TrendReport {

    String metric;

    TrendAnalysis trend;

    @Schema(description = "Weekly and monthly patterns with strength above 0.3")
    List<SeasonalPattern> patterns;
}
