package com.metrics.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@Schema(description = "A ranked, human-readable analytical finding")
public class Insight {

    @Schema(description = "Insight identifier", example = "trend_sessions")
    String id;

    @Schema(description = "Insight type; always equal to data.kind", example = "TREND")
    InsightType type;

    @Schema(description = "Short title", example = "sessions showing increasing trend")
    String title;

    @Schema(description = "One-sentence description")
    String description;

    @Schema(description = "Severity", example = "WARNING")
    InsightSeverity severity;

    @Schema(description = "Confidence (0-1)", example = "0.87")
    double confidence;

    @Schema(description = "Creation time")
    Instant createdAt;

    @Schema(description = "Metrics involved", example = "[\"sessions\"]")
    List<String> metrics;

    @Schema(description = "The finding behind this insight")
    InsightPayload data;

    @Schema(description = "Free-form tags", example = "[\"trend\", \"increasing\", \"warning\"]")
    List<String> tags;

    /**
     * Set only by consumers; the engine never reads it.
     */
    @With
    @Schema(description = "Whether a consumer dismissed this insight", example = "false")
    boolean dismissed;

    @Schema(description = "Suggested UI actions")
    List<InsightAction> actions;
}
