package com.metrics.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@Schema(description = "A recommendation derived from a cross-metric finding")
public class InsightRecommendation {

    String id;

    String title;

    String description;

    @Schema(description = "Priority", example = "MEDIUM")
    Level priority;

    @Schema(description = "Confidence (0-1)", example = "0.93")
    double confidence;

    @Schema(description = "Category", example = "TECHNICAL")
    Category category;

    List<RecommendedAction> actions;

    String potentialImpact;

    List<String> evidencePoints;

    Instant createdAt;

    public enum Level {
        CRITICAL,
        HIGH,
        MEDIUM,
        LOW
    }

    public enum Category {
        TRAFFIC,
        CONVERSION,
        ENGAGEMENT,
        TECHNICAL,
        CONTENT
    }

    @Value
    @Builder
    public static class RecommendedAction {
        String title;
        String description;
        Level effort;
        Level impact;
    }
}
