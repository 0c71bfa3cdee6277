package com.metrics.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "A UI affordance suggested alongside an insight")
public class InsightAction {

    @Schema(description = "Button label", example = "Investigate")
    String label;

    @Schema(description = "Action identifier", example = "investigate")
    String action;

    @Schema(description = "Whether this is the primary action", example = "true")
    boolean primary;

    public static InsightAction primary(String label, String action) {
        return new InsightAction(label, action, true);
    }

    public static InsightAction secondary(String label, String action) {
        return new InsightAction(label, action, false);
    }
}
