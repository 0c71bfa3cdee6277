package com.metrics.insights.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Tagged variant carrying the finding behind an {@link Insight}. Exactly one of
 * the finding fields is set, and {@link #getKind()} names which one.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "The finding behind an insight; exactly one field besides 'kind' is present")
public class InsightPayload {

    InsightType kind;
    Anomaly anomaly;
    TrendAnalysis trend;
    PredictiveInsight prediction;
    PatternInsight pattern;
    InsightRecommendation recommendation;

    public static InsightPayload anomaly(Anomaly anomaly) {
        return new InsightPayload(InsightType.ANOMALY, anomaly, null, null, null, null);
    }

    public static InsightPayload trend(TrendAnalysis trend) {
        return new InsightPayload(InsightType.TREND, null, trend, null, null, null);
    }

    public static InsightPayload prediction(PredictiveInsight prediction) {
        return new InsightPayload(InsightType.PREDICTION, null, null, prediction, null, null);
    }

    public static InsightPayload pattern(PatternInsight pattern) {
        return new InsightPayload(InsightType.PATTERN, null, null, null, pattern, null);
    }

    public static InsightPayload recommendation(InsightRecommendation recommendation) {
        return new InsightPayload(InsightType.RECOMMENDATION, null, null, null, null, recommendation);
    }
}
