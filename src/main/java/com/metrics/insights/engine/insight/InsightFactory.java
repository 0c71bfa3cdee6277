package com.metrics.insights.engine.insight;

import com.metrics.insights.model.Anomaly;
import com.metrics.insights.model.ForecastResult;
import com.metrics.insights.model.Insight;
import com.metrics.insights.model.InsightAction;
import com.metrics.insights.model.InsightPayload;
import com.metrics.insights.model.InsightRecommendation;
import com.metrics.insights.model.InsightSeverity;
import com.metrics.insights.model.InsightType;
import com.metrics.insights.model.MetricDataPoint;
import com.metrics.insights.model.PatternInsight;
import com.metrics.insights.model.PredictiveInsight;
import com.metrics.insights.model.SeasonalPattern;
import com.metrics.insights.model.TimeInterval;
import com.metrics.insights.model.TrendAnalysis;
import com.metrics.insights.model.TrendDirection;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

import static com.metrics.insights.engine.stats.StatisticalPrimitives.clampUnit;

/**
 * Turns individual findings into titled, tagged {@link Insight} records.
 * Every confidence is clamped to [0, 1] here.
 */
public class InsightFactory {

    static final double PREDICTION_WARNING_CHANGE = 20.0;
    static final double PREDICTION_SIGNIFICANT_CHANGE = 10.0;
    static final double PREDICTION_RANGE = 0.2;

    private final Clock clock;

    public InsightFactory(Clock clock) {
        this.clock = clock;
    }

    public Insight anomaly(Anomaly anomaly) {
        return Insight.builder()
                .id(anomaly.getId())
                .type(InsightType.ANOMALY)
                .title(anomaly.getType().getLabel() + " detected in " + anomaly.getMetric())
                .description(anomaly.getDescription())
                .severity(anomaly.getSeverity().toInsightSeverity())
                .confidence(clampUnit(anomaly.getConfidence()))
                .createdAt(clock.instant())
                .metrics(List.of(anomaly.getMetric()))
                .data(InsightPayload.anomaly(anomaly))
                .tags(List.of("anomaly", tag(anomaly.getType()), tag(anomaly.getSeverity())))
                .actions(List.of(
                        InsightAction.primary("Investigate", "investigate"),
                        InsightAction.secondary("Dismiss", "dismiss")))
                .build();
    }

    public Insight trend(String metric, TrendAnalysis trend) {
        InsightSeverity severity = trendSeverity(trend);
        String direction = tag(trend.getDirection());
        return Insight.builder()
                .id("trend_" + metric)
                .type(InsightType.TREND)
                .title(metric + " showing " + direction + " trend")
                .description(String.format(Locale.ROOT, "%s has been %s by %.1f%% with %.0f%% confidence",
                        metric, direction, Math.abs(trend.getRate()), trend.getConfidence() * 100))
                .severity(severity)
                .confidence(clampUnit(trend.getConfidence()))
                .createdAt(clock.instant())
                .metrics(List.of(metric))
                .data(InsightPayload.trend(trend))
                .tags(List.of("trend", direction, tag(severity)))
                .actions(List.of(
                        InsightAction.primary("View Details", "view_trend"),
                        InsightAction.secondary("Set Alert", "set_alert")))
                .build();
    }

    public Insight pattern(String metric, SeasonalPattern pattern) {
        String type = tag(pattern.getType());
        PatternInsight details = PatternInsight.builder()
                .id("pattern_" + metric + "_" + type)
                .pattern(pattern.getType())
                .description(type + " seasonality in " + metric)
                .frequency(pattern.getStrength())
                .strength(pattern.getStrength())
                .peak(pattern.getPeak())
                .trough(pattern.getTrough())
                .implications(List.of("Optimize for " + pattern.getPeak(), "Investigate " + pattern.getTrough() + " performance"))
                .build();
        return Insight.builder()
                .id(details.getId())
                .type(InsightType.PATTERN)
                .title(type + " pattern detected in " + metric)
                .description("Strong " + type + " seasonality with peaks on " + pattern.getPeak()
                        + " and troughs on " + pattern.getTrough())
                .severity(InsightSeverity.INFO)
                .confidence(clampUnit(pattern.getStrength()))
                .createdAt(clock.instant())
                .metrics(List.of(metric))
                .data(InsightPayload.pattern(details))
                .tags(List.of("pattern", type, "seasonal"))
                .actions(List.of(
                        InsightAction.primary("Optimize Schedule", "optimize_schedule"),
                        InsightAction.secondary("View Pattern", "view_pattern")))
                .build();
    }

    /**
     * The change is measured between the first and the last predicted step.
     */
    public Insight prediction(ForecastResult forecast, TimeInterval interval) {
        List<MetricDataPoint> predictions = forecast.getPredictions();
        double first = predictions.isEmpty() ? 0.0 : predictions.get(0).getValue();
        double last = predictions.isEmpty() ? 0.0 : predictions.get(predictions.size() - 1).getValue();
        double change = first != 0 ? (last - first) / first * 100 : 0.0;
        boolean growth = change > 0;
        String timeframe = interval.describeSpan(forecast.getHorizon());
        String metric = forecast.getMetric();
        double confidence = clampUnit(forecast.getConfidence());

        PredictiveInsight details = PredictiveInsight.builder()
                .id("prediction_" + metric)
                .metric(metric)
                .value(last)
                .confidence(confidence)
                .lower(last * (1 - PREDICTION_RANGE))
                .upper(last * (1 + PREDICTION_RANGE))
                .timeframe(timeframe)
                .methodology(forecast.getMethodology())
                .factors(List.of("Historical trends", "Seasonal patterns"))
                .businessImpact(change > PREDICTION_SIGNIFICANT_CHANGE ? "Significant" : "Moderate")
                .predictions(predictions)
                .build();
        return Insight.builder()
                .id(details.getId())
                .type(InsightType.PREDICTION)
                .title(metric + " forecast: " + (growth ? "growth" : "decline") + " expected")
                .description(String.format(Locale.ROOT, "Predicted %.1f%% %s over next %s",
                        Math.abs(change), growth ? "increase" : "decrease", timeframe))
                .severity(Math.abs(change) > PREDICTION_WARNING_CHANGE ? InsightSeverity.WARNING : InsightSeverity.INFO)
                .confidence(confidence)
                .createdAt(clock.instant())
                .metrics(List.of(metric))
                .data(InsightPayload.prediction(details))
                .tags(List.of("prediction", "forecast", growth ? "growth" : "decline"))
                .actions(List.of(
                        InsightAction.primary("View Forecast", "view_forecast"),
                        InsightAction.secondary("Plan Actions", "plan_actions")))
                .build();
    }

    public Insight correlation(String first, String second, double correlation) {
        Instant now = clock.instant();
        String sign = correlation > 0 ? "positive" : "negative";
        double strength = clampUnit(Math.abs(correlation));
        InsightRecommendation recommendation = InsightRecommendation.builder()
                .id("correlation_" + first + "_" + second)
                .title("Metric Correlation")
                .description("Strong " + sign + " correlation detected")
                .priority(InsightRecommendation.Level.MEDIUM)
                .confidence(strength)
                .category(InsightRecommendation.Category.TECHNICAL)
                .actions(List.of(InsightRecommendation.RecommendedAction.builder()
                        .title("Monitor Together")
                        .description("Set up combined monitoring for these metrics")
                        .effort(InsightRecommendation.Level.LOW)
                        .impact(InsightRecommendation.Level.MEDIUM)
                        .build()))
                .potentialImpact("Improved monitoring and optimization opportunities")
                .evidencePoints(List.of(String.format(Locale.ROOT, "Correlation coefficient: %.3f", correlation)))
                .createdAt(now)
                .build();
        return Insight.builder()
                .id(recommendation.getId())
                .type(InsightType.RECOMMENDATION)
                .title("Strong correlation between " + first + " and " + second)
                .description(String.format(Locale.ROOT, "%s correlation (%.0f%%) suggests these metrics are related",
                        correlation > 0 ? "Positive" : "Negative", correlation * 100))
                .severity(InsightSeverity.INFO)
                .confidence(strength)
                .createdAt(now)
                .metrics(List.of(first, second))
                .data(InsightPayload.recommendation(recommendation))
                .tags(List.of("correlation", "metrics", "relationship"))
                .actions(List.of())
                .build();
    }

    /**
     * Low-confidence trends are always informational; otherwise the absolute
     * rate decides, with moderate growth reported as positive.
     */
    static InsightSeverity trendSeverity(TrendAnalysis trend) {
        if (trend.getConfidence() < 0.3) return InsightSeverity.INFO;
        double rate = Math.abs(trend.getRate());
        if (rate > 50) return InsightSeverity.CRITICAL;
        if (rate > 20) return InsightSeverity.WARNING;
        if (trend.getDirection() == TrendDirection.INCREASING && rate > 5) return InsightSeverity.POSITIVE;
        return InsightSeverity.INFO;
    }

    private static String tag(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
