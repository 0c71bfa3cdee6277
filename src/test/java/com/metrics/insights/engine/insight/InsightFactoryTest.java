package com.metrics.insights.engine.insight;

import com.metrics.insights.model.Anomaly;
import com.metrics.insights.model.AnomalySeverity;
import com.metrics.insights.model.AnomalyType;
import com.metrics.insights.model.ForecastResult;
import com.metrics.insights.model.Insight;
import com.metrics.insights.model.InsightAction;
import com.metrics.insights.model.InsightSeverity;
import com.metrics.insights.model.InsightType;
import com.metrics.insights.model.MetricDataPoint;
import com.metrics.insights.model.PatternType;
import com.metrics.insights.model.SeasonalPattern;
import com.metrics.insights.model.TimeInterval;
import com.metrics.insights.model.TrendAnalysis;
import com.metrics.insights.model.TrendDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class InsightFactoryTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private InsightFactory factory;

    @BeforeEach
    void setUp() {
        factory = new InsightFactory(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static TrendAnalysis trend(TrendDirection direction, double rate, double confidence) {
        return TrendAnalysis.builder()
                .direction(direction)
                .rate(rate)
                .confidence(confidence)
                .strength(confidence)
                .r2(confidence)
                .build();
    }

    private static ForecastResult forecast(double first, double last, double confidence) {
        return ForecastResult.builder()
                .metric("revenue")
                .predictions(List.of(
                        MetricDataPoint.builder().timestamp(NOW).value(first).metric("revenue").build(),
                        MetricDataPoint.builder().timestamp(NOW.plusSeconds(86_400)).value(last).metric("revenue").build()))
                .confidence(confidence)
                .methodology("Linear regression with seasonal adjustment")
                .horizon(2)
                .build();
    }

    @Test
    void anomaly_titleTagsAndActions() {
        Anomaly anomaly = Anomaly.builder()
                .id("zscore_sessions_15")
                .metric("sessions")
                .timestamp(NOW)
                .value(500)
                .type(AnomalyType.SPIKE)
                .severity(AnomalySeverity.CRITICAL)
                .confidence(1.4)
                .description("sessions shows unusual spike")
                .build();

        Insight insight = factory.anomaly(anomaly);

        assertThat(insight.getId()).isEqualTo("zscore_sessions_15");
        assertThat(insight.getTitle()).isEqualTo("Spike detected in sessions");
        assertThat(insight.getSeverity()).isEqualTo(InsightSeverity.CRITICAL);
        assertThat(insight.getConfidence()).isEqualTo(1.0);
        assertThat(insight.getTags()).containsExactly("anomaly", "spike", "critical");
        assertThat(insight.getActions()).extracting(InsightAction::getLabel).containsExactly("Investigate", "Dismiss");
        assertThat(insight.getCreatedAt()).isEqualTo(NOW);
        assertThat(insight.getData().getKind()).isEqualTo(InsightType.ANOMALY);
        assertThat(insight.getData().getAnomaly()).isSameAs(anomaly);
        assertThat(insight.isDismissed()).isFalse();
    }

    @Test
    void trend_describesDirectionRateAndConfidence() {
        Insight insight = factory.trend("sessions", trend(TrendDirection.INCREASING, 145.0, 0.98));

        assertThat(insight.getId()).isEqualTo("trend_sessions");
        assertThat(insight.getType()).isEqualTo(InsightType.TREND);
        assertThat(insight.getTitle()).isEqualTo("sessions showing increasing trend");
        assertThat(insight.getDescription()).isEqualTo("sessions has been increasing by 145.0% with 98% confidence");
        assertThat(insight.getSeverity()).isEqualTo(InsightSeverity.CRITICAL);
        assertThat(insight.getTags()).containsExactly("trend", "increasing", "critical");
    }

    @Test
    void trendSeverity_followsConfidenceThenRate() {
        assertThat(InsightFactory.trendSeverity(trend(TrendDirection.INCREASING, 80, 0.2))).isEqualTo(InsightSeverity.INFO);
        assertThat(InsightFactory.trendSeverity(trend(TrendDirection.DECREASING, -60, 0.8))).isEqualTo(InsightSeverity.CRITICAL);
        assertThat(InsightFactory.trendSeverity(trend(TrendDirection.DECREASING, -30, 0.8))).isEqualTo(InsightSeverity.WARNING);
        assertThat(InsightFactory.trendSeverity(trend(TrendDirection.INCREASING, 10, 0.8))).isEqualTo(InsightSeverity.POSITIVE);
        assertThat(InsightFactory.trendSeverity(trend(TrendDirection.DECREASING, -10, 0.8))).isEqualTo(InsightSeverity.INFO);
    }

    @Test
    void pattern_namesPeakAndTrough() {
        SeasonalPattern pattern = SeasonalPattern.builder()
                .type(PatternType.WEEKLY).strength(0.9).peak("Monday").trough("Saturday").build();

        Insight insight = factory.pattern("sessions", pattern);

        assertThat(insight.getId()).isEqualTo("pattern_sessions_weekly");
        assertThat(insight.getSeverity()).isEqualTo(InsightSeverity.INFO);
        assertThat(insight.getConfidence()).isEqualTo(0.9);
        assertThat(insight.getDescription())
                .isEqualTo("Strong weekly seasonality with peaks on Monday and troughs on Saturday");
        assertThat(insight.getData().getPattern().getImplications())
                .containsExactly("Optimize for Monday", "Investigate Saturday performance");
    }

    @Test
    void prediction_largeGrowth_isWarningWithRange() {
        Insight insight = factory.prediction(forecast(100, 130, 0.8), TimeInterval.DAY);

        assertThat(insight.getTitle()).isEqualTo("revenue forecast: growth expected");
        assertThat(insight.getDescription()).isEqualTo("Predicted 30.0% increase over next 2 days");
        assertThat(insight.getSeverity()).isEqualTo(InsightSeverity.WARNING);
        assertThat(insight.getData().getPrediction().getLower()).isCloseTo(104.0, within(1e-9));
        assertThat(insight.getData().getPrediction().getUpper()).isCloseTo(156.0, within(1e-9));
        assertThat(insight.getData().getPrediction().getBusinessImpact()).isEqualTo("Significant");
        assertThat(insight.getData().getPrediction().getTimeframe()).isEqualTo("2 days");
    }

    @Test
    void prediction_smallDecline_isInformational() {
        Insight insight = factory.prediction(forecast(100, 95, 0.6), TimeInterval.HOUR);

        assertThat(insight.getTitle()).isEqualTo("revenue forecast: decline expected");
        assertThat(insight.getSeverity()).isEqualTo(InsightSeverity.INFO);
        assertThat(insight.getData().getPrediction().getBusinessImpact()).isEqualTo("Moderate");
        assertThat(insight.getTags()).contains("decline");
    }

    @Test
    void correlation_isTechnicalRecommendation() {
        Insight insight = factory.correlation("sessions", "revenue", -0.85);

        assertThat(insight.getType()).isEqualTo(InsightType.RECOMMENDATION);
        assertThat(insight.getId()).isEqualTo("correlation_sessions_revenue");
        assertThat(insight.getConfidence()).isCloseTo(0.85, within(1e-9));
        assertThat(insight.getMetrics()).containsExactly("sessions", "revenue");
        assertThat(insight.getDescription()).startsWith("Negative correlation (-85%)");
        assertThat(insight.getActions()).isEmpty();
        assertThat(insight.getData().getRecommendation().getEvidencePoints())
                .containsExactly("Correlation coefficient: -0.850");
    }
}
