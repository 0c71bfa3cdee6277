package com.metrics.insights.engine.insight;

import com.metrics.insights.engine.anomaly.AnomalyDetector;
import com.metrics.insights.engine.forecast.PredictiveEngine;
import com.metrics.insights.engine.trend.TrendAnalyzer;
import com.metrics.insights.model.AnomalyDetectionConfig;
import com.metrics.insights.model.Insight;
import com.metrics.insights.model.InsightSeverity;
import com.metrics.insights.model.InsightType;
import com.metrics.insights.model.TimeInterval;
import com.metrics.insights.model.TimeSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.metrics.insights.testutil.TimeSeriesFixtures.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class InsightGeneratorTest {

    private TrendAnalyzer trendAnalyzer;
    private InsightFactory factory;
    private InsightGenerator generator;

    @BeforeEach
    void setUp() {
        trendAnalyzer = new TrendAnalyzer();
        factory = new InsightFactory(Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC));
        generator = new InsightGenerator(new AnomalyDetector(AnomalyDetectionConfig.defaults()), trendAnalyzer,
                new PredictiveEngine(trendAnalyzer), factory, 7, null);
    }

    private static TimeSeries rising(String metric) {
        return daily(metric, 30, i -> 100 + 5.0 * i);
    }

    private static TimeSeries doubledWithNoise(String metric) {
        return daily(metric, 30, i -> 2 * (100 + 5.0 * i) + ((i % 3) - 1) * 0.5);
    }

    private static TimeSeries alternating(String metric) {
        return daily(metric, 30, i -> i % 2 == 0 ? 100.0 : 50.0);
    }

    private static Insight insight(String id, InsightSeverity severity, double confidence) {
        return Insight.builder().id(id).type(InsightType.TREND).severity(severity).confidence(confidence).build();
    }

    @Test
    void generateInsights_risingSeries_yieldsTrendAndPrediction() {
        List<Insight> insights = generator.generateInsights(List.of(rising("sessions")));

        assertThat(insights).extracting(Insight::getId).contains("trend_sessions", "prediction_sessions");
    }

    @Test
    void generateInsights_everyInsightIsWellFormed() {
        List<TimeSeries> batch = List.of(
                synthetic("sessions", 90, TimeInterval.DAY, 1L),
                synthetic("revenue", 90, TimeInterval.DAY, 2L),
                spikeAtDay15("pageviews"));

        List<Insight> insights = generator.generateInsights(batch);

        assertThat(insights).isNotEmpty().allSatisfy(insight -> {
            assertThat(insight.getConfidence()).isBetween(0.0, 1.0);
            assertThat(insight.getType()).isEqualTo(insight.getData().getKind());
            assertThat(insight.getMetrics()).isNotEmpty();
        });
    }

    @Test
    void generateInsights_resultIsRankedByWeightTimesConfidence() {
        List<Insight> insights = generator.generateInsights(List.of(spikeAtDay15("sessions"), rising("revenue")));

        for (int i = 1; i < insights.size(); i++) {
            Insight previous = insights.get(i - 1);
            Insight current = insights.get(i);
            assertThat(previous.getSeverity().getWeight() * previous.getConfidence())
                    .isGreaterThanOrEqualTo(current.getSeverity().getWeight() * current.getConfidence());
        }
    }

    @Test
    void generateInsights_correlatedPair_emitsRecommendation() {
        List<Insight> insights = generator.generateInsights(List.of(rising("sessions"), doubledWithNoise("revenue")));

        assertThat(insights).filteredOn(i -> i.getType() == InsightType.RECOMMENDATION)
                .singleElement()
                .satisfies(i -> {
                    assertThat(i.getId()).isEqualTo("correlation_sessions_revenue");
                    assertThat(i.getMetrics()).containsExactly("sessions", "revenue");
                    assertThat(i.getConfidence()).isGreaterThan(0.99);
                });
    }

    @Test
    void generateInsights_independentPair_emitsNoRecommendation() {
        List<Insight> insights = generator.generateInsights(List.of(rising("sessions"), alternating("bounce_rate")));

        assertThat(insights).noneMatch(i -> i.getType() == InsightType.RECOMMENDATION);
    }

    @Test
    void generateInsights_failingMetric_isSkippedAndReported() {
        AnomalyDetector detector = mock(AnomalyDetector.class);
        InsightGenerationListener listener = mock(InsightGenerationListener.class);
        TimeSeries broken = rising("broken");
        TimeSeries healthy = rising("healthy");
        when(detector.detectAnomalies(broken)).thenThrow(new IllegalStateException("boom"));
        when(detector.detectAnomalies(healthy)).thenReturn(List.of());
        InsightGenerator withFailure = new InsightGenerator(detector, trendAnalyzer,
                new PredictiveEngine(trendAnalyzer), factory, 7, listener);

        List<Insight> insights = withFailure.generateInsights(List.of(broken, healthy));

        assertThat(insights).isNotEmpty().allSatisfy(i -> assertThat(i.getMetrics()).doesNotContain("broken"));
        verify(listener).analysisFailed(eq("metric"), eq("broken"), any(IllegalStateException.class));
        verify(listener).seriesAnalysed("healthy", 30);
        verify(listener, never()).seriesAnalysed(eq("broken"), anyInt());
        verify(listener, times(insights.size())).insightGenerated(any(Insight.class));
        verify(listener, never()).insightGenerated(argThat(i -> i.getType() == InsightType.RECOMMENDATION));
    }

    @Test
    void generateInsights_emptyBatch_returnsEmpty() {
        assertThat(generator.generateInsights(new ArrayList<>())).isEmpty();
    }

    @Test
    void prioritize_ordersByWeightTimesConfidenceAndKeepsTiesStable() {
        Insight info = insight("info", InsightSeverity.INFO, 0.9);
        Insight critical = insight("critical", InsightSeverity.CRITICAL, 0.5);
        Insight warningA = insight("warningA", InsightSeverity.WARNING, 0.5);
        Insight warningB = insight("warningB", InsightSeverity.WARNING, 0.5);

        List<Insight> ranked = InsightGenerator.prioritize(List.of(info, warningA, critical, warningB));

        assertThat(ranked).containsExactly(critical, warningA, warningB, info);
    }
}
