package com.metrics.insights.service;

import com.metrics.insights.config.MetricsConfig;
import com.metrics.insights.engine.anomaly.AnomalyDetector;
import com.metrics.insights.engine.forecast.PredictiveEngine;
import com.metrics.insights.engine.insight.InsightGenerator;
import com.metrics.insights.engine.trend.TrendAnalyzer;
import com.metrics.insights.model.*;
import com.metrics.insights.testutil.TimeSeriesFixtures;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationHandler;
import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InsightServiceTest {

    @Mock private InsightGenerator insightGenerator;
    @Mock private AnomalyDetector anomalyDetector;
    @Mock private TrendAnalyzer trendAnalyzer;
    @Mock private PredictiveEngine predictiveEngine;
    @Mock private MetricsConfig metricsConfig;

    private InsightService insightService;
    private TimeSeries series;

    @BeforeEach
    void setUp() {
        insightService = new InsightService(insightGenerator, anomalyDetector, trendAnalyzer,
                predictiveEngine, metricsConfig);
        series = TimeSeriesFixtures.spikeAtDay15("sessions");
    }

    private static Insight insight(String id) {
        return Insight.builder().id(id).type(InsightType.TREND).severity(InsightSeverity.INFO).confidence(0.8).build();
    }

    @Test
    void generateInsights_delegatesToGenerator() {
        List<Insight> expected = List.of(insight("trend_sessions"));
        when(insightGenerator.generateInsights(List.of(series))).thenReturn(expected);

        List<Insight> result = insightService.generateInsights(List.of(series));

        assertThat(result).isEqualTo(expected);
    }

    @Test
    void generateInsightsAsync_throughProxy_isObserved() {
        List<String> observed = new ArrayList<>();
        ObservationRegistry registry = ObservationRegistry.create();
        registry.observationConfig().observationHandler(new ObservationHandler<Observation.Context>() {
            @Override
            public void onStart(Observation.Context context) {
                observed.add(context.getName());
            }

            @Override
            public boolean supportsContext(Observation.Context context) {
                return true;
            }
        });
        AspectJProxyFactory factory = new AspectJProxyFactory(insightService);
        factory.addAspect(new ObservedAspect(registry));
        InsightService proxied = factory.getProxy();
        when(insightGenerator.generateInsights(List.of(series))).thenReturn(List.of(insight("trend_sessions")));

        List<Insight> result = proxied.generateInsightsAsync(List.of(series)).join();

        assertThat(result).hasSize(1);
        assertThat(observed).contains("insights.generate.async");
    }

    @Test
    void generateInsights_emptyBatch_throws() {
        assertThatThrownBy(() -> insightService.generateInsights(List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("At least one");
        verifyNoInteractions(insightGenerator);
    }

    @Test
    void generateInsights_nullEntry_throws() {
        assertThatThrownBy(() -> insightService.generateInsights(Arrays.asList(series, null)))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(insightGenerator);
    }

    @Test
    void generateInsightsAsync_completesWithGeneratedInsights() {
        List<Insight> expected = List.of(insight("pattern_sessions_weekly"));
        when(insightGenerator.generateInsights(List.of(series))).thenReturn(expected);

        CompletableFuture<List<Insight>> future = insightService.generateInsightsAsync(List.of(series));

        assertThat(future).isCompletedWithValue(expected);
    }

    @Test
    void detectAnomalies_noOverride_usesConfiguredDetectorAndRecordsMetrics() {
        Anomaly spike = Anomaly.builder().id("zscore_sessions_15").metric("sessions")
                .type(AnomalyType.SPIKE).severity(AnomalySeverity.CRITICAL).build();
        when(anomalyDetector.detectAnomalies(series)).thenReturn(List.of(spike));

        List<Anomaly> result = insightService.detectAnomalies(series, null);

        assertThat(result).containsExactly(spike);
        verify(metricsConfig).recordAnomaly("spike");
    }

    @Test
    void detectAnomalies_sensitivityOverride_buildsDedicatedDetector() {
        when(anomalyDetector.getConfig()).thenReturn(AnomalyDetectionConfig.defaults());
        when(trendAnalyzer.getZone()).thenReturn(ZoneOffset.UTC);

        List<Anomaly> result = insightService.detectAnomalies(series, Sensitivity.HIGH);

        assertThat(result).anyMatch(a -> a.getType() == AnomalyType.SPIKE && a.getValue() == 500.0);
        verify(anomalyDetector, never()).detectAnomalies(any());
        verify(metricsConfig, times(result.size())).recordAnomaly(anyString());
    }

    @Test
    void detectAnomalies_nullSeries_throws() {
        assertThatThrownBy(() -> insightService.detectAnomalies(null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void analyzeTrend_combinesTrendAndPatterns() {
        TrendAnalysis trend = TrendAnalysis.builder().direction(TrendDirection.STABLE).confidence(0.9).build();
        SeasonalPattern weekly = SeasonalPattern.builder().type(PatternType.WEEKLY).strength(0.6)
                .peak("Monday").trough("Sunday").build();
        when(trendAnalyzer.analyzeTrend(series)).thenReturn(trend);
        when(trendAnalyzer.detectSeasonalPatterns(series)).thenReturn(List.of(weekly));

        TrendReport report = insightService.analyzeTrend(series);

        assertThat(report.getMetric()).isEqualTo("sessions");
        assertThat(report.getTrend()).isSameAs(trend);
        assertThat(report.getPatterns()).containsExactly(weekly);
    }

    @Test
    void forecast_noHorizon_usesConfiguredHorizon() {
        ForecastResult expected = ForecastResult.builder().metric("sessions").horizon(7).build();
        when(insightGenerator.getForecastHorizon()).thenReturn(7);
        when(predictiveEngine.generateForecast(series, 7)).thenReturn(expected);

        assertThat(insightService.forecast(series, null)).isSameAs(expected);
    }

    @Test
    void forecast_explicitHorizon_isPassedThrough() {
        ForecastResult expected = ForecastResult.builder().metric("sessions").horizon(3).build();
        when(predictiveEngine.generateForecast(series, 3)).thenReturn(expected);

        assertThat(insightService.forecast(series, 3)).isSameAs(expected);
        verify(insightGenerator, never()).getForecastHorizon();
    }

    @Test
    void forecast_seriesWithoutInterval_throws() {
        TimeSeries noInterval = TimeSeries.builder()
                .metric("sessions")
                .dataPoints(series.getDataPoints())
                .build();

        assertThatThrownBy(() -> insightService.forecast(noInterval, 3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("interval");
        verifyNoInteractions(predictiveEngine);
    }
}
