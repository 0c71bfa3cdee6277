package com.metrics.insights.service;

import com.metrics.insights.config.MetricsConfig;
import com.metrics.insights.engine.anomaly.AnomalyDetector;
import com.metrics.insights.engine.forecast.PredictiveEngine;
import com.metrics.insights.engine.insight.InsightGenerator;
import com.metrics.insights.engine.trend.TrendAnalyzer;
import com.metrics.insights.model.Anomaly;
import com.metrics.insights.model.ForecastResult;
import com.metrics.insights.model.Insight;
import com.metrics.insights.model.Sensitivity;
import com.metrics.insights.model.TimeSeries;
import com.metrics.insights.model.TrendReport;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

@Service
public class InsightService {

    private static final Logger log = LoggerFactory.getLogger(InsightService.class);

    private final InsightGenerator insightGenerator;
    private final AnomalyDetector anomalyDetector;
    private final TrendAnalyzer trendAnalyzer;
    private final PredictiveEngine predictiveEngine;
    private final MetricsConfig metricsConfig;

    public InsightService(InsightGenerator insightGenerator,
                          AnomalyDetector anomalyDetector,
                          TrendAnalyzer trendAnalyzer,
                          PredictiveEngine predictiveEngine,
                          MetricsConfig metricsConfig) {
        this.insightGenerator = insightGenerator;
        this.anomalyDetector = anomalyDetector;
        this.trendAnalyzer = trendAnalyzer;
        this.predictiveEngine = predictiveEngine;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Analyse a batch of series and return the ranked insights. Series that fail
     * analysis are skipped; only a structurally invalid request is rejected.
     */
    @Observed(name = "insights.generate", contextualName = "generate-insights")
    public List<Insight> generateInsights(List<TimeSeries> batch) {
        if (batch == null || batch.isEmpty()) {
            throw new IllegalArgumentException("At least one time series is required");
        }
        if (batch.stream().anyMatch(series -> series == null)) {
            throw new IllegalArgumentException("Time series entries must not be null");
        }
        List<Insight> insights = insightGenerator.generateInsights(batch);
        log.info("Generated {} insights from {} series", insights.size(), batch.size());
        return insights;
    }

    /**
     * Same as {@link #generateInsights(List)} on the application task executor.
     */
    @Async
    @Observed(name = "insights.generate.async", contextualName = "generate-insights-async")
    public CompletableFuture<List<Insight>> generateInsightsAsync(List<TimeSeries> batch) {
        return CompletableFuture.completedFuture(generateInsights(batch));
    }

    /**
     * @param sensitivity overrides the configured sensitivity for this call when non-null
     */
    @Observed(name = "insights.anomalies", contextualName = "detect-anomalies")
    public List<Anomaly> detectAnomalies(TimeSeries series, Sensitivity sensitivity) {
        requireSeries(series);
        AnomalyDetector detector = sensitivity == null
                ? anomalyDetector
                : new AnomalyDetector(anomalyDetector.getConfig().withSensitivity(sensitivity), trendAnalyzer.getZone());
        List<Anomaly> anomalies = detector.detectAnomalies(series);
        anomalies.forEach(a -> metricsConfig.recordAnomaly(a.getType().name().toLowerCase(Locale.ROOT)));
        log.info("Detected {} anomalies in {} ({} points)", anomalies.size(), series.getMetric(), series.size());
        return anomalies;
    }

    @Observed(name = "insights.trend", contextualName = "analyze-trend")
    public TrendReport analyzeTrend(TimeSeries series) {
        requireSeries(series);
        return TrendReport.builder()
                .metric(series.getMetric())
                .trend(trendAnalyzer.analyzeTrend(series))
                .patterns(trendAnalyzer.detectSeasonalPatterns(series))
                .build();
    }

    @Observed(name = "insights.forecast", contextualName = "generate-forecast")
    public ForecastResult forecast(TimeSeries series, Integer horizon) {
        requireSeries(series);
        int steps = horizon != null ? horizon : insightGenerator.getForecastHorizon();
        return predictiveEngine.generateForecast(series, steps);
    }

    private void requireSeries(TimeSeries series) {
        if (series == null) {
            throw new IllegalArgumentException("A time series is required");
        }
        series.validate();
    }
}
