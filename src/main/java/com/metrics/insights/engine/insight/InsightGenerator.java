package com.metrics.insights.engine.insight;

import com.metrics.insights.engine.anomaly.AnomalyDetector;
import com.metrics.insights.engine.forecast.PredictiveEngine;
import com.metrics.insights.engine.stats.StatisticalPrimitives;
import com.metrics.insights.engine.trend.TrendAnalyzer;
import com.metrics.insights.model.Anomaly;
import com.metrics.insights.model.ForecastResult;
import com.metrics.insights.model.Insight;
import com.metrics.insights.model.SeasonalPattern;
import com.metrics.insights.model.TimeSeries;
import com.metrics.insights.model.TrendAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs every analyzer over a batch of series and ranks the combined findings.
 *
 * <p>Each series is analysed in isolation: a failure in one is logged, reported
 * to the listener and skipped, and the rest of the batch still produces insights.
 */
public class InsightGenerator {

    private static final Logger log = LoggerFactory.getLogger(InsightGenerator.class);

    static final double TREND_MIN_CONFIDENCE = 0.5;
    static final double FORECAST_MIN_CONFIDENCE = 0.4;
    static final double CORRELATION_MIN_ABS = 0.7;

    private final AnomalyDetector anomalyDetector;
    private final TrendAnalyzer trendAnalyzer;
    private final PredictiveEngine predictiveEngine;
    private final InsightFactory insightFactory;
    private final int forecastHorizon;
    private final InsightGenerationListener listener;

    public InsightGenerator(AnomalyDetector anomalyDetector, TrendAnalyzer trendAnalyzer,
                            PredictiveEngine predictiveEngine, InsightFactory insightFactory,
                            int forecastHorizon, InsightGenerationListener listener) {
        this.anomalyDetector = anomalyDetector;
        this.trendAnalyzer = trendAnalyzer;
        this.predictiveEngine = predictiveEngine;
        this.insightFactory = insightFactory;
        this.forecastHorizon = forecastHorizon;
        this.listener = listener != null ? listener : InsightGenerationListener.NO_OP;
    }

    public List<Insight> generateInsights(List<TimeSeries> batch) {
        List<Insight> insights = new ArrayList<>();
        List<TimeSeries> analysed = new ArrayList<>();

        for (TimeSeries series : batch) {
            try {
                insights.addAll(analyse(series));
                analysed.add(series);
                listener.seriesAnalysed(series.getMetric(), series.size());
            } catch (RuntimeException e) {
                log.warn("Skipping metric {}: analysis failed: {}", series.getMetric(), e.getMessage());
                listener.analysisFailed("metric", series.getMetric(), e);
            }
        }

        insights.addAll(correlationInsights(analysed));

        List<Insight> ranked = prioritize(insights);
        ranked.forEach(listener::insightGenerated);
        return ranked;
    }

    private List<Insight> analyse(TimeSeries series) {
        series.validate();
        String metric = series.getMetric();
        List<Insight> insights = new ArrayList<>();

        List<Anomaly> anomalies = anomalyDetector.detectAnomalies(series);
        for (Anomaly anomaly : anomalies) {
            insights.add(insightFactory.anomaly(anomaly));
        }

        TrendAnalysis trend = trendAnalyzer.analyzeTrend(series);
        if (trend.getConfidence() > TREND_MIN_CONFIDENCE) {
            insights.add(insightFactory.trend(metric, trend));
        }

        List<SeasonalPattern> patterns = trendAnalyzer.detectSeasonalPatterns(series);
        for (SeasonalPattern pattern : patterns) {
            insights.add(insightFactory.pattern(metric, pattern));
        }

        ForecastResult forecast = predictiveEngine.generateForecast(series, forecastHorizon);
        if (forecast.getConfidence() > FORECAST_MIN_CONFIDENCE) {
            insights.add(insightFactory.prediction(forecast, series.getInterval()));
        }

        log.debug("Metric {}: {} anomalies, trend {} ({}), {} patterns, forecast confidence {}",
                metric, anomalies.size(), trend.getDirection(), trend.getConfidence(),
                patterns.size(), forecast.getConfidence());
        return insights;
    }

    /**
     * Pearson correlation of every pair's raw values, index-aligned and truncated
     * to the shorter series.
     */
    List<Insight> correlationInsights(List<TimeSeries> batch) {
        List<Insight> insights = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            for (int j = i + 1; j < batch.size(); j++) {
                TimeSeries first = batch.get(i);
                TimeSeries second = batch.get(j);
                try {
                    double r = StatisticalPrimitives.pearsonCorrelation(first.values(), second.values());
                    if (Math.abs(r) > CORRELATION_MIN_ABS) {
                        insights.add(insightFactory.correlation(first.getMetric(), second.getMetric(), r));
                    }
                } catch (RuntimeException e) {
                    String pair = first.getMetric() + "/" + second.getMetric();
                    log.warn("Skipping correlation {}: {}", pair, e.getMessage());
                    listener.analysisFailed("correlation", pair, e);
                }
            }
        }
        return insights;
    }

    /**
     * Stable sort by severity weight times confidence, highest first.
     */
    static List<Insight> prioritize(List<Insight> insights) {
        List<Insight> ranked = new ArrayList<>(insights);
        ranked.sort(Comparator.comparingDouble(InsightGenerator::rank).reversed());
        return ranked;
    }

    private static double rank(Insight insight) {
        return insight.getSeverity().getWeight() * insight.getConfidence();
    }

    public int getForecastHorizon() {
        return forecastHorizon;
    }
}
