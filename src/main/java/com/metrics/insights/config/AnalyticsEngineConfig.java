package com.metrics.insights.config;

import com.metrics.insights.engine.anomaly.AnomalyDetector;
import com.metrics.insights.engine.evaluation.TimeSeriesCrossValidator;
import com.metrics.insights.engine.forecast.PredictiveEngine;
import com.metrics.insights.engine.insight.InsightFactory;
import com.metrics.insights.engine.insight.InsightGenerator;
import com.metrics.insights.engine.preprocessing.DataPreprocessor;
import com.metrics.insights.engine.trend.TrendAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the plain-Java analytics engine as shared singletons. Every component
 * is immutable once built, so one instance serves all concurrent requests.
 */
@Configuration
public class AnalyticsEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsEngineConfig.class);

    @Bean
    public Clock analyticsClock() {
        return Clock.systemUTC();
    }

    @Bean
    public TrendAnalyzer trendAnalyzer(AnalyticsProperties properties) {
        return new TrendAnalyzer(properties.zone());
    }

    @Bean
    public AnomalyDetector anomalyDetector(AnalyticsProperties properties) {
        AnomalyDetector detector = new AnomalyDetector(properties.toAnomalyDetectionConfig(), properties.zone());
        log.info("Anomaly detector configured: {}", detector.getConfig());
        return detector;
    }

    @Bean
    public PredictiveEngine predictiveEngine(TrendAnalyzer trendAnalyzer) {
        return new PredictiveEngine(trendAnalyzer);
    }

    @Bean
    public InsightFactory insightFactory(Clock analyticsClock) {
        return new InsightFactory(analyticsClock);
    }

    @Bean
    public InsightGenerator insightGenerator(AnomalyDetector anomalyDetector, TrendAnalyzer trendAnalyzer,
                                             PredictiveEngine predictiveEngine, InsightFactory insightFactory,
                                             AnalyticsProperties properties, MetricsConfig metricsConfig) {
        if (properties.getForecastHorizon() < 1) {
            throw new IllegalStateException("analytics.forecast-horizon must be >= 1, was "
                    + properties.getForecastHorizon());
        }
        return new InsightGenerator(anomalyDetector, trendAnalyzer, predictiveEngine, insightFactory,
                properties.getForecastHorizon(), metricsConfig);
    }

    @Bean
    public DataPreprocessor dataPreprocessor() {
        return new DataPreprocessor();
    }

    @Bean
    public TimeSeriesCrossValidator timeSeriesCrossValidator() {
        return new TimeSeriesCrossValidator();
    }
}
