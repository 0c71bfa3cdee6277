package com.metrics.insights.engine.forecast;

import com.metrics.insights.engine.stats.RegressionResult;
import com.metrics.insights.engine.stats.StatisticalPrimitives;
import com.metrics.insights.engine.trend.SeasonalProfile;
import com.metrics.insights.engine.trend.TrendAnalyzer;
import com.metrics.insights.model.ForecastResult;
import com.metrics.insights.model.MetricDataPoint;
import com.metrics.insights.model.TimeSeries;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Short-horizon forecasts: the index regression extrapolated past the last
 * point, plus a calendar adjustment from every significant seasonal pattern.
 */
public class PredictiveEngine {

    public static final String METHODOLOGY = "Linear regression with seasonal adjustment";

    private final TrendAnalyzer trendAnalyzer;

    public PredictiveEngine(TrendAnalyzer trendAnalyzer) {
        this.trendAnalyzer = trendAnalyzer;
    }

    /**
     * Forecasts {@code horizon} steps of the series' interval. Step i (1-based)
     * is placed at lastTimestamp + i * interval, floored at 0 and given the
     * confidence R² * e^(-i / horizon).
     */
    public ForecastResult generateForecast(TimeSeries series, int horizon) {
        if (horizon < 1) {
            throw new IllegalArgumentException("horizon must be >= 1, was " + horizon);
        }
        series.validate();
        List<MetricDataPoint> history = series.getDataPoints();
        RegressionResult regression = StatisticalPrimitives.linearRegression(history);
        List<SeasonalProfile> profiles = trendAnalyzer.significantProfiles(series);
        Instant last = history.get(history.size() - 1).getTimestamp();
        Duration step = series.getInterval().getStep();
        int n = history.size();

        List<MetricDataPoint> predictions = new ArrayList<>(horizon);
        for (int i = 1; i <= horizon; i++) {
            Instant timestamp = last.plus(step.multipliedBy(i));
            double base = regression.predictAt(n + i - 1);
            double adjustment = 0.0;
            for (SeasonalProfile profile : profiles) {
                adjustment += profile.adjustment(timestamp) * profile.strength();
            }
            predictions.add(MetricDataPoint.builder()
                    .timestamp(timestamp)
                    .value(Math.max(0.0, base + adjustment))
                    .metric(series.getMetric())
                    .confidence(StatisticalPrimitives.clampUnit(regression.getR2() * Math.exp(-(double) i / horizon)))
                    .build());
        }

        return ForecastResult.builder()
                .metric(series.getMetric())
                .predictions(predictions)
                .confidence(regression.getR2())
                .methodology(METHODOLOGY)
                .horizon(horizon)
                .build();
    }
}
