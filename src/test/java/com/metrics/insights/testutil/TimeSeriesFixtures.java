package com.metrics.insights.testutil;

import com.metrics.insights.model.MetricDataPoint;
import com.metrics.insights.model.TimeInterval;
import com.metrics.insights.model.TimeSeries;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.IntToDoubleFunction;

/**
 * Shared time-series builders for engine, service and controller tests.
 */
public final class TimeSeriesFixtures {

    // A Monday, midnight UTC.
    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private TimeSeriesFixtures() {}

    public static TimeSeries series(String metric, TimeInterval interval, double... values) {
        return series(metric, interval, START, values);
    }

    public static TimeSeries series(String metric, TimeInterval interval, Instant start, double... values) {
        List<MetricDataPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(MetricDataPoint.builder()
                    .timestamp(start.plus(interval.getStep().multipliedBy(i)))
                    .value(values[i])
                    .metric(metric)
                    .build());
        }
        return TimeSeries.of(metric, interval, points);
    }

    public static TimeSeries daily(String metric, double... values) {
        return series(metric, TimeInterval.DAY, values);
    }

    public static TimeSeries daily(String metric, int days, IntToDoubleFunction valueAt) {
        double[] values = new double[days];
        for (int i = 0; i < days; i++) values[i] = valueAt.applyAsDouble(i);
        return daily(metric, values);
    }

    /**
     * Synthetic series: base 1000 with a small random drift, a sinusoidal
     * seasonal swing of 30% (period 24 for hourly data, 7 otherwise), 10% noise
     * and a 2% chance per point of an injected anomaly (x0.3 or x2.5).
     */
    public static TimeSeries synthetic(String metric, int points, TimeInterval interval, long seed) {
        Random random = new Random(seed);
        double base = 1000;
        double trendRate = (random.nextDouble() - 0.5) * 0.02;
        double amplitude = base * 0.3;
        int period = interval == TimeInterval.HOUR ? 24 : 7;

        double[] values = new double[points];
        for (int i = 0; i < points; i++) {
            double trend = base * (1 + trendRate * i);
            double seasonal = amplitude * Math.sin(2 * Math.PI * i / period);
            double noise = (random.nextDouble() - 0.5) * base * 0.1;
            double value = trend + seasonal + noise;
            if (random.nextDouble() < 0.02) {
                value *= random.nextBoolean() ? 2.5 : 0.3;
            }
            values[i] = Math.max(0, value);
        }
        return series(metric, interval, values);
    }

    /**
     * 30 daily points around 100 with small deterministic wiggle and a single
     * 5x spike at day 15.
     */
    public static TimeSeries spikeAtDay15(String metric) {
        return daily(metric, 30, i -> i == 15 ? 500.0 : 100.0 + (i % 3) - 1);
    }

    /**
     * {@code days} days from a Monday: weekdays 100, weekends 10.
     */
    public static TimeSeries weekdayWeekend(String metric, int days) {
        return daily(metric, days, i -> (i % 7) >= 5 ? 10.0 : 100.0);
    }
}
