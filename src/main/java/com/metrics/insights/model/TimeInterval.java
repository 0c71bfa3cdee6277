package com.metrics.insights.model;

import java.time.Duration;

/**
 * Sampling interval of a time series. Fixes both the seasonal period used by
 * decomposition and the real-world step used to project forecast timestamps.
 */
public enum TimeInterval {
    HOUR(24, Duration.ofHours(1), "hour"),
    DAY(7, Duration.ofDays(1), "day"),
    WEEK(4, Duration.ofDays(7), "week"),
    // average Gregorian month
    MONTH(12, Duration.ofMillis(2_629_746_000L), "month");

    private final int seasonalPeriod;
    private final Duration step;
    private final String unit;

    TimeInterval(int seasonalPeriod, Duration step, String unit) {
        this.seasonalPeriod = seasonalPeriod;
        this.step = step;
        this.unit = unit;
    }

    public int getSeasonalPeriod() {
        return seasonalPeriod;
    }

    public Duration getStep() {
        return step;
    }

    /**
     * Human-readable span such as "7 days" or "1 hour".
     */
    public String describeSpan(int steps) {
        return steps + " " + unit + (steps == 1 ? "" : "s");
    }
}
