package com.metrics.insights.engine.trend;

import com.metrics.insights.engine.stats.RegressionResult;
import com.metrics.insights.engine.stats.StatisticalPrimitives;
import com.metrics.insights.model.SeasonalPattern;
import com.metrics.insights.model.TimeSeries;
import com.metrics.insights.model.TrendAnalysis;
import com.metrics.insights.model.TrendDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Linear trend characterisation and calendar pattern discovery.
 */
public class TrendAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TrendAnalyzer.class);

    static final double VOLATILE_R2 = 0.3;
    static final double STABLE_SLOPE = 0.01;
    static final int WEEKLY_MIN_POINTS = 14;
    static final int MONTHLY_MIN_POINTS = 60;
    static final double PATTERN_MIN_STRENGTH = 0.3;

    private final ZoneId zone;

    public TrendAnalyzer() {
        this(ZoneId.of("UTC"));
    }

    public TrendAnalyzer(ZoneId zone) {
        this.zone = zone;
    }

    public ZoneId getZone() {
        return zone;
    }

    /**
     * Regression of value against index. Direction is VOLATILE below R² 0.3,
     * STABLE for |slope| under 0.01, otherwise the slope's sign. The rate is the
     * percentage change between the first and last raw values.
     */
    public TrendAnalysis analyzeTrend(TimeSeries series) {
        series.validate();
        RegressionResult regression = StatisticalPrimitives.linearRegression(series.getDataPoints());
        double[] values = series.values();

        return TrendAnalysis.builder()
                .direction(direction(regression.getSlope(), regression.getR2()))
                .strength(Math.min(Math.abs(regression.getR2()), 1.0))
                .rate(percentageChange(values))
                .confidence(StatisticalPrimitives.clampUnit(regression.getR2()))
                .startDate(series.effectiveStart())
                .endDate(series.effectiveEnd())
                .r2(regression.getR2())
                .build();
    }

    public List<SeasonalPattern> detectSeasonalPatterns(TimeSeries series) {
        List<SeasonalPattern> patterns = new ArrayList<>();
        for (SeasonalProfile profile : significantProfiles(series)) {
            patterns.add(profile.toPattern());
        }
        return patterns;
    }

    /**
     * Weekly (at least 14 points) and monthly (at least 60 points) profiles whose
     * strength exceeds 0.3. Shorter series simply yield no profile.
     */
    public List<SeasonalProfile> significantProfiles(TimeSeries series) {
        series.validate();
        List<SeasonalProfile> profiles = new ArrayList<>();
        int n = series.size();
        if (n >= WEEKLY_MIN_POINTS) {
            addIfSignificant(profiles, SeasonalProfile.weekly(series.getDataPoints(), zone), series.getMetric());
        }
        if (n >= MONTHLY_MIN_POINTS) {
            addIfSignificant(profiles, SeasonalProfile.monthly(series.getDataPoints(), zone), series.getMetric());
        }
        return profiles;
    }

    private void addIfSignificant(List<SeasonalProfile> profiles, SeasonalProfile profile, String metric) {
        double strength = profile.strength();
        log.debug("Metric {}: {} pattern strength {}", metric, profile.getType(), strength);
        if (strength > PATTERN_MIN_STRENGTH) {
            profiles.add(profile);
        }
    }

    static TrendDirection direction(double slope, double r2) {
        if (r2 < VOLATILE_R2) return TrendDirection.VOLATILE;
        if (Math.abs(slope) < STABLE_SLOPE) return TrendDirection.STABLE;
        return slope > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
    }

    static double percentageChange(double[] values) {
        if (values.length < 2) return 0.0;
        double start = values[0];
        double end = values[values.length - 1];
        return start != 0 ? (end - start) / start * 100 : 0.0;
    }
}
