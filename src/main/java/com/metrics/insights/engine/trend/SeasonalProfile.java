package com.metrics.insights.engine.trend;

import com.metrics.insights.model.MetricDataPoint;
import com.metrics.insights.model.PatternType;
import com.metrics.insights.model.SeasonalPattern;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.Month;
import java.time.ZoneId;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;
import java.util.function.ToIntFunction;

/**
 * Per-phase averages of a series bucketed by calendar day of week or month.
 * Only phases that received at least one observation take part in strength,
 * peak, trough and adjustment calculations.
 */
public final class SeasonalProfile {

    private final PatternType type;
    private final ZoneId zone;
    private final double[] averages;
    private final boolean[] populated;
    private final String[] labels;

    private SeasonalProfile(PatternType type, ZoneId zone, double[] averages, boolean[] populated, String[] labels) {
        this.type = type;
        this.zone = zone;
        this.averages = averages;
        this.populated = populated;
        this.labels = labels;
    }

    /**
     * Day-of-week profile, phases ordered Monday to Sunday.
     */
    public static SeasonalProfile weekly(List<MetricDataPoint> points, ZoneId zone) {
        String[] labels = new String[7];
        for (DayOfWeek day : DayOfWeek.values()) {
            labels[day.getValue() - 1] = day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
        }
        return build(PatternType.WEEKLY, points, zone, labels, phaseFunction(PatternType.WEEKLY, zone));
    }

    /**
     * Month-of-year profile, phases ordered January to December.
     */
    public static SeasonalProfile monthly(List<MetricDataPoint> points, ZoneId zone) {
        String[] labels = new String[12];
        for (Month month : Month.values()) {
            labels[month.getValue() - 1] = month.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
        }
        return build(PatternType.MONTHLY, points, zone, labels, phaseFunction(PatternType.MONTHLY, zone));
    }

    private static SeasonalProfile build(PatternType type, List<MetricDataPoint> points, ZoneId zone,
                                         String[] labels, ToIntFunction<Instant> phaseOf) {
        double[] sums = new double[labels.length];
        int[] counts = new int[labels.length];
        for (MetricDataPoint point : points) {
            int phase = phaseOf.applyAsInt(point.getTimestamp());
            sums[phase] += point.getValue();
            counts[phase]++;
        }
        double[] averages = new double[labels.length];
        boolean[] populated = new boolean[labels.length];
        for (int p = 0; p < labels.length; p++) {
            populated[p] = counts[p] > 0;
            averages[p] = populated[p] ? sums[p] / counts[p] : 0.0;
        }
        return new SeasonalProfile(type, zone, averages, populated, labels);
    }

    private static ToIntFunction<Instant> phaseFunction(PatternType type, ZoneId zone) {
        if (type == PatternType.WEEKLY) {
            return instant -> instant.atZone(zone).getDayOfWeek().getValue() - 1;
        }
        return instant -> instant.atZone(zone).getMonthValue() - 1;
    }

    public PatternType getType() {
        return type;
    }

    /**
     * (max - min) / max over populated phases; 0 when max is not positive.
     */
    public double strength() {
        int peak = peakIndex();
        if (peak < 0) return 0.0;
        double max = averages[peak];
        double min = averages[troughIndex()];
        if (max <= 0) return 0.0;
        return Math.max(0.0, Math.min(1.0, (max - min) / max));
    }

    public String peak() {
        int index = peakIndex();
        return index < 0 ? null : labels[index];
    }

    public String trough() {
        int index = troughIndex();
        return index < 0 ? null : labels[index];
    }

    /**
     * Phase average minus the mean of all populated phase averages, for the
     * phase that {@code instant} falls into. 0 for phases without history.
     */
    public double adjustment(Instant instant) {
        int phase = phaseFunction(type, zone).applyAsInt(instant);
        if (!populated[phase]) return 0.0;
        double sum = 0.0;
        int count = 0;
        for (int p = 0; p < averages.length; p++) {
            if (populated[p]) {
                sum += averages[p];
                count++;
            }
        }
        return averages[phase] - sum / count;
    }

    public SeasonalPattern toPattern() {
        return SeasonalPattern.builder()
                .type(type)
                .strength(strength())
                .peak(peak())
                .trough(trough())
                .build();
    }

    private int peakIndex() {
        int best = -1;
        for (int p = 0; p < averages.length; p++) {
            if (populated[p] && (best < 0 || averages[p] > averages[best])) best = p;
        }
        return best;
    }

    private int troughIndex() {
        int best = -1;
        for (int p = 0; p < averages.length; p++) {
            if (populated[p] && (best < 0 || averages[p] < averages[best])) best = p;
        }
        return best;
    }
}
