package com.metrics.insights.engine.anomaly;

import com.metrics.insights.model.MetricDataPoint;
import com.metrics.insights.model.TimeSeries;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * A subsequence of a series that remembers each point's position in the
 * original, so anomaly ids stay stable when points are filtered out.
 */
final class IndexedSeries {

    private final String metric;
    private final List<MetricDataPoint> points;
    private final int[] originalIndex;

    private IndexedSeries(String metric, List<MetricDataPoint> points, int[] originalIndex) {
        this.metric = metric;
        this.points = points;
        this.originalIndex = originalIndex;
    }

    static IndexedSeries of(TimeSeries series) {
        int[] index = new int[series.size()];
        for (int i = 0; i < index.length; i++) index[i] = i;
        return new IndexedSeries(series.getMetric(), series.getDataPoints(), index);
    }

    static IndexedSeries weekdaysOf(TimeSeries series, ZoneId zone) {
        List<MetricDataPoint> kept = new ArrayList<>();
        List<Integer> positions = new ArrayList<>();
        List<MetricDataPoint> all = series.getDataPoints();
        for (int i = 0; i < all.size(); i++) {
            DayOfWeek day = all.get(i).getTimestamp().atZone(zone).getDayOfWeek();
            if (day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY) {
                kept.add(all.get(i));
                positions.add(i);
            }
        }
        return new IndexedSeries(series.getMetric(), kept,
                positions.stream().mapToInt(Integer::intValue).toArray());
    }

    String metric() {
        return metric;
    }

    int size() {
        return points.size();
    }

    MetricDataPoint point(int i) {
        return points.get(i);
    }

    int originalIndex(int i) {
        return originalIndex[i];
    }

    double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) values[i] = points.get(i).getValue();
        return values;
    }
}
