package com.metrics.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@Jacksonized
@Schema(description = "Chronologically ordered observations of one metric")
public class TimeSeries {

    @Schema(description = "Metric name", example = "sessions")
    String metric;

    @Schema(description = "Observations, oldest first. Must contain at least one point.")
    List<MetricDataPoint> dataPoints;

    @Schema(description = "Sampling interval", example = "DAY")
    TimeInterval interval;

    @Schema(description = "Start of the covered period", example = "2024-03-01T00:00:00Z")
    Instant periodStart;

    @Schema(description = "End of the covered period", example = "2024-03-30T00:00:00Z")
    Instant periodEnd;

    /**
     * Builds a series whose period spans its first and last observation.
     */
    public static TimeSeries of(String metric, TimeInterval interval, List<MetricDataPoint> points) {
        if (points == null || points.isEmpty()) {
            throw new IllegalArgumentException("Time series '" + metric + "' must contain at least one point");
        }
        return TimeSeries.builder()
                .metric(metric)
                .interval(interval)
                .dataPoints(List.copyOf(points))
                .periodStart(points.get(0).getTimestamp())
                .periodEnd(points.get(points.size() - 1).getTimestamp())
                .build();
    }

    public double[] values() {
        double[] values = new double[dataPoints.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = dataPoints.get(i).getValue();
        }
        return values;
    }

    public int size() {
        return dataPoints == null ? 0 : dataPoints.size();
    }

    /**
     * Rejects series that cannot be analysed at all: no points, no interval or
     * observations out of chronological order.
     */
    public void validate() {
        if (dataPoints == null || dataPoints.isEmpty()) {
            throw new IllegalArgumentException("Time series '" + metric + "' must contain at least one point");
        }
        if (interval == null) {
            throw new IllegalArgumentException("Time series '" + metric + "' has no interval");
        }
        Instant previous = null;
        for (MetricDataPoint point : dataPoints) {
            if (point.getTimestamp() == null) {
                throw new IllegalArgumentException("Time series '" + metric + "' has a point without timestamp");
            }
            if (previous != null && point.getTimestamp().isBefore(previous)) {
                throw new IllegalArgumentException("Time series '" + metric + "' is not in chronological order");
            }
            previous = point.getTimestamp();
        }
    }

    public Instant effectiveStart() {
        return periodStart != null ? periodStart : dataPoints.get(0).getTimestamp();
    }

    public Instant effectiveEnd() {
        return periodEnd != null ? periodEnd : dataPoints.get(dataPoints.size() - 1).getTimestamp();
    }
}
