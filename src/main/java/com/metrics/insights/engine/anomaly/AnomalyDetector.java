package com.metrics.insights.engine.anomaly;

import com.metrics.insights.model.Anomaly;
import com.metrics.insights.model.AnomalyDetectionConfig;
import com.metrics.insights.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Time-series anomaly detection: a global z-score pass, a sliding-window
 * isolation pass and a seasonal-residual pass, merged and deduplicated.
 *
 * <p>Instances hold only immutable configuration and may be shared freely.
 */
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    static final long DUPLICATE_WINDOW_MS = Duration.ofHours(1).toMillis();
    static final double DUPLICATE_VALUE_RATIO = 0.1;

    private final AnomalyDetectionConfig config;
    private final ZoneId zone;
    private final List<AnomalyPass> passes;

    public AnomalyDetector(AnomalyDetectionConfig config) {
        this(config, ZoneId.of("UTC"));
    }

    public AnomalyDetector(AnomalyDetectionConfig config, ZoneId zone) {
        this.config = config != null ? config : AnomalyDetectionConfig.defaults();
        this.zone = zone;
        this.passes = List.of(new ZScorePass(), new WindowIsolationPass(), new SeasonalResidualPass());
    }

    public AnomalyDetectionConfig getConfig() {
        return config;
    }

    /**
     * Detects anomalies, keeping only the most confident report of each real event.
     */
    public List<Anomaly> detectAnomalies(TimeSeries series) {
        List<Anomaly> candidates = detectCandidates(series);
        List<Anomaly> unique = deduplicate(candidates);
        log.debug("Metric {}: {} anomaly candidates, {} after deduplication",
                series.getMetric(), candidates.size(), unique.size());
        return unique;
    }

    /**
     * Raw output of every pass, in pass order, before deduplication.
     */
    public List<Anomaly> detectCandidates(TimeSeries series) {
        series.validate();
        IndexedSeries full = IndexedSeries.of(series);
        IndexedSeries weekdays = config.isExcludeWeekends() ? IndexedSeries.weekdaysOf(series, zone) : full;

        List<Anomaly> candidates = new ArrayList<>();
        for (AnomalyPass pass : passes) {
            IndexedSeries view = pass.honoursWeekendExclusion() ? weekdays : full;
            List<Anomaly> found = pass.detect(view, series.getInterval(), config);
            log.trace("Pass {} flagged {} points in {}", pass.getName(), found.size(), series.getMetric());
            candidates.addAll(found);
        }
        return candidates;
    }

    /**
     * Greedy deduplication in descending confidence order (stable for ties). A
     * candidate is dropped when a kept anomaly of the same metric lies within
     * one hour and within 10% of the kept value.
     */
    static List<Anomaly> deduplicate(List<Anomaly> candidates) {
        List<Anomaly> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingDouble(Anomaly::getConfidence).reversed());

        List<Anomaly> unique = new ArrayList<>();
        for (Anomaly candidate : sorted) {
            boolean duplicate = unique.stream().anyMatch(existing -> isSameEvent(existing, candidate));
            if (!duplicate) {
                unique.add(candidate);
            }
        }
        return unique;
    }

    private static boolean isSameEvent(Anomaly existing, Anomaly candidate) {
        long gap = Math.abs(existing.getTimestamp().toEpochMilli() - candidate.getTimestamp().toEpochMilli());
        return gap < DUPLICATE_WINDOW_MS
                && existing.getMetric().equals(candidate.getMetric())
                && Math.abs(existing.getValue() - candidate.getValue())
                        < DUPLICATE_VALUE_RATIO * Math.abs(existing.getValue());
    }
}
