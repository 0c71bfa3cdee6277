package com.metrics.insights.engine.anomaly;

import com.metrics.insights.model.Anomaly;
import com.metrics.insights.model.AnomalyDetectionConfig;
import com.metrics.insights.model.TimeInterval;

import java.util.List;

/**
 * One independent detection pass. Passes never see each other's output;
 * merging and deduplication happen in {@link AnomalyDetector}.
 */
interface AnomalyPass {

    String getName();

    /**
     * Whether the pass should see the weekday-only view when weekends are excluded.
     */
    boolean honoursWeekendExclusion();

    List<Anomaly> detect(IndexedSeries series, TimeInterval interval, AnomalyDetectionConfig config);
}
