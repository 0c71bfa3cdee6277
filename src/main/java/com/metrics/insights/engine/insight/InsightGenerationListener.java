package com.metrics.insights.engine.insight;

import com.metrics.insights.model.Insight;

/**
 * Callbacks fired while a batch is analysed. All methods default to no-ops.
 */
public interface InsightGenerationListener {

    InsightGenerationListener NO_OP = new InsightGenerationListener() {};

    default void seriesAnalysed(String metric, int points) {}

    default void analysisFailed(String stage, String subject, RuntimeException cause) {}

    default void insightGenerated(Insight insight) {}
}
