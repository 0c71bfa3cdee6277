package com.metrics.insights.engine.outlier;

import com.metrics.insights.model.OutlierMethod;
import com.metrics.insights.model.OutlierResult;

/**
 * A single outlier-flagging strategy. Each implementation handles one {@link OutlierMethod}.
 */
public interface OutlierStrategy {

    OutlierMethod getSupportedMethod();

    /**
     * Flags outliers in {@code data}.
     *
     * @param data      the series, in input order
     * @param threshold the configured threshold; strategies may rescale it and
     *                  report the value they actually applied
     */
    OutlierResult detect(double[] data, double threshold);
}
