package com.metrics.insights.engine.outlier;

import com.metrics.insights.model.OutlierMethod;
import com.metrics.insights.model.OutlierResult;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Single-series outlier detection with a fixed strategy and threshold.
 * Instances are immutable and can be shared across threads.
 */
public class OutlierDetector {

    public static final OutlierMethod DEFAULT_METHOD = OutlierMethod.ZSCORE;
    public static final double DEFAULT_THRESHOLD = 2.5;

    private static final List<OutlierStrategy> BUILT_IN = List.of(
            new ZScoreOutlierStrategy(),
            new IqrOutlierStrategy(),
            new IsolationOutlierStrategy(),
            new LofOutlierStrategy());

    private final OutlierMethod method;
    private final double threshold;
    private final Map<OutlierMethod, OutlierStrategy> strategies;

    public OutlierDetector() {
        this(DEFAULT_METHOD, DEFAULT_THRESHOLD);
    }

    public OutlierDetector(OutlierMethod method, double threshold) {
        this(method, threshold, BUILT_IN);
    }

    OutlierDetector(OutlierMethod method, double threshold, List<OutlierStrategy> available) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive, was " + threshold);
        }
        this.method = method != null ? method : DEFAULT_METHOD;
        this.threshold = threshold;
        this.strategies = new EnumMap<>(OutlierMethod.class);
        for (OutlierStrategy strategy : available) {
            strategies.put(strategy.getSupportedMethod(), strategy);
        }
    }

    public OutlierResult detect(double[] data) {
        if (data == null) {
            throw new IllegalArgumentException("data must not be null");
        }
        OutlierStrategy strategy = strategies.get(method);
        if (strategy == null) {
            throw new IllegalStateException("No outlier strategy registered for " + method);
        }
        return strategy.detect(data, threshold);
    }

    public OutlierMethod getMethod() {
        return method;
    }

    public double getThreshold() {
        return threshold;
    }
}
