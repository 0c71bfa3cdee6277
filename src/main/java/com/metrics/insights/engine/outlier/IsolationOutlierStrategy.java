package com.metrics.insights.engine.outlier;

import com.metrics.insights.model.OutlierMethod;
import com.metrics.insights.model.OutlierResult;

import java.util.Arrays;

/**
 * Nearest-neighbour approximation of isolation: the average distance of a value
 * to its k = min(5, n - 1) nearest values, divided by the series range, must
 * exceed threshold / 10.
 */
public class IsolationOutlierStrategy implements OutlierStrategy {

    private static final int MAX_NEIGHBOURS = 5;

    @Override
    public OutlierMethod getSupportedMethod() {
        return OutlierMethod.ISOLATION;
    }

    @Override
    public OutlierResult detect(double[] data, double threshold) {
        double applied = threshold / 10;
        int n = data.length;
        int k = Math.min(MAX_NEIGHBOURS, n - 1);
        double range = n == 0 ? 0.0 : Arrays.stream(data).max().getAsDouble() - Arrays.stream(data).min().getAsDouble();
        if (k <= 0 || range == 0) {
            return OutlierCollector.allClean(data, getSupportedMethod(), applied);
        }

        OutlierCollector collector = new OutlierCollector();
        double[] distances = new double[n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                distances[j] = Math.abs(data[i] - data[j]);
            }
            Arrays.sort(distances);
            double sum = 0.0;
            for (int j = 1; j <= k; j++) sum += distances[j];
            double score = (sum / k) / range;
            if (score > applied) {
                collector.flag(i, data[i], score);
            } else {
                collector.keep(data[i]);
            }
        }
        return collector.build(getSupportedMethod(), applied);
    }
}
