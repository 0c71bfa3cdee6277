package com.metrics.insights.engine.outlier;

import com.metrics.insights.engine.stats.StatisticalPrimitives;
import com.metrics.insights.model.OutlierMethod;
import com.metrics.insights.model.OutlierResult;

/**
 * Flags values whose absolute z-score exceeds the threshold. A constant
 * series has no outliers.
 */
public class ZScoreOutlierStrategy implements OutlierStrategy {

    @Override
    public OutlierMethod getSupportedMethod() {
        return OutlierMethod.ZSCORE;
    }

    @Override
    public OutlierResult detect(double[] data, double threshold) {
        double mean = StatisticalPrimitives.mean(data);
        double std = StatisticalPrimitives.standardDeviation(data);
        if (std == 0) {
            return OutlierCollector.allClean(data, getSupportedMethod(), threshold);
        }

        OutlierCollector collector = new OutlierCollector();
        for (int i = 0; i < data.length; i++) {
            double z = Math.abs(data[i] - mean) / std;
            if (z > threshold) {
                collector.flag(i, data[i], z);
            } else {
                collector.keep(data[i]);
            }
        }
        return collector.build(getSupportedMethod(), threshold);
    }
}
