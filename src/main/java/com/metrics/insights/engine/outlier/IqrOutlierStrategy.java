package com.metrics.insights.engine.outlier;

import com.metrics.insights.model.OutlierMethod;
import com.metrics.insights.model.OutlierResult;

import java.util.Arrays;

/**
 * Tukey fences at 1.5 IQR. Quartiles are read from the sorted series at the
 * truncated indices floor(0.25n) and floor(0.75n), without interpolation.
 * The configured threshold is ignored; the reported threshold is the fence multiplier.
 */
public class IqrOutlierStrategy implements OutlierStrategy {

    static final double FENCE_MULTIPLIER = 1.5;

    @Override
    public OutlierMethod getSupportedMethod() {
        return OutlierMethod.IQR;
    }

    @Override
    public OutlierResult detect(double[] data, double threshold) {
        if (data.length == 0) {
            return OutlierCollector.allClean(data, getSupportedMethod(), FENCE_MULTIPLIER);
        }
        double[] sorted = data.clone();
        Arrays.sort(sorted);
        double q1 = sorted[(int) Math.floor(sorted.length * 0.25)];
        double q3 = sorted[(int) Math.floor(sorted.length * 0.75)];
        double iqr = q3 - q1;
        double lower = q1 - FENCE_MULTIPLIER * iqr;
        double upper = q3 + FENCE_MULTIPLIER * iqr;

        OutlierCollector collector = new OutlierCollector();
        for (int i = 0; i < data.length; i++) {
            double value = data[i];
            if (value < lower || value > upper) {
                double pastBound = value < lower ? lower - value : value - upper;
                double statistic = iqr > 0 ? pastBound / iqr : 1.0;
                collector.flag(i, value, statistic);
            } else {
                collector.keep(value);
            }
        }
        return collector.build(getSupportedMethod(), FENCE_MULTIPLIER);
    }
}
