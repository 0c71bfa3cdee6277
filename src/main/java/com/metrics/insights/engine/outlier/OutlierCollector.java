package com.metrics.insights.engine.outlier;

import com.metrics.insights.engine.stats.StatisticalPrimitives;
import com.metrics.insights.model.OutlierMethod;
import com.metrics.insights.model.OutlierResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates flagged and clean entries in input order.
 */
class OutlierCollector {

    private final List<OutlierResult.Outlier> outliers = new ArrayList<>();
    private final List<Double> cleanData = new ArrayList<>();

    void flag(int index, double value, double statistic) {
        outliers.add(OutlierResult.Outlier.builder()
                .index(index)
                .value(value)
                .score(StatisticalPrimitives.clampUnit(statistic))
                .statistic(statistic)
                .build());
    }

    void keep(double value) {
        cleanData.add(value);
    }

    OutlierResult build(OutlierMethod method, double threshold) {
        return OutlierResult.builder()
                .outliers(List.copyOf(outliers))
                .cleanData(List.copyOf(cleanData))
                .method(method)
                .threshold(threshold)
                .build();
    }

    static OutlierResult allClean(double[] data, OutlierMethod method, double threshold) {
        OutlierCollector collector = new OutlierCollector();
        for (double v : data) collector.keep(v);
        return collector.build(method, threshold);
    }
}
