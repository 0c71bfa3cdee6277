package com.metrics.insights.engine.outlier;

import com.metrics.insights.model.OutlierMethod;
import com.metrics.insights.model.OutlierResult;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Simplified local outlier factor over one-dimensional values.
 *
 * <p>With k = min(5, n / 3), the neighbours of a point are entries 1..k of all
 * points stable-sorted by distance (entry 0 is dropped as "self", even when a
 * tied duplicate sorts first). The reachability of a point is the mean of
 * max(d, kDistance(neighbour)) over its neighbours, where kDistance is the k-th
 * entry of the sorted distance list including self. lrd = 1 / (reach + 1e-10),
 * and the factor is the mean of neighbourLrd / lrd. Points with a factor above
 * the threshold are flagged.
 *
 * <p>Neighbour lists, k-distances and densities are computed once per point,
 * so a call is O(n² log n).
 */
public class LofOutlierStrategy implements OutlierStrategy {

    private static final int MAX_NEIGHBOURS = 5;
    private static final double EPSILON = 1e-10;

    @Override
    public OutlierMethod getSupportedMethod() {
        return OutlierMethod.LOF;
    }

    @Override
    public OutlierResult detect(double[] data, double threshold) {
        int n = data.length;
        int k = Math.min(MAX_NEIGHBOURS, n / 3);
        if (k == 0) {
            return OutlierCollector.allClean(data, getSupportedMethod(), threshold);
        }

        int[][] neighbours = new int[n][];
        double[] kDistance = new double[n];
        for (int i = 0; i < n; i++) {
            final double value = data[i];
            Integer[] order = new Integer[n];
            for (int j = 0; j < n; j++) order[j] = j;
            // Arrays.sort on objects is stable
            Arrays.sort(order, Comparator.comparingDouble(j -> Math.abs(value - data[j])));
            neighbours[i] = new int[k];
            for (int j = 0; j < k; j++) neighbours[i][j] = order[j + 1];
            kDistance[i] = Math.abs(value - data[order[k]]);
        }

        double[] lrd = new double[n];
        for (int i = 0; i < n; i++) {
            double reach = 0.0;
            for (int neighbour : neighbours[i]) {
                reach += Math.max(Math.abs(data[i] - data[neighbour]), kDistance[neighbour]);
            }
            lrd[i] = 1 / (reach / k + EPSILON);
        }

        OutlierCollector collector = new OutlierCollector();
        for (int i = 0; i < n; i++) {
            double ratioSum = 0.0;
            for (int neighbour : neighbours[i]) {
                ratioSum += lrd[neighbour] / lrd[i];
            }
            double factor = ratioSum / k;
            if (factor > threshold) {
                collector.flag(i, data[i], factor);
            } else {
                collector.keep(data[i]);
            }
        }
        return collector.build(getSupportedMethod(), threshold);
    }
}
