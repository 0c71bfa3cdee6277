package com.metrics.insights.engine.preprocessing;

import com.metrics.insights.model.FillMethod;
import com.metrics.insights.model.PreprocessingConfig;
import com.metrics.insights.model.ProcessedData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cleans a raw numeric series in four ordered steps: imputation of missing
 * values, outlier clamping, centered smoothing and min-max normalization.
 *
 * A value is missing when it is null, NaN or infinite. Statistics reported
 * in the metadata and used for clamping come from the valid input values only.
 */
public class DataPreprocessor {

    private static final Logger log = LoggerFactory.getLogger(DataPreprocessor.class);

    public ProcessedData preprocess(List<Double> data, PreprocessingConfig config) {
        if (data == null) {
            throw new IllegalArgumentException("data must not be null");
        }
        PreprocessingConfig effective = config != null ? config : PreprocessingConfig.defaults();
        int n = data.size();

        double[] values = new double[n];
        boolean[] valid = new boolean[n];
        List<Double> validValues = new ArrayList<>();
        int missingCount = 0;
        for (int i = 0; i < n; i++) {
            Double v = data.get(i);
            if (isValid(v)) {
                values[i] = v;
                valid[i] = true;
                validValues.add(v);
            } else {
                values[i] = Double.NaN;
                missingCount++;
            }
        }

        double mean = validValues.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double std = populationStd(validValues, mean);
        double min = validValues.isEmpty() ? 0.0 : Collections.min(validValues);
        double max = validValues.isEmpty() ? 0.0 : Collections.max(validValues);

        if (missingCount > 0) {
            FillMethod method = effective.getFillMissing() != null ? effective.getFillMissing() : FillMethod.INTERPOLATE;
            fillMissing(values, valid, method);
            log.debug("Imputed {} missing values using {}", missingCount, method);
        }

        int outlierCount = 0;
        if (effective.isRemoveOutliers() && std > 0) {
            double bound = effective.getOutlierThreshold() * std;
            for (int i = 0; i < n; i++) {
                if (Math.abs(values[i] - mean) > bound) {
                    values[i] = values[i] > mean ? mean + bound : mean - bound;
                    outlierCount++;
                }
            }
        }

        if (effective.isSmoothing() && effective.getSmoothingWindow() > 1) {
            values = centeredSmooth(values, effective.getSmoothingWindow());
        }

        if (effective.isNormalize()) {
            normalize(values);
        }

        List<Double> processed = new ArrayList<>(n);
        for (double v : values) processed.add(v);

        return ProcessedData.builder()
                .original(Collections.unmodifiableList(new ArrayList<>(data)))
                .processed(processed)
                .metadata(ProcessedData.Metadata.builder()
                        .mean(mean)
                        .std(std)
                        .min(min)
                        .max(max)
                        .missingCount(missingCount)
                        .outlierCount(outlierCount)
                        .build())
                .build();
    }

    private void fillMissing(double[] values, boolean[] valid, FillMethod method) {
        int n = values.length;
        switch (method) {
            case FORWARD -> {
                for (int i = 0; i < n; i++) {
                    if (!valid[i]) values[i] = i > 0 ? values[i - 1] : 0.0;
                }
            }
            case BACKWARD -> {
                for (int i = 0; i < n; i++) {
                    if (valid[i]) continue;
                    double next = 0.0;
                    for (int j = i + 1; j < n; j++) {
                        if (valid[j]) {
                            next = values[j];
                            break;
                        }
                    }
                    values[i] = next;
                }
            }
            case INTERPOLATE -> interpolate(values, valid);
            case MEAN -> {
                // running mean includes values imputed earlier in the pass
                boolean[] filled = valid.clone();
                for (int i = 0; i < n; i++) {
                    if (filled[i]) continue;
                    double sum = 0.0;
                    int count = 0;
                    for (int j = 0; j < n; j++) {
                        if (filled[j]) {
                            sum += values[j];
                            count++;
                        }
                    }
                    values[i] = count > 0 ? sum / count : 0.0;
                    filled[i] = true;
                }
            }
        }
    }

    private void interpolate(double[] values, boolean[] valid) {
        int n = values.length;
        boolean[] known = valid.clone();
        for (int i = 0; i < n; i++) {
            if (known[i]) continue;
            int prev = -1;
            for (int j = i - 1; j >= 0; j--) {
                if (known[j]) {
                    prev = j;
                    break;
                }
            }
            int next = -1;
            for (int j = i + 1; j < n; j++) {
                if (known[j]) {
                    next = j;
                    break;
                }
            }
            if (prev >= 0 && next >= 0) {
                double weight = (double) (i - prev) / (next - prev);
                values[i] = values[prev] + weight * (values[next] - values[prev]);
            } else if (prev >= 0) {
                values[i] = values[prev];
            } else if (next >= 0) {
                values[i] = values[next];
            } else {
                values[i] = 0.0;
            }
            known[i] = true;
        }
    }

    /**
     * Centered moving average whose window shrinks at the series edges.
     */
    private double[] centeredSmooth(double[] values, int window) {
        int n = values.length;
        int half = window / 2;
        double[] smoothed = new double[n];
        for (int i = 0; i < n; i++) {
            int from = Math.max(0, i - half);
            int to = Math.min(n - 1, i + half);
            double sum = 0.0;
            for (int j = from; j <= to; j++) sum += values[j];
            smoothed[i] = sum / (to - from + 1);
        }
        return smoothed;
    }

    private void normalize(double[] values) {
        if (values.length == 0) return;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double range = max - min;
        for (int i = 0; i < values.length; i++) {
            values[i] = range == 0 ? 0.0 : (values[i] - min) / range;
        }
    }

    private static boolean isValid(Double v) {
        return v != null && !v.isNaN() && !v.isInfinite();
    }

    private static double populationStd(List<Double> values, double mean) {
        if (values.isEmpty()) return 0.0;
        double sumSq = 0.0;
        for (double v : values) {
            sumSq += (v - mean) * (v - mean);
        }
        return Math.sqrt(sumSq / values.size());
    }
}
