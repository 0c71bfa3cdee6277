package com.metrics.insights.service;

import com.metrics.insights.config.AnalyticsProperties;
import com.metrics.insights.engine.outlier.OutlierDetector;
import com.metrics.insights.engine.preprocessing.DataPreprocessor;
import com.metrics.insights.model.OutlierMethod;
import com.metrics.insights.model.OutlierResult;
import com.metrics.insights.model.PreprocessingConfig;
import com.metrics.insights.model.ProcessedData;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class DataPreparationService {

    private static final Logger log = LoggerFactory.getLogger(DataPreparationService.class);

    private final DataPreprocessor preprocessor;
    private final AnalyticsProperties properties;

    public DataPreparationService(DataPreprocessor preprocessor, AnalyticsProperties properties) {
        this.preprocessor = preprocessor;
        this.properties = properties;
    }

    /**
     * @param config options for this call; the configured defaults apply when null
     */
    @Observed(name = "data.preprocess", contextualName = "preprocess-series")
    public ProcessedData preprocess(List<Double> values, PreprocessingConfig config) {
        if (values == null) {
            throw new IllegalArgumentException("values are required");
        }
        PreprocessingConfig effective = config != null ? config : properties.toPreprocessingConfig();
        if (effective.isSmoothing() && effective.getSmoothingWindow() < 1) {
            throw new IllegalArgumentException("smoothingWindow must be >= 1");
        }
        ProcessedData result = preprocessor.preprocess(values, effective);
        log.debug("Preprocessed {} values: {} missing, {} clamped",
                values.size(), result.getMetadata().getMissingCount(), result.getMetadata().getOutlierCount());
        return result;
    }

    /**
     * @param method    strategy for this call; the configured method applies when null
     * @param threshold threshold for this call; the configured threshold applies when null
     */
    @Observed(name = "data.outliers", contextualName = "detect-outliers")
    public OutlierResult detectOutliers(List<Double> values, OutlierMethod method, Double threshold) {
        if (values == null) {
            throw new IllegalArgumentException("values are required");
        }
        double[] data = new double[values.size()];
        for (int i = 0; i < data.length; i++) {
            Double v = values.get(i);
            if (v == null || v.isNaN() || v.isInfinite()) {
                throw new IllegalArgumentException("values[" + i + "] is not a finite number");
            }
            data[i] = v;
        }
        OutlierDetector detector = new OutlierDetector(
                method != null ? method : properties.getOutlier().getMethod(),
                threshold != null ? threshold : properties.getOutlier().getThreshold());
        OutlierResult result = detector.detect(data);
        log.debug("Outlier detection ({}) flagged {} of {} values",
                result.getMethod(), result.getOutliers().size(), data.length);
        return result;
    }
}
