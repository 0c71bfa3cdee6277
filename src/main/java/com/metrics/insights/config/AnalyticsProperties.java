package com.metrics.insights.config;

import com.metrics.insights.model.AnomalyDetectionConfig;
import com.metrics.insights.model.FillMethod;
import com.metrics.insights.model.OutlierMethod;
import com.metrics.insights.model.PreprocessingConfig;
import com.metrics.insights.model.Sensitivity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;

@Data
@Configuration
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    // Zone used to bucket timestamps into days of week and months.
    private String zoneId = "UTC";

    // Number of interval steps forecast for every metric in a batch.
    private int forecastHorizon = 7;

    private Anomaly anomaly = new Anomaly();

    private Preprocessing preprocessing = new Preprocessing();

    private Outlier outlier = new Outlier();

    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }

    public AnomalyDetectionConfig toAnomalyDetectionConfig() {
        return AnomalyDetectionConfig.builder()
                .sensitivity(anomaly.getSensitivity())
                .lookbackPeriod(anomaly.getLookbackPeriod())
                .seasonalityWindow(anomaly.getSeasonalityWindow())
                .minimumDeviation(anomaly.getMinimumDeviation())
                .excludeWeekends(anomaly.isExcludeWeekends())
                .build();
    }

    public PreprocessingConfig toPreprocessingConfig() {
        return PreprocessingConfig.builder()
                .normalize(preprocessing.isNormalize())
                .fillMissing(preprocessing.getFillMissing())
                .removeOutliers(preprocessing.isRemoveOutliers())
                .outlierThreshold(preprocessing.getOutlierThreshold())
                .smoothing(preprocessing.isSmoothing())
                .smoothingWindow(preprocessing.getSmoothingWindow())
                .build();
    }

    @Data
    public static class Anomaly {
        private Sensitivity sensitivity = Sensitivity.MEDIUM;
        // Days of history callers are expected to pass; informational only.
        private int lookbackPeriod = 30;
        // Minimum points before the seasonal-residual pass runs.
        private int seasonalityWindow = 14;
        // Floor for the z-score threshold, in standard deviations.
        private double minimumDeviation = 2.0;
        private boolean excludeWeekends = false;
    }

    @Data
    public static class Preprocessing {
        private boolean normalize = false;
        private FillMethod fillMissing = FillMethod.INTERPOLATE;
        private boolean removeOutliers = false;
        private double outlierThreshold = 3.0;
        private boolean smoothing = false;
        private int smoothingWindow = 3;
    }

    @Data
    public static class Outlier {
        private OutlierMethod method = OutlierMethod.ZSCORE;
        private double threshold = 2.5;
    }
}
