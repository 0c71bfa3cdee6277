package com.metrics.insights.config;

import com.metrics.insights.engine.insight.InsightGenerationListener;
import com.metrics.insights.model.Insight;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class MetricsConfig implements InsightGenerationListener {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordInsight(String type, String severity) {
        Counter.builder("insights.generated.count")
                .tag("type", type)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordAnomaly(String type) {
        Counter.builder("anomalies.detected.count")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    public void recordAnalysisFailure(String stage) {
        Counter.builder("insights.analysis.failures")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordSeriesPoints(int points) {
        DistributionSummary.builder("insights.series.points")
                .register(registry)
                .record(points);
    }

    @Override
    public void seriesAnalysed(String metric, int points) {
        recordSeriesPoints(points);
    }

    @Override
    public void analysisFailed(String stage, String subject, RuntimeException cause) {
        recordAnalysisFailure(stage);
    }

    @Override
    public void insightGenerated(Insight insight) {
        recordInsight(insight.getType().name().toLowerCase(Locale.ROOT),
                insight.getSeverity().name().toLowerCase(Locale.ROOT));
        if (insight.getData() != null && insight.getData().getAnomaly() != null) {
            recordAnomaly(insight.getData().getAnomaly().getType().name().toLowerCase(Locale.ROOT));
        }
    }
}
