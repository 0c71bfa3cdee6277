package com.metrics.insights.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI metricsInsightsOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Metrics Insights API")
                        .version("1.0.0")
                        .description(
                                "Analytics engine that turns per-metric time series into ranked findings.\n\n" +
                                "**Insight Pipeline:**\n" +
                                "1. Submit one or more series via `POST /api/v1/insights/generate`\n" +
                                "2. Each series runs through anomaly detection (z-score, sliding-window isolation, seasonal residual)\n" +
                                "3. Linear trend analysis and weekly/monthly pattern discovery\n" +
                                "4. A short forecast from the regression plus seasonal adjustment\n" +
                                "5. Pairwise correlation across metrics\n" +
                                "6. Findings are ranked by severity weight x confidence\n\n" +
                                "**Severity Weights:** `CRITICAL` 4, `WARNING` 3, `POSITIVE` 2, `INFO` 1\n\n" +
                                "**Supporting Tools:** preprocessing (`/api/v1/data/preprocess`), single-series outliers " +
                                "(`/api/v1/data/outliers`), model scoring and rolling-origin cross-validation (`/api/v1/models`)")
                        .contact(new Contact().name("Metrics Insights Team")));
    }
}
