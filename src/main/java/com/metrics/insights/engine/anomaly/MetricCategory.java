package com.metrics.insights.engine.anomaly;

import java.util.List;
import java.util.Locale;

/**
 * Coarse business category of a metric, inferred from its name.
 */
public enum MetricCategory {
    TRAFFIC(
            List.of("Viral content", "Marketing campaign", "External mentions", "SEO improvements"),
            List.of("Technical issues", "Server downtime", "Algorithm changes", "Competitor activity")),
    CONVERSION(
            List.of("Promotional offers", "UX improvements", "Pricing changes", "Product launches"),
            List.of("Technical bugs", "Payment issues", "User experience problems", "Price increases")),
    ENGAGEMENT(
            List.of("Content quality improvements", "New features", "Personalization", "User campaigns"),
            List.of("Content fatigue", "Technical issues", "Competition", "Seasonal effects"));

    static final List<String> FALLBACK_CAUSES = List.of("External factors", "Technical changes", "Market conditions");

    private final List<String> spikeCauses;
    private final List<String> dropCauses;

    MetricCategory(List<String> spikeCauses, List<String> dropCauses) {
        this.spikeCauses = spikeCauses;
        this.dropCauses = dropCauses;
    }

    /**
     * "conversion" or "purchase" means conversion; "engagement", "time" or
     * "bounce" means engagement; everything else is traffic.
     */
    public static MetricCategory of(String metric) {
        String name = metric == null ? "" : metric.toLowerCase(Locale.ROOT);
        if (name.contains("conversion") || name.contains("purchase")) return CONVERSION;
        if (name.contains("engagement") || name.contains("time") || name.contains("bounce")) return ENGAGEMENT;
        return TRAFFIC;
    }

    public List<String> causes(boolean spike) {
        return spike ? spikeCauses : dropCauses;
    }
}
