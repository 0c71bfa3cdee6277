package com.metrics.insights.model;

public enum InsightSeverity {
    CRITICAL(4),
    WARNING(3),
    POSITIVE(2),
    INFO(1);

    private final int weight;

    InsightSeverity(int weight) {
        this.weight = weight;
    }

    /**
     * Ranking weight; multiplied by an insight's confidence to order the final list.
     */
    public int getWeight() {
        return weight;
    }
}
