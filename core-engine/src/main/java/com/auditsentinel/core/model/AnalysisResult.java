package com.auditsentinel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Everything one analysis run produces.
 *
 * @since 1.0.0
 */
public final class AnalysisResult {

    private final List<Finding> findings;
    private final RunStatistics statistics;
    private final RunSummary summary;
    private final List<RunRecommendation> recommendations;

    public AnalysisResult(List<Finding> findings,
            RunStatistics statistics,
            RunSummary summary,
            List<RunRecommendation> recommendations) {
        this.findings = List.copyOf(Objects.requireNonNull(findings, "findings must not be null"));
        this.statistics = Objects.requireNonNull(statistics, "statistics must not be null");
        this.summary = Objects.requireNonNull(summary, "summary must not be null");
        this.recommendations = List.copyOf(Objects.requireNonNull(recommendations, "recommendations must not be null"));
    }

    public List<Finding> getFindings() {
        return findings;
    }

    public RunStatistics getStatistics() {
        return statistics;
    }

    public RunSummary getSummary() {
        return summary;
    }

    public List<RunRecommendation> getRecommendations() {
        return recommendations;
    }
}
