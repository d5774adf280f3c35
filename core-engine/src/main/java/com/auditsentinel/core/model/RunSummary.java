package com.auditsentinel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Per-run roll-up of the finding set: counts per severity, the top threat
 * types and the bounded risk score.
 *
 * @since 1.0.0
 */
public final class RunSummary {

    private final int totalFindings;
    private final int criticalFindings;
    private final int highSeverityFindings;
    private final int mediumSeverityFindings;
    private final int lowSeverityFindings;
    private final List<TopThreat> topThreats;
    private final int riskScore;

    public RunSummary(int totalFindings,
            int criticalFindings,
            int highSeverityFindings,
            int mediumSeverityFindings,
            int lowSeverityFindings,
            List<TopThreat> topThreats,
            int riskScore) {
        if (riskScore < 0 || riskScore > 100) {
            throw new IllegalArgumentException("riskScore must be in [0, 100], got: " + riskScore);
        }
        this.totalFindings = totalFindings;
        this.criticalFindings = criticalFindings;
        this.highSeverityFindings = highSeverityFindings;
        this.mediumSeverityFindings = mediumSeverityFindings;
        this.lowSeverityFindings = lowSeverityFindings;
        this.topThreats = List.copyOf(Objects.requireNonNull(topThreats, "topThreats must not be null"));
        this.riskScore = riskScore;
    }

    public int getTotalFindings() {
        return totalFindings;
    }

    public int getCriticalFindings() {
        return criticalFindings;
    }

    public int getHighSeverityFindings() {
        return highSeverityFindings;
    }

    public int getMediumSeverityFindings() {
        return mediumSeverityFindings;
    }

    public int getLowSeverityFindings() {
        return lowSeverityFindings;
    }

    public List<TopThreat> getTopThreats() {
        return topThreats;
    }

    public int getRiskScore() {
        return riskScore;
    }

    @Override
    public String toString() {
        return "RunSummary{" +
                "totalFindings=" + totalFindings +
                ", critical=" + criticalFindings +
                ", high=" + highSeverityFindings +
                ", topThreats=" + topThreats +
                ", riskScore=" + riskScore +
                '}';
    }
}
