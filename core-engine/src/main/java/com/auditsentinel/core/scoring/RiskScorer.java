package com.auditsentinel.core.scoring;

import com.auditsentinel.core.model.Finding;
import com.auditsentinel.core.model.RunStatistics;
import com.auditsentinel.core.model.RunSummary;
import com.auditsentinel.core.model.Severity;
import com.auditsentinel.core.model.TopThreat;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collapses the findings and statistics of a run into a {@link RunSummary}.
 *
 * <h3>Risk score</h3>
 * <p>
 * The sum of the severity weights of all findings, plus 0.1 per failed
 * operation, 2 per distinct blacklisted application, 3 per distinct
 * blacklisted country and 1 per distinct blacklisted user agent. The total
 * is rounded half-up and capped at 100.
 * </p>
 *
 * @since 1.0.0
 */
public final class RiskScorer {

    public static final int MAX_SCORE = 100;
    public static final int TOP_THREAT_LIMIT = 5;

    private RiskScorer() {
        // static helpers
    }

    /**
     * @param findings   all findings of the run
     * @param statistics the run statistics
     * @return the risk score in {@code [0, 100]}
     */
    public static int score(List<Finding> findings, RunStatistics statistics) {
        Objects.requireNonNull(findings, "findings must not be null");
        Objects.requireNonNull(statistics, "statistics must not be null");

        double total = 0;
        for (Finding finding : findings) {
            total += finding.getSeverity().getWeight();
        }
        RunStatistics.BlacklistedEntities blacklisted = statistics.getBlacklistedEntities();
        total += statistics.getFailedOperations() * 0.1;
        total += blacklisted.getApplications().size() * 2;
        total += blacklisted.getCountries().size() * 3;
        total += blacklisted.getUserAgents().size();

        return (int) Math.min(MAX_SCORE, Math.round(total));
    }

    /**
     * Finding types by count, most frequent first. Ties keep the order in
     * which the type first appeared.
     *
     * @param findings all findings of the run
     * @return at most {@value #TOP_THREAT_LIMIT} entries
     */
    public static List<TopThreat> topThreats(List<Finding> findings) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Finding finding : findings) {
            counts.merge(finding.getType(), 1, Integer::sum);
        }
        List<TopThreat> threats = new ArrayList<>();
        counts.forEach((type, count) -> threats.add(new TopThreat(type, count)));
        // List.sort is stable
        threats.sort(Comparator.comparingInt(TopThreat::getCount).reversed());
        return threats.size() > TOP_THREAT_LIMIT ? List.copyOf(threats.subList(0, TOP_THREAT_LIMIT)) : threats;
    }

    /**
     * @param findings   all findings of the run
     * @param statistics the run statistics
     * @return severity counts, top threats and risk score
     */
    public static RunSummary summarize(List<Finding> findings, RunStatistics statistics) {
        Map<Severity, Integer> bySeverity = new LinkedHashMap<>();
        for (Finding finding : findings) {
            bySeverity.merge(finding.getSeverity(), 1, Integer::sum);
        }
        return new RunSummary(
                findings.size(),
                bySeverity.getOrDefault(Severity.CRITICAL, 0),
                bySeverity.getOrDefault(Severity.HIGH, 0),
                bySeverity.getOrDefault(Severity.MEDIUM, 0),
                bySeverity.getOrDefault(Severity.LOW, 0),
                topThreats(findings),
                score(findings, statistics));
    }
}
