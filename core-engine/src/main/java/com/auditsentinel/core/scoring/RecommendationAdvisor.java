package com.auditsentinel.core.scoring;

import com.auditsentinel.core.detection.TimeAnomalyRule;
import com.auditsentinel.core.model.Finding;
import com.auditsentinel.core.model.RunRecommendation;
import com.auditsentinel.core.model.RunStatistics;

import java.util.ArrayList;
import java.util.List;

/**
 * Run-level advice derived from the statistics and findings of a run.
 *
 * @since 1.0.0
 */
public final class RecommendationAdvisor {

    private RecommendationAdvisor() {
        // static helpers
    }

    public static List<RunRecommendation> advise(List<Finding> findings, RunStatistics statistics) {
        List<RunRecommendation> advice = new ArrayList<>();

        if (statistics.getFailedOperations() > 0) {
            advice.add(new RunRecommendation("security", "high",
                    "Review failed authentication attempts",
                    "Found " + statistics.getFailedOperations()
                            + " failed operations. Review for potential brute force attacks.",
                    "Investigate failed login patterns and consider implementing account lockout policies."));
        }

        if (statistics.getHighSeverityEvents() > 0) {
            advice.add(new RunRecommendation("security", "critical",
                    "Address high severity security events",
                    "Found " + statistics.getHighSeverityEvents()
                            + " high severity events requiring immediate attention.",
                    "Review and respond to all high severity findings immediately."));
        }

        boolean afterHours = findings.stream()
                .anyMatch(f -> TimeAnomalyRule.AFTER_HOURS_TYPE.equals(f.getType()));
        if (afterHours) {
            advice.add(new RunRecommendation("monitoring", "medium",
                    "Monitor after-hours activity",
                    "Detected activity outside normal business hours.",
                    "Implement monitoring for unusual time patterns and consider geo-fencing."));
        }

        return advice;
    }
}
