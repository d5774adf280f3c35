package com.auditsentinel.core.detection;

import com.auditsentinel.core.model.Identity;
import com.auditsentinel.core.model.IdentityStrategy;
import com.auditsentinel.core.model.NormalizedEvent;
import com.auditsentinel.core.model.RunStatistics;
import com.auditsentinel.core.model.Severity;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Mutable accumulator behind {@link RunStatistics}.
 *
 * <p>
 * Distinct values are collected in hash sets during the run and only
 * counted by {@link #snapshot()}. The {@code Unknown} sentinel is never
 * counted as a distinct operation, application, country or IP address.
 * Not thread-safe; owned by one {@link AnalysisContext}.
 * </p>
 */
public final class StatisticsCollector {

    private int totalEvents;
    private final Set<Identity> users = new HashSet<>();
    private final Set<String> operations = new HashSet<>();
    private final Set<String> applications = new HashSet<>();
    private final Set<String> countries = new HashSet<>();
    private final Set<String> ipAddresses = new HashSet<>();
    private int successOperations;
    private int failedOperations;
    private int suspiciousActivities;
    private int highSeverityEvents;
    private int criticalSeverityEvents;
    private final Set<String> blacklistedApplications = new LinkedHashSet<>();
    private final Set<String> blacklistedCountries = new LinkedHashSet<>();
    private final Set<String> blacklistedUserAgents = new LinkedHashSet<>();
    private final Map<IdentityStrategy, Integer> unknownUsers = new EnumMap<>(IdentityStrategy.class);

    /**
     * Count one event.
     *
     * @param event normalized event
     */
    public void record(NormalizedEvent event) {
        totalEvents++;
        users.add(event.getIdentity());
        addKnown(operations, event.getOperation());
        addKnown(applications, event.getApplication());
        addKnown(countries, event.getLocation());
        addKnown(ipAddresses, event.getIpAddress());

        if (event.isSuccess()) {
            successOperations++;
        } else if (event.isFailure()) {
            failedOperations++;
        }
        if (event.isUnknownUser()) {
            unknownUsers.merge(event.getIdentity().getStrategy(), 1, Integer::sum);
        }
    }

    /**
     * Count one suspicious-operation match.
     *
     * @param severity severity of the matched pattern
     */
    public void recordSuspicious(Severity severity) {
        suspiciousActivities++;
        if (severity == Severity.HIGH) {
            highSeverityEvents++;
        } else if (severity == Severity.CRITICAL) {
            criticalSeverityEvents++;
        }
    }

    public void recordBlacklistedApplication(String application) {
        blacklistedApplications.add(application);
    }

    public void recordBlacklistedCountry(String country) {
        blacklistedCountries.add(country);
    }

    public void recordBlacklistedUserAgent(String userAgent) {
        blacklistedUserAgents.add(userAgent);
    }

    /**
     * @return immutable counts of everything recorded so far
     */
    public RunStatistics snapshot() {
        return RunStatistics.builder()
                .totalEvents(totalEvents)
                .uniqueUsers(users.size())
                .uniqueOperations(operations.size())
                .uniqueApplications(applications.size())
                .uniqueCountries(countries.size())
                .uniqueIpAddresses(ipAddresses.size())
                .successOperations(successOperations)
                .failedOperations(failedOperations)
                .suspiciousActivities(suspiciousActivities)
                .highSeverityEvents(highSeverityEvents)
                .criticalSeverityEvents(criticalSeverityEvents)
                .blacklistedEntities(new RunStatistics.BlacklistedEntities(
                        blacklistedApplications, blacklistedCountries, blacklistedUserAgents))
                .dataQuality(new RunStatistics.DataQuality(unknownUsers))
                .build();
    }

    private static void addKnown(Set<String> target, String value) {
        if (!NormalizedEvent.isUnknown(value)) {
            target.add(value);
        }
    }
}
