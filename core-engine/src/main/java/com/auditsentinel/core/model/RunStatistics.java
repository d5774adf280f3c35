package com.auditsentinel.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregate counters for one analysis run.
 *
 * <p>
 * An immutable snapshot: distinct values are accumulated during the run and
 * only their counts are published here, except for blacklist hits where the
 * matching values themselves are kept.
 * </p>
 *
 * @since 1.0.0
 */
public final class RunStatistics {

    private final int totalEvents;
    private final int uniqueUsers;
    private final int uniqueOperations;
    private final int uniqueApplications;
    private final int uniqueCountries;
    private final int uniqueIpAddresses;
    private final int successOperations;
    private final int failedOperations;
    private final int suspiciousActivities;
    private final int highSeverityEvents;
    private final int criticalSeverityEvents;
    private final BlacklistedEntities blacklistedEntities;
    private final DataQuality dataQuality;

    private RunStatistics(Builder b) {
        this.totalEvents = b.totalEvents;
        this.uniqueUsers = b.uniqueUsers;
        this.uniqueOperations = b.uniqueOperations;
        this.uniqueApplications = b.uniqueApplications;
        this.uniqueCountries = b.uniqueCountries;
        this.uniqueIpAddresses = b.uniqueIpAddresses;
        this.successOperations = b.successOperations;
        this.failedOperations = b.failedOperations;
        this.suspiciousActivities = b.suspiciousActivities;
        this.highSeverityEvents = b.highSeverityEvents;
        this.criticalSeverityEvents = b.criticalSeverityEvents;
        this.blacklistedEntities = Objects.requireNonNull(b.blacklistedEntities, "blacklistedEntities must not be null");
        this.dataQuality = Objects.requireNonNull(b.dataQuality, "dataQuality must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return statistics of a run over zero events
     */
    public static RunStatistics empty() {
        return builder()
                .blacklistedEntities(new BlacklistedEntities(Set.of(), Set.of(), Set.of()))
                .dataQuality(new DataQuality(Map.of()))
                .build();
    }

    public int getTotalEvents() {
        return totalEvents;
    }

    public int getUniqueUsers() {
        return uniqueUsers;
    }

    public int getUniqueOperations() {
        return uniqueOperations;
    }

    public int getUniqueApplications() {
        return uniqueApplications;
    }

    public int getUniqueCountries() {
        return uniqueCountries;
    }

    public int getUniqueIpAddresses() {
        return uniqueIpAddresses;
    }

    public int getSuccessOperations() {
        return successOperations;
    }

    public int getFailedOperations() {
        return failedOperations;
    }

    public int getSuspiciousActivities() {
        return suspiciousActivities;
    }

    public int getHighSeverityEvents() {
        return highSeverityEvents;
    }

    public int getCriticalSeverityEvents() {
        return criticalSeverityEvents;
    }

    public BlacklistedEntities getBlacklistedEntities() {
        return blacklistedEntities;
    }

    public DataQuality getDataQuality() {
        return dataQuality;
    }

    // ---------------------------------------------------------------
    // Nested value types
    // ---------------------------------------------------------------

    /**
     * Distinct attribute values that matched a blacklist.
     */
    public static final class BlacklistedEntities {
        private final Set<String> applications;
        private final Set<String> countries;
        private final Set<String> userAgents;

        public BlacklistedEntities(Set<String> applications, Set<String> countries, Set<String> userAgents) {
            this.applications = Collections.unmodifiableSet(new LinkedHashSet<>(applications));
            this.countries = Collections.unmodifiableSet(new LinkedHashSet<>(countries));
            this.userAgents = Collections.unmodifiableSet(new LinkedHashSet<>(userAgents));
        }

        public Set<String> getApplications() {
            return applications;
        }

        public Set<String> getCountries() {
            return countries;
        }

        public Set<String> getUserAgents() {
            return userAgents;
        }
    }

    /**
     * Identity-resolution quality: how many events carried a synthetic user,
     * broken down by the strategy that produced it.
     */
    public static final class DataQuality {
        private final Map<IdentityStrategy, Integer> unknownUsersByStrategy;

        public DataQuality(Map<IdentityStrategy, Integer> unknownUsersByStrategy) {
            Map<IdentityStrategy, Integer> copy = new EnumMap<>(IdentityStrategy.class);
            copy.putAll(unknownUsersByStrategy);
            copy.remove(IdentityStrategy.REAL);
            this.unknownUsersByStrategy = Collections.unmodifiableMap(copy);
        }

        public int getUnknownUserEvents() {
            return unknownUsersByStrategy.values().stream().mapToInt(Integer::intValue).sum();
        }

        public Map<IdentityStrategy, Integer> getUnknownUsersByStrategy() {
            return unknownUsersByStrategy;
        }

        public int countFor(IdentityStrategy strategy) {
            return unknownUsersByStrategy.getOrDefault(strategy, 0);
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private int totalEvents;
        private int uniqueUsers;
        private int uniqueOperations;
        private int uniqueApplications;
        private int uniqueCountries;
        private int uniqueIpAddresses;
        private int successOperations;
        private int failedOperations;
        private int suspiciousActivities;
        private int highSeverityEvents;
        private int criticalSeverityEvents;
        private BlacklistedEntities blacklistedEntities;
        private DataQuality dataQuality;

        public Builder totalEvents(int v) {
            this.totalEvents = v;
            return this;
        }

        public Builder uniqueUsers(int v) {
            this.uniqueUsers = v;
            return this;
        }

        public Builder uniqueOperations(int v) {
            this.uniqueOperations = v;
            return this;
        }

        public Builder uniqueApplications(int v) {
            this.uniqueApplications = v;
            return this;
        }

        public Builder uniqueCountries(int v) {
            this.uniqueCountries = v;
            return this;
        }

        public Builder uniqueIpAddresses(int v) {
            this.uniqueIpAddresses = v;
            return this;
        }

        public Builder successOperations(int v) {
            this.successOperations = v;
            return this;
        }

        public Builder failedOperations(int v) {
            this.failedOperations = v;
            return this;
        }

        public Builder suspiciousActivities(int v) {
            this.suspiciousActivities = v;
            return this;
        }

        public Builder highSeverityEvents(int v) {
            this.highSeverityEvents = v;
            return this;
        }

        public Builder criticalSeverityEvents(int v) {
            this.criticalSeverityEvents = v;
            return this;
        }

        public Builder blacklistedEntities(BlacklistedEntities v) {
            this.blacklistedEntities = v;
            return this;
        }

        public Builder dataQuality(DataQuality v) {
            this.dataQuality = v;
            return this;
        }

        public RunStatistics build() {
            return new RunStatistics(this);
        }
    }

    @Override
    public String toString() {
        return "RunStatistics{" +
                "totalEvents=" + totalEvents +
                ", uniqueUsers=" + uniqueUsers +
                ", failedOperations=" + failedOperations +
                ", suspiciousActivities=" + suspiciousActivities +
                '}';
    }
}
