package com.auditsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Entities a finding refers to. Empty categories are omitted from JSON.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class AffectedEntities {

    private final List<String> users;
    private final List<String> applications;
    private final List<String> ipAddresses;
    private final List<String> locations;
    private final List<String> operations;
    private final List<String> userAgents;
    private final List<String> targetResources;

    private AffectedEntities(Builder b) {
        this.users = List.copyOf(b.users);
        this.applications = List.copyOf(b.applications);
        this.ipAddresses = List.copyOf(b.ipAddresses);
        this.locations = List.copyOf(b.locations);
        this.operations = List.copyOf(b.operations);
        this.userAgents = List.copyOf(b.userAgents);
        this.targetResources = List.copyOf(b.targetResources);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getUsers() {
        return users;
    }

    public List<String> getApplications() {
        return applications;
    }

    public List<String> getIpAddresses() {
        return ipAddresses;
    }

    public List<String> getLocations() {
        return locations;
    }

    public List<String> getOperations() {
        return operations;
    }

    public List<String> getUserAgents() {
        return userAgents;
    }

    public List<String> getTargetResources() {
        return targetResources;
    }

    /**
     * Collects entity values; {@code null}, blank and {@code Unknown} values
     * are skipped.
     */
    public static class Builder {
        private final List<String> users = new ArrayList<>();
        private final List<String> applications = new ArrayList<>();
        private final List<String> ipAddresses = new ArrayList<>();
        private final List<String> locations = new ArrayList<>();
        private final List<String> operations = new ArrayList<>();
        private final List<String> userAgents = new ArrayList<>();
        private final List<String> targetResources = new ArrayList<>();

        public Builder user(String user) {
            add(users, user);
            return this;
        }

        public Builder users(Iterable<String> values) {
            values.forEach(v -> add(users, v));
            return this;
        }

        public Builder application(String application) {
            add(applications, application);
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            add(ipAddresses, ipAddress);
            return this;
        }

        public Builder location(String location) {
            add(locations, location);
            return this;
        }

        public Builder operation(String operation) {
            add(operations, operation);
            return this;
        }

        public Builder userAgent(String userAgent) {
            add(userAgents, userAgent);
            return this;
        }

        public Builder targetResources(Iterable<String> values) {
            values.forEach(v -> add(targetResources, v));
            return this;
        }

        public AffectedEntities build() {
            return new AffectedEntities(this);
        }

        private static void add(List<String> target, String value) {
            if (value != null && !value.isBlank() && !NormalizedEvent.isUnknown(value)) {
                target.add(value);
            }
        }
    }

    @Override
    public String toString() {
        return "AffectedEntities{users=" + users + ", applications=" + applications
                + ", ipAddresses=" + ipAddresses + ", locations=" + locations + '}';
    }
}
