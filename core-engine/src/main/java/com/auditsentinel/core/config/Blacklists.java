package com.auditsentinel.core.config;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable application, country and user-agent denylists.
 *
 * <p>
 * Loaded once at start-up and shared read-only by every analysis run. An
 * attribute matches an entry when it contains the entry's value,
 * case-insensitively; the first matching entry in file order wins.
 * </p>
 *
 * @since 1.0.0
 */
public final class Blacklists {

    private static final Blacklists EMPTY = new Blacklists(List.of(), List.of(), List.of());

    private final List<BlacklistEntry> applications;
    private final List<BlacklistEntry> countries;
    private final List<BlacklistEntry> userAgents;

    public Blacklists(List<BlacklistEntry> applications,
            List<BlacklistEntry> countries,
            List<BlacklistEntry> userAgents) {
        this.applications = List.copyOf(Objects.requireNonNull(applications, "applications must not be null"));
        this.countries = List.copyOf(Objects.requireNonNull(countries, "countries must not be null"));
        this.userAgents = List.copyOf(Objects.requireNonNull(userAgents, "userAgents must not be null"));
    }

    public static Blacklists empty() {
        return EMPTY;
    }

    public Optional<BlacklistEntry> matchApplication(String application) {
        return match(applications, application);
    }

    public Optional<BlacklistEntry> matchCountry(String location) {
        return match(countries, location);
    }

    public Optional<BlacklistEntry> matchUserAgent(String userAgent) {
        return match(userAgents, userAgent);
    }

    public List<BlacklistEntry> getApplications() {
        return applications;
    }

    public List<BlacklistEntry> getCountries() {
        return countries;
    }

    public List<BlacklistEntry> getUserAgents() {
        return userAgents;
    }

    private static Optional<BlacklistEntry> match(List<BlacklistEntry> entries, String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return Optional.empty();
        }
        String haystack = candidate.toLowerCase(Locale.ROOT);
        return entries.stream()
                .filter(e -> haystack.contains(e.getValue().toLowerCase(Locale.ROOT)))
                .findFirst();
    }

    @Override
    public String toString() {
        return "Blacklists{applications=" + applications.size()
                + ", countries=" + countries.size()
                + ", userAgents=" + userAgents.size() + '}';
    }
}
