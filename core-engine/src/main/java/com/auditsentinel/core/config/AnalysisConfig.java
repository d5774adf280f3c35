package com.auditsentinel.core.config;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the analysis settings YAML.
 *
 * <p>
 * Expected YAML structure (every key optional, defaults shown):
 * </p>
 *
 * <pre>
 * source: entra_audit_logs
 * timeZone: ""            # blank = host default zone
 * businessHours:
 *   start: 6
 *   end: 22
 * bruteForce:
 *   failureThreshold: 3
 *   windowMinutes: 60
 *   lookbackEvents: 100
 * correlation:
 *   highActivityThreshold: 1000
 *   sharedIpEventThreshold: 500
 *   sharedIpUserThreshold: 10
 * blacklists:
 *   applications: blacklists/Application-Blacklist.csv
 *   countries: blacklists/Country-Blacklist.csv
 *   userAgents: blacklists/UserAgent-Blacklist.csv
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading. Instances are mutable only while
 * SnakeYAML populates them and are treated as read-only afterwards.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisConfig {

    private String source = "entra_audit_logs";
    private String timeZone = "";
    private BusinessHours businessHours = new BusinessHours();
    private BruteForce bruteForce = new BruteForce();
    private Correlation correlation = new Correlation();
    private BlacklistSources blacklists = new BlacklistSources();

    /**
     * @return configuration with every default applied
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig();
    }

    /**
     * Resolve the zone used for after-hours and weekend checks.
     *
     * @return configured zone, or the host default when blank
     */
    public ZoneId resolveZone() {
        return timeZone == null || timeZone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(timeZone.trim());
    }

    /**
     * Validate every setting, collecting all errors into one exception.
     *
     * @throws IllegalStateException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (source == null || source.isBlank()) {
            errors.add("source must not be blank");
        }
        if (timeZone != null && !timeZone.isBlank()) {
            try {
                ZoneId.of(timeZone.trim());
            } catch (DateTimeException e) {
                errors.add("timeZone is not a valid zone id: '" + timeZone + "'");
            }
        }
        if (businessHours == null || bruteForce == null || correlation == null || blacklists == null) {
            errors.add("businessHours, bruteForce, correlation and blacklists sections must not be null");
        } else {
            businessHours.validate(errors);
            bruteForce.validate(errors);
            correlation.validate(errors);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Analysis configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required by SnakeYAML)
    // ---------------------------------------------------------------

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    public BusinessHours getBusinessHours() {
        return businessHours;
    }

    public void setBusinessHours(BusinessHours businessHours) {
        this.businessHours = businessHours;
    }

    public BruteForce getBruteForce() {
        return bruteForce;
    }

    public void setBruteForce(BruteForce bruteForce) {
        this.bruteForce = bruteForce;
    }

    public Correlation getCorrelation() {
        return correlation;
    }

    public void setCorrelation(Correlation correlation) {
        this.correlation = correlation;
    }

    public BlacklistSources getBlacklists() {
        return blacklists;
    }

    public void setBlacklists(BlacklistSources blacklists) {
        this.blacklists = blacklists;
    }

    // ---------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------

    /**
     * Local hours considered normal. Activity with hour {@code < start} or
     * {@code > end} is after-hours.
     */
    public static class BusinessHours {
        private int start = 6;
        private int end = 22;

        void validate(List<String> errors) {
            if (start < 0 || start > 23) {
                errors.add("businessHours.start must be in [0, 23], got: " + start);
            }
            if (end < 0 || end > 23) {
                errors.add("businessHours.end must be in [0, 23], got: " + end);
            }
            if (start > end) {
                errors.add("businessHours.start must be <= end, got: " + start + " > " + end);
            }
        }

        public int getStart() {
            return start;
        }

        public void setStart(int start) {
            this.start = start;
        }

        public int getEnd() {
            return end;
        }

        public void setEnd(int end) {
            this.end = end;
        }
    }

    /**
     * Sliding-window failure detection. Fires when the failures of one user
     * inside the window exceed {@code failureThreshold}.
     */
    public static class BruteForce {
        private int failureThreshold = 3;
        private int windowMinutes = 60;
        private int lookbackEvents = 100;

        void validate(List<String> errors) {
            if (failureThreshold < 1) {
                errors.add("bruteForce.failureThreshold must be >= 1, got: " + failureThreshold);
            }
            if (windowMinutes < 1) {
                errors.add("bruteForce.windowMinutes must be >= 1, got: " + windowMinutes);
            }
            if (lookbackEvents < 1) {
                errors.add("bruteForce.lookbackEvents must be >= 1, got: " + lookbackEvents);
            }
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public int getWindowMinutes() {
            return windowMinutes;
        }

        public void setWindowMinutes(int windowMinutes) {
            this.windowMinutes = windowMinutes;
        }

        public int getLookbackEvents() {
            return lookbackEvents;
        }

        public void setLookbackEvents(int lookbackEvents) {
            this.lookbackEvents = lookbackEvents;
        }
    }

    /**
     * Thresholds of the cross-event pass. All comparisons are strict.
     */
    public static class Correlation {
        private int highActivityThreshold = 1000;
        private int sharedIpEventThreshold = 500;
        private int sharedIpUserThreshold = 10;

        void validate(List<String> errors) {
            if (highActivityThreshold < 1) {
                errors.add("correlation.highActivityThreshold must be >= 1, got: " + highActivityThreshold);
            }
            if (sharedIpEventThreshold < 1) {
                errors.add("correlation.sharedIpEventThreshold must be >= 1, got: " + sharedIpEventThreshold);
            }
            if (sharedIpUserThreshold < 1) {
                errors.add("correlation.sharedIpUserThreshold must be >= 1, got: " + sharedIpUserThreshold);
            }
        }

        public int getHighActivityThreshold() {
            return highActivityThreshold;
        }

        public void setHighActivityThreshold(int highActivityThreshold) {
            this.highActivityThreshold = highActivityThreshold;
        }

        public int getSharedIpEventThreshold() {
            return sharedIpEventThreshold;
        }

        public void setSharedIpEventThreshold(int sharedIpEventThreshold) {
            this.sharedIpEventThreshold = sharedIpEventThreshold;
        }

        public int getSharedIpUserThreshold() {
            return sharedIpUserThreshold;
        }

        public void setSharedIpUserThreshold(int sharedIpUserThreshold) {
            this.sharedIpUserThreshold = sharedIpUserThreshold;
        }
    }

    /**
     * Locations of the blacklist CSV files: a file system path, or a
     * classpath resource when no such file exists. Blank disables the list.
     */
    public static class BlacklistSources {
        private String applications = "blacklists/Application-Blacklist.csv";
        private String countries = "blacklists/Country-Blacklist.csv";
        private String userAgents = "blacklists/UserAgent-Blacklist.csv";

        public String getApplications() {
            return applications;
        }

        public void setApplications(String applications) {
            this.applications = applications;
        }

        public String getCountries() {
            return countries;
        }

        public void setCountries(String countries) {
            this.countries = countries;
        }

        public String getUserAgents() {
            return userAgents;
        }

        public void setUserAgents(String userAgents) {
            this.userAgents = userAgents;
        }
    }

    @Override
    public String toString() {
        return "AnalysisConfig{" +
                "source='" + source + '\'' +
                ", timeZone='" + timeZone + '\'' +
                ", businessHours=" + businessHours.start + "-" + businessHours.end +
                ", bruteForce>" + bruteForce.failureThreshold + "/" + bruteForce.windowMinutes + "min" +
                '}';
    }
}
