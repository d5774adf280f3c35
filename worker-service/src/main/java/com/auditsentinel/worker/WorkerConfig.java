package com.auditsentinel.worker;

import com.auditsentinel.core.alerting.AlertContext;
import com.auditsentinel.core.config.AnalysisConfigLoader;
import com.auditsentinel.worker.pipeline.ExtractionOutputDataSource;
import com.auditsentinel.worker.scheduler.OrphanPolicy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Typed, immutable configuration of the worker service.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults,
 * so the service is configured through container env vars or a shell
 * environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class WorkerConfig {

    // ---------------------------------------------------------------
    // Worker pool
    // ---------------------------------------------------------------
    private final int workerCount;
    private final long dispatchBackoffMs;
    private final OrphanPolicy orphanPolicy;

    // ---------------------------------------------------------------
    // Collaborators
    // ---------------------------------------------------------------
    private final String apiBaseUrl;
    private final String serviceToken;
    private final long uploadTimeoutMs;
    private final long alertTimeoutMs;
    private final List<Path> extractionDataDirs;
    private final String defaultOrganizationId;

    // ---------------------------------------------------------------
    // Tasks
    // ---------------------------------------------------------------
    private final String analysisConfigPath;
    private final long extractionStageDelayMs;
    private final int jobRetentionDays;

    // ---------------------------------------------------------------
    // Status surface
    // ---------------------------------------------------------------
    private final int httpPort;
    private final long statusLogIntervalMs;

    private WorkerConfig(Builder b) {
        this.workerCount = b.workerCount;
        this.dispatchBackoffMs = b.dispatchBackoffMs;
        this.orphanPolicy = b.orphanPolicy;
        this.apiBaseUrl = b.apiBaseUrl;
        this.serviceToken = b.serviceToken;
        this.uploadTimeoutMs = b.uploadTimeoutMs;
        this.alertTimeoutMs = b.alertTimeoutMs;
        this.extractionDataDirs = List.copyOf(b.extractionDataDirs);
        this.defaultOrganizationId = b.defaultOrganizationId;
        this.analysisConfigPath = b.analysisConfigPath;
        this.extractionStageDelayMs = b.extractionStageDelayMs;
        this.jobRetentionDays = b.jobRetentionDays;
        this.httpPort = b.httpPort;
        this.statusLogIntervalMs = b.statusLogIntervalMs;
    }

    // ---------------------------------------------------------------
    // Factory – resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link WorkerConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static WorkerConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Build a {@link WorkerConfig} from an arbitrary variable lookup.
     *
     * @param env variable name to value, {@code null} when unset
     * @return fully populated configuration
     * @throws IllegalStateException    if a value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static WorkerConfig fromEnvironment(Function<String, String> env) {
        Objects.requireNonNull(env, "env must not be null");
        try {
            return new Builder()
                    .workerCount(parseInt(env, "MAX_WORKERS", Integer.toString(defaultWorkerCount())))
                    .dispatchBackoffMs(parseLong(env, "DISPATCH_BACKOFF_MS", "1000"))
                    .orphanPolicy(OrphanPolicy.fromString(value(env, "ORPHAN_POLICY", "FAIL")))
                    .apiBaseUrl(value(env, "API_BASE_URL", "http://api:3000"))
                    .serviceToken(value(env, "SERVICE_AUTH_TOKEN", ""))
                    .uploadTimeoutMs(parseLong(env, "UPLOAD_TIMEOUT_MS", "30000"))
                    .alertTimeoutMs(parseLong(env, "ALERT_TIMEOUT_MS", "10000"))
                    .extractionDataDirs(parsePaths(value(env, "EXTRACTION_DATA_DIRS", "")))
                    .defaultOrganizationId(value(env, "DEFAULT_ORGANIZATION_ID", AlertContext.DEFAULT_ORGANIZATION_ID))
                    .analysisConfigPath(value(env, AnalysisConfigLoader.ENV_CONFIG_PATH, ""))
                    .extractionStageDelayMs(parseLong(env, "EXTRACTION_STAGE_DELAY_MS", "1000"))
                    .jobRetentionDays(parseInt(env, "JOB_RETENTION_DAYS", "30"))
                    .httpPort(parseInt(env, "HTTP_PORT", "8080"))
                    .statusLogIntervalMs(parseLong(env, "STATUS_LOG_INTERVAL_MS", "30000"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * @return available processors minus one, at least one
     */
    public static int defaultWorkerCount() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getWorkerCount() {
        return workerCount;
    }

    public Duration getDispatchBackoff() {
        return Duration.ofMillis(dispatchBackoffMs);
    }

    public OrphanPolicy getOrphanPolicy() {
        return orphanPolicy;
    }

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public String getServiceToken() {
        return serviceToken;
    }

    public Duration getUploadTimeout() {
        return Duration.ofMillis(uploadTimeoutMs);
    }

    public Duration getAlertTimeout() {
        return Duration.ofMillis(alertTimeoutMs);
    }

    public List<Path> getExtractionDataDirs() {
        return extractionDataDirs;
    }

    public String getDefaultOrganizationId() {
        return defaultOrganizationId;
    }

    public String getAnalysisConfigPath() {
        return analysisConfigPath;
    }

    public Duration getExtractionStageDelay() {
        return Duration.ofMillis(extractionStageDelayMs);
    }

    public int getJobRetentionDays() {
        return jobRetentionDays;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public Duration getStatusLogInterval() {
        return Duration.ofMillis(statusLogIntervalMs);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link WorkerConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (worker count &gt; 0, positive intervals and timeouts, port in
     * [1, 65535], non-blank API base URL and organization id).
     * </p>
     */
    public static class Builder {
        private int workerCount = defaultWorkerCount();
        private long dispatchBackoffMs = 1_000;
        private OrphanPolicy orphanPolicy = OrphanPolicy.FAIL;
        private String apiBaseUrl = "http://api:3000";
        private String serviceToken = "";
        private long uploadTimeoutMs = 30_000;
        private long alertTimeoutMs = 10_000;
        private List<Path> extractionDataDirs = ExtractionOutputDataSource.DEFAULT_BASE_DIRECTORIES;
        private String defaultOrganizationId = AlertContext.DEFAULT_ORGANIZATION_ID;
        private String analysisConfigPath = "";
        private long extractionStageDelayMs = 1_000;
        private int jobRetentionDays = 30;
        private int httpPort = 8080;
        private long statusLogIntervalMs = 30_000;

        public Builder workerCount(int v) {
            this.workerCount = v;
            return this;
        }

        public Builder dispatchBackoffMs(long v) {
            this.dispatchBackoffMs = v;
            return this;
        }

        public Builder orphanPolicy(OrphanPolicy v) {
            this.orphanPolicy = v;
            return this;
        }

        public Builder apiBaseUrl(String v) {
            this.apiBaseUrl = v;
            return this;
        }

        public Builder serviceToken(String v) {
            this.serviceToken = v;
            return this;
        }

        public Builder uploadTimeoutMs(long v) {
            this.uploadTimeoutMs = v;
            return this;
        }

        public Builder alertTimeoutMs(long v) {
            this.alertTimeoutMs = v;
            return this;
        }

        /**
         * @param v base directories; an empty list selects the defaults
         */
        public Builder extractionDataDirs(List<Path> v) {
            this.extractionDataDirs = v == null || v.isEmpty()
                    ? ExtractionOutputDataSource.DEFAULT_BASE_DIRECTORIES
                    : v;
            return this;
        }

        public Builder defaultOrganizationId(String v) {
            this.defaultOrganizationId = v;
            return this;
        }

        public Builder analysisConfigPath(String v) {
            this.analysisConfigPath = v;
            return this;
        }

        public Builder extractionStageDelayMs(long v) {
            this.extractionStageDelayMs = v;
            return this;
        }

        public Builder jobRetentionDays(int v) {
            this.jobRetentionDays = v;
            return this;
        }

        public Builder httpPort(int v) {
            this.httpPort = v;
            return this;
        }

        public Builder statusLogIntervalMs(long v) {
            this.statusLogIntervalMs = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link WorkerConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public WorkerConfig build() {
            Objects.requireNonNull(orphanPolicy, "orphanPolicy required");
            requireNonBlank(apiBaseUrl, "apiBaseUrl");
            requireNonBlank(defaultOrganizationId, "defaultOrganizationId");

            if (workerCount < 1) {
                throw new IllegalArgumentException("workerCount must be >= 1, got: " + workerCount);
            }
            requirePositive(dispatchBackoffMs, "dispatchBackoffMs");
            requirePositive(uploadTimeoutMs, "uploadTimeoutMs");
            requirePositive(alertTimeoutMs, "alertTimeoutMs");
            requirePositive(statusLogIntervalMs, "statusLogIntervalMs");
            requirePositive(jobRetentionDays, "jobRetentionDays");
            if (extractionStageDelayMs < 0) {
                throw new IllegalArgumentException(
                        "extractionStageDelayMs must be >= 0, got: " + extractionStageDelayMs);
            }
            if (httpPort < 1 || httpPort > 65_535) {
                throw new IllegalArgumentException(
                        "httpPort must be in [1, 65535], got: " + httpPort);
            }

            return new WorkerConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }

        private static void requirePositive(long value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(Function<String, String> env, String name, String defaultValue) {
        String value = env.apply(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static int parseInt(Function<String, String> env, String name, String defaultValue) {
        return Integer.parseInt(value(env, name, defaultValue));
    }

    private static long parseLong(Function<String, String> env, String name, String defaultValue) {
        return Long.parseLong(value(env, name, defaultValue));
    }

    private static List<Path> parsePaths(String value) {
        if (value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Path::of)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "WorkerConfig{" +
                "workerCount=" + workerCount +
                ", dispatchBackoffMs=" + dispatchBackoffMs +
                ", orphanPolicy=" + orphanPolicy +
                ", apiBaseUrl='" + apiBaseUrl + '\'' +
                ", serviceToken=" + (serviceToken == null || serviceToken.isBlank() ? "<unset>" : "<set>") +
                ", uploadTimeoutMs=" + uploadTimeoutMs +
                ", alertTimeoutMs=" + alertTimeoutMs +
                ", extractionDataDirs=" + extractionDataDirs +
                ", analysisConfigPath='" + analysisConfigPath + '\'' +
                ", extractionStageDelayMs=" + extractionStageDelayMs +
                ", jobRetentionDays=" + jobRetentionDays +
                ", httpPort=" + httpPort +
                ", statusLogIntervalMs=" + statusLogIntervalMs +
                '}';
    }
}
