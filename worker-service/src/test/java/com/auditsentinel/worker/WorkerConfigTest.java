package com.auditsentinel.worker;

import com.auditsentinel.core.alerting.AlertContext;
import com.auditsentinel.worker.pipeline.ExtractionOutputDataSource;
import com.auditsentinel.worker.scheduler.OrphanPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerConfigTest {

    @Test
    @DisplayName("Should fall back to defaults when nothing is set")
    void shouldApplyDefaults() {
        WorkerConfig config = WorkerConfig.fromEnvironment(name -> null);

        assertThat(config.getWorkerCount()).isEqualTo(WorkerConfig.defaultWorkerCount()).isPositive();
        assertThat(config.getDispatchBackoff()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.getOrphanPolicy()).isEqualTo(OrphanPolicy.FAIL);
        assertThat(config.getApiBaseUrl()).isEqualTo("http://api:3000");
        assertThat(config.getServiceToken()).isEmpty();
        assertThat(config.getUploadTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getAlertTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.getExtractionDataDirs()).isEqualTo(ExtractionOutputDataSource.DEFAULT_BASE_DIRECTORIES);
        assertThat(config.getDefaultOrganizationId()).isEqualTo(AlertContext.DEFAULT_ORGANIZATION_ID);
        assertThat(config.getExtractionStageDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.getJobRetentionDays()).isEqualTo(30);
        assertThat(config.getHttpPort()).isEqualTo(8080);
        assertThat(config.getStatusLogInterval()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("Should read every variable from the environment")
    void shouldReadEnvironment() {
        Map<String, String> env = new HashMap<>();
        env.put("MAX_WORKERS", "4");
        env.put("DISPATCH_BACKOFF_MS", "250");
        env.put("ORPHAN_POLICY", "abandon");
        env.put("API_BASE_URL", "http://localhost:3000");
        env.put("SERVICE_AUTH_TOKEN", " secret ");
        env.put("EXTRACTION_DATA_DIRS", "/data/a, /data/b,");
        env.put("DEFAULT_ORGANIZATION_ID", "org-9");
        env.put("ANALYSIS_CONFIG_PATH", "/etc/audit/analysis.yml");
        env.put("EXTRACTION_STAGE_DELAY_MS", "0");
        env.put("JOB_RETENTION_DAYS", "7");
        env.put("HTTP_PORT", "9090");

        WorkerConfig config = WorkerConfig.fromEnvironment(env::get);

        assertThat(config.getWorkerCount()).isEqualTo(4);
        assertThat(config.getDispatchBackoff()).isEqualTo(Duration.ofMillis(250));
        assertThat(config.getOrphanPolicy()).isEqualTo(OrphanPolicy.ABANDON);
        assertThat(config.getApiBaseUrl()).isEqualTo("http://localhost:3000");
        assertThat(config.getServiceToken()).isEqualTo("secret");
        assertThat(config.getExtractionDataDirs()).containsExactly(Path.of("/data/a"), Path.of("/data/b"));
        assertThat(config.getDefaultOrganizationId()).isEqualTo("org-9");
        assertThat(config.getAnalysisConfigPath()).isEqualTo("/etc/audit/analysis.yml");
        assertThat(config.getExtractionStageDelay()).isZero();
        assertThat(config.getJobRetentionDays()).isEqualTo(7);
        assertThat(config.getHttpPort()).isEqualTo(9090);
    }

    @Test
    @DisplayName("Should report an unparsable number as a configuration error")
    void shouldRejectUnparsableNumbers() {
        assertThatThrownBy(() -> WorkerConfig.fromEnvironment(Map.of("MAX_WORKERS", "many")::get))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("many");
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldValidateRanges() {
        assertThatThrownBy(() -> new WorkerConfig.Builder().workerCount(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("workerCount");
        assertThatThrownBy(() -> new WorkerConfig.Builder().httpPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("httpPort");
        assertThatThrownBy(() -> new WorkerConfig.Builder().dispatchBackoffMs(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WorkerConfig.Builder().extractionStageDelayMs(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WorkerConfig.Builder().apiBaseUrl(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("apiBaseUrl");
    }

    @Test
    @DisplayName("Should never print the service token")
    void shouldMaskToken() {
        WorkerConfig config = new WorkerConfig.Builder().serviceToken("super-secret").build();

        assertThat(config.toString()).contains("serviceToken=<set>").doesNotContain("super-secret");
    }
}
