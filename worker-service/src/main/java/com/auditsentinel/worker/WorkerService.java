package com.auditsentinel.worker;

import com.auditsentinel.core.alerting.AlertEmitter;
import com.auditsentinel.core.analysis.AnalysisEngine;
import com.auditsentinel.core.config.AnalysisConfig;
import com.auditsentinel.core.config.AnalysisConfigLoader;
import com.auditsentinel.core.config.BlacklistLoader;
import com.auditsentinel.core.config.Blacklists;
import com.auditsentinel.worker.pipeline.AnalysisTaskHandler;
import com.auditsentinel.worker.pipeline.AuditDataSource;
import com.auditsentinel.worker.pipeline.ExtractionOutputDataSource;
import com.auditsentinel.worker.pipeline.ExtractionTaskHandler;
import com.auditsentinel.worker.pipeline.FallbackAuditDataSource;
import com.auditsentinel.worker.pipeline.HttpAlertSink;
import com.auditsentinel.worker.pipeline.UploadedDataSource;
import com.auditsentinel.worker.scheduler.MessageCodec;
import com.auditsentinel.worker.scheduler.SchedulerMetrics;
import com.auditsentinel.worker.scheduler.SchedulerStatus;
import com.auditsentinel.worker.scheduler.TaskHandler;
import com.auditsentinel.worker.scheduler.TaskScheduler;
import com.auditsentinel.worker.scheduler.ThreadWorkerUnit;
import com.auditsentinel.worker.store.InMemoryJobStore;
import com.auditsentinel.worker.store.JobStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for the Audit Sentinel worker service.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   POST /tasks
 *     → JobStore (queued)
 *     → TaskScheduler (priority queue)
 *     → ThreadWorkerUnit (one task per unit)
 *         analysis:   upload API / extractor files → AnalysisEngine → alerts API
 *         extraction: staged progress
 *     → JobStore (progress, completed | failed)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Service settings are resolved from environment variables via
 * {@link WorkerConfig}; analysis settings come from
 * {@link AnalysisConfigLoader}.
 * </p>
 *
 * <h3>Maintenance</h3>
 * <p>
 * A background thread logs the scheduler status at a fixed interval and
 * purges terminal task records older than the retention period every hour.
 * </p>
 *
 * @since 1.0.0
 */
public final class WorkerService {

    private static final Logger LOG = LoggerFactory.getLogger(WorkerService.class);

    private static final Duration PURGE_INTERVAL = Duration.ofHours(1);

    private final WorkerConfig config;
    private final JobStore jobStore;
    private final TaskScheduler scheduler;
    private final StatusServer statusServer;
    private final Clock clock;
    private final ScheduledExecutorService maintenance;

    WorkerService(WorkerConfig config, JobStore jobStore, TaskScheduler scheduler,
            StatusServer statusServer, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.statusServer = Objects.requireNonNull(statusServer, "statusServer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.maintenance = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "worker-maintenance");
            t.setDaemon(true);
            return t;
        });
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        WorkerConfig config = WorkerConfig.fromEnvironment();
        LOG.info("Starting Audit Sentinel worker service with config: {}", config);

        // 2. Assemble and start
        WorkerService service = create(config);
        Runtime.getRuntime().addShutdownHook(new Thread(service::stop, "worker-shutdown"));
        service.start();

        // 3. Keep the main thread alive; units and servers run on daemon threads
        Thread.currentThread().join();
    }

    // ---------------------------------------------------------------
    // Assembly
    // ---------------------------------------------------------------

    /**
     * Wire the scheduler, handlers and collaborators for a configuration.
     *
     * @param config service settings
     * @return a service ready to {@link #start()}
     */
    public static WorkerService create(WorkerConfig config) {
        AnalysisConfig analysisConfig = AnalysisConfigLoader.load(config.getAnalysisConfigPath());
        Blacklists blacklists = BlacklistLoader.load(analysisConfig.getBlacklists());

        ObjectMapper mapper = MessageCodec.newObjectMapper();
        MessageCodec codec = new MessageCodec(mapper);
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(config.getUploadTimeout())
                .build();

        JobStore jobStore = new InMemoryJobStore();
        SchedulerMetrics metrics = new SchedulerMetrics(new SimpleMeterRegistry());

        TaskScheduler scheduler = TaskScheduler.builder()
                .poolSize(config.getWorkerCount())
                .dispatchBackoff(config.getDispatchBackoff())
                .orphanPolicy(config.getOrphanPolicy())
                .unitFactory(ThreadWorkerUnit.factory(
                        () -> handlers(config, analysisConfig, blacklists, http, mapper), codec))
                .jobStore(jobStore)
                .codec(codec)
                .metrics(metrics)
                .build();

        StatusServer statusServer = new StatusServer(scheduler, jobStore, mapper);
        return new WorkerService(config, jobStore, scheduler, statusServer, Clock.systemUTC());
    }

    /**
     * Fresh handler instances for one unit.
     */
    static List<TaskHandler> handlers(WorkerConfig config, AnalysisConfig analysisConfig,
            Blacklists blacklists, HttpClient http, ObjectMapper mapper) {
        AuditDataSource dataSource = new FallbackAuditDataSource(List.of(
                new UploadedDataSource(http, config.getApiBaseUrl(), config.getServiceToken(),
                        config.getUploadTimeout(), mapper),
                new ExtractionOutputDataSource(config.getExtractionDataDirs(), mapper)));
        AlertEmitter alertEmitter = new AlertEmitter(new HttpAlertSink(http, config.getApiBaseUrl(),
                config.getServiceToken(), config.getAlertTimeout(), mapper));

        return List.of(
                new AnalysisTaskHandler(new AnalysisEngine(analysisConfig, blacklists), dataSource,
                        alertEmitter, config.getDefaultOrganizationId()),
                new ExtractionTaskHandler(config.getExtractionStageDelay()));
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start the scheduler, the status server and the maintenance jobs.
     */
    public void start() {
        scheduler.start();
        statusServer.start(config.getHttpPort());

        long statusMs = config.getStatusLogInterval().toMillis();
        maintenance.scheduleAtFixedRate(this::logStatus, statusMs, statusMs, TimeUnit.MILLISECONDS);
        maintenance.scheduleAtFixedRate(this::purgeExpiredRecords,
                PURGE_INTERVAL.toMillis(), PURGE_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Worker service started");
    }

    /**
     * Stop everything. In-flight tasks are abandoned.
     */
    public void stop() {
        LOG.info("Shutting down worker service");
        maintenance.shutdownNow();
        statusServer.stop();
        scheduler.shutdown();
    }

    void logStatus() {
        try {
            SchedulerStatus status = scheduler.status();
            LOG.info("Scheduler status: {} | {}", status, scheduler.getMetrics());
        } catch (RuntimeException e) {
            LOG.warn("Failed to collect scheduler status: {}", e.getMessage(), e);
        }
    }

    int purgeExpiredRecords() {
        try {
            return jobStore.purgeTerminalBefore(clock.instant().minus(Duration.ofDays(config.getJobRetentionDays())));
        } catch (RuntimeException e) {
            LOG.error("Failed to purge expired task records: {}", e.getMessage(), e);
            return 0;
        }
    }

    TaskScheduler getScheduler() {
        return scheduler;
    }
}
