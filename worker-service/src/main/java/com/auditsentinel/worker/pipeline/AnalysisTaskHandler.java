package com.auditsentinel.worker.pipeline;

import com.auditsentinel.core.alerting.AlertContext;
import com.auditsentinel.core.alerting.AlertEmitter;
import com.auditsentinel.core.analysis.AnalysisEngine;
import com.auditsentinel.core.model.AnalysisResult;
import com.auditsentinel.core.model.AuditRecord;
import com.auditsentinel.worker.scheduler.ProgressReporter;
import com.auditsentinel.worker.scheduler.Task;
import com.auditsentinel.worker.scheduler.TaskHandler;
import com.auditsentinel.worker.scheduler.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one analysis: load the extraction's records, analyze them, raise
 * alerts for the high and critical findings.
 *
 * <h3>Payload</h3>
 * <ul>
 * <li>{@code extractionId} – required; which records to analyze</li>
 * <li>{@code analysisId} – correlation id for alerts; defaults to the task id</li>
 * <li>{@code organizationId} – owner of the alerts; defaults to the
 * configured organization</li>
 * </ul>
 *
 * <h3>Result</h3>
 * <pre>
 * {success: true,
 *  results: {summary, findings, statistics, recommendations},
 *  alerts: [...]}
 * </pre>
 *
 * @since 1.0.0
 */
public class AnalysisTaskHandler implements TaskHandler {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisTaskHandler.class);

    public static final String EXTRACTION_ID = "extractionId";
    public static final String ANALYSIS_ID = "analysisId";
    public static final String ORGANIZATION_ID = "organizationId";

    private final AnalysisEngine engine;
    private final AuditDataSource dataSource;
    private final AlertEmitter alertEmitter;
    private final String defaultOrganizationId;

    public AnalysisTaskHandler(AnalysisEngine engine, AuditDataSource dataSource, AlertEmitter alertEmitter) {
        this(engine, dataSource, alertEmitter, AlertContext.DEFAULT_ORGANIZATION_ID);
    }

    public AnalysisTaskHandler(AnalysisEngine engine, AuditDataSource dataSource, AlertEmitter alertEmitter,
            String defaultOrganizationId) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.alertEmitter = Objects.requireNonNull(alertEmitter, "alertEmitter must not be null");
        this.defaultOrganizationId = Objects.requireNonNull(defaultOrganizationId,
                "defaultOrganizationId must not be null");
    }

    @Override
    public TaskKind kind() {
        return TaskKind.ANALYSIS;
    }

    @Override
    public Map<String, Object> handle(Task task, ProgressReporter progress) throws AuditDataException {
        String extractionId = task.payloadString(EXTRACTION_ID).orElseThrow(() ->
                new IllegalArgumentException("Analysis task " + task.getId() + " has no " + EXTRACTION_ID));
        String analysisId = task.payloadString(ANALYSIS_ID).orElse(task.getId());
        String organizationId = task.payloadString(ORGANIZATION_ID).orElse(defaultOrganizationId);

        progress.report(10, "Starting analysis");

        progress.report(20, "Loading extraction data");
        List<AuditRecord> records = dataSource.load(extractionId);
        LOG.info("Loaded {} audit log entries for analysis {}", records.size(), analysisId);

        progress.report(40, "Analyzing audit logs");
        AnalysisResult result = engine.analyze(records);

        progress.report(70, "Generating alerts");
        List<Map<String, Object>> alerts = alertEmitter.emit(result.getFindings(),
                new AlertContext(organizationId, analysisId, extractionId));

        progress.report(90, "Finalizing analysis");

        Map<String, Object> results = new LinkedHashMap<>();
        results.put("summary", result.getSummary());
        results.put("findings", result.getFindings());
        results.put("statistics", result.getStatistics());
        results.put("recommendations", result.getRecommendations());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", true);
        payload.put("results", results);
        payload.put("alerts", alerts);
        return payload;
    }
}
