package com.auditsentinel.core.alerting;

import java.util.Objects;

/**
 * Identifiers stamped on every alert of one analysis task.
 *
 * @since 1.0.0
 */
public final class AlertContext {

    public static final String DEFAULT_ORGANIZATION_ID = "00000000-0000-0000-0000-000000000001";

    private final String organizationId;
    private final String analysisId;
    private final String extractionId;

    /**
     * @param organizationId owning organization; {@code null} or blank selects
     *                       {@link #DEFAULT_ORGANIZATION_ID}
     * @param analysisId     the analysis task id
     * @param extractionId   the extraction the data came from; may be
     *                       {@code null}
     */
    public AlertContext(String organizationId, String analysisId, String extractionId) {
        this.organizationId = organizationId == null || organizationId.isBlank()
                ? DEFAULT_ORGANIZATION_ID
                : organizationId;
        this.analysisId = Objects.requireNonNull(analysisId, "analysisId must not be null");
        this.extractionId = extractionId;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public String getAnalysisId() {
        return analysisId;
    }

    public String getExtractionId() {
        return extractionId;
    }

    @Override
    public String toString() {
        return "AlertContext{organizationId='" + organizationId + "', analysisId='" + analysisId
                + "', extractionId='" + extractionId + "'}";
    }
}
