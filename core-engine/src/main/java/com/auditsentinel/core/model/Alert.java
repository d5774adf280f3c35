package com.auditsentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Alert derived from a high or critical finding.
 *
 * <p>
 * Serialized to JSON and posted to the alerting API. Carries the finding's
 * evidentiary payload under {@code data} together with the organization and
 * run correlation identifiers.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromFinding(Finding, String, String, String)} or the
 * {@link Builder}. {@code title}, {@code severity} and
 * {@code organizationId} are required.
 * </p>
 *
 * @since 1.0.0
 */
public class Alert {

    /** Status of every newly created alert. */
    public static final String STATUS_NEW = "new";

    private String title;
    private String description;
    private Severity severity;
    private String source;
    private String status;
    private String organizationId;
    private String analysisId;
    private String extractionId;

    /** Evidentiary payload copied from the finding. */
    private Map<String, Object> data;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public Alert() {
    }

    private Alert(Builder builder) {
        this.title = Objects.requireNonNull(builder.title, "title must not be null");
        this.description = builder.description;
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.source = builder.source;
        this.status = builder.status != null ? builder.status : STATUS_NEW;
        this.organizationId = Objects.requireNonNull(builder.organizationId, "organizationId must not be null");
        this.analysisId = builder.analysisId;
        this.extractionId = builder.extractionId;
        this.data = builder.data != null ? new LinkedHashMap<>(builder.data) : new LinkedHashMap<>();
    }

    /**
     * Build the alert for one finding.
     *
     * @param finding        the high or critical finding
     * @param organizationId owning organization
     * @param analysisId     analysis run id; may be {@code null}
     * @param extractionId   extraction the data came from; may be {@code null}
     * @return a new alert with status {@value #STATUS_NEW}
     */
    public static Alert fromFinding(Finding finding, String organizationId, String analysisId, String extractionId) {
        Objects.requireNonNull(finding, "finding must not be null");
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("finding", finding);
        data.put("timestamp", finding.getTimestamp());
        data.put("affectedEntities", finding.getAffectedEntities());
        data.put("evidence", finding.getEvidence());
        data.put("mitreAttack", finding.getMitreMapping());
        data.put("recommendations", finding.getRecommendations());

        return builder()
                .title(finding.getTitle())
                .description(finding.getDescription())
                .severity(finding.getSeverity())
                .source(finding.getSource())
                .organizationId(organizationId)
                .analysisId(analysisId)
                .extractionId(extractionId)
                .data(data)
                .build();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String title;
        private String description;
        private Severity severity;
        private String source;
        private String status;
        private String organizationId;
        private String analysisId;
        private String extractionId;
        private Map<String, Object> data;

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder analysisId(String analysisId) {
            this.analysisId = analysisId;
            return this;
        }

        public Builder extractionId(String extractionId) {
            this.extractionId = extractionId;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        /**
         * @return a new {@link Alert}
         * @throws NullPointerException if {@code title}, {@code severity} or
         *                              {@code organizationId} is {@code null}
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(String organizationId) {
        this.organizationId = organizationId;
    }

    public String getAnalysisId() {
        return analysisId;
    }

    public void setAnalysisId(String analysisId) {
        this.analysisId = analysisId;
    }

    public String getExtractionId() {
        return extractionId;
    }

    public void setExtractionId(String extractionId) {
        this.extractionId = extractionId;
    }

    /**
     * @return unmodifiable view of the payload, or {@code null} if not set
     */
    public Map<String, Object> getData() {
        return data != null ? Collections.unmodifiableMap(data) : null;
    }

    public void setData(Map<String, Object> data) {
        this.data = data != null ? new LinkedHashMap<>(data) : null;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Objects.equals(title, alert.title)
                && severity == alert.severity
                && Objects.equals(analysisId, alert.analysisId)
                && Objects.equals(data, alert.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, severity, analysisId);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "title='" + title + '\'' +
                ", severity=" + severity +
                ", organizationId='" + organizationId + '\'' +
                ", analysisId='" + analysisId + '\'' +
                '}';
    }
}
