package com.auditsentinel.worker.pipeline;

import com.auditsentinel.core.model.AuditRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Tries a list of sources in order and returns the first one's data.
 *
 * @since 1.0.0
 */
public class FallbackAuditDataSource implements AuditDataSource {

    private static final Logger LOG = LoggerFactory.getLogger(FallbackAuditDataSource.class);

    private final List<AuditDataSource> sources;

    public FallbackAuditDataSource(List<AuditDataSource> sources) {
        this.sources = List.copyOf(Objects.requireNonNull(sources, "sources must not be null"));
        if (this.sources.isEmpty()) {
            throw new IllegalArgumentException("At least one audit data source is required");
        }
    }

    /**
     * @throws AuditDataException the last source's failure, when every source fails
     */
    @Override
    public List<AuditRecord> load(String extractionId) throws AuditDataException {
        AuditDataException last = null;
        for (AuditDataSource source : sources) {
            try {
                return source.load(extractionId);
            } catch (AuditDataException e) {
                LOG.info("No data for extraction {} from {}: {}", extractionId,
                        source.getClass().getSimpleName(), e.getMessage());
                last = e;
            }
        }
        throw last;
    }
}
