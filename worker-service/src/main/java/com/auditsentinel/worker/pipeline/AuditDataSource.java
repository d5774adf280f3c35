package com.auditsentinel.worker.pipeline;

import com.auditsentinel.core.model.AuditRecord;

import java.util.List;

/**
 * Supplies the raw audit records collected by one extraction.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AuditDataSource {

    /**
     * @param extractionId extraction identifier
     * @return records in source order, possibly empty
     * @throws AuditDataException if this source has no data for the extraction
     */
    List<AuditRecord> load(String extractionId) throws AuditDataException;
}
