package com.auditsentinel.worker.pipeline;

/**
 * Raised when the audit records of an extraction cannot be loaded.
 *
 * @since 1.0.0
 */
public class AuditDataException extends Exception {

    private static final long serialVersionUID = 1L;

    public AuditDataException(String message) {
        super(message);
    }

    public AuditDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
