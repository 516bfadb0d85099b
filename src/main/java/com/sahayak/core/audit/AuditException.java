package com.sahayak.core.audit;

/**
 * Thrown when the audit store cannot persist or update a record.
 */
public class AuditException extends RuntimeException {

    public AuditException(String message) {
        super(message);
    }

    public AuditException(String message, Throwable cause) {
        super(message, cause);
    }
}
