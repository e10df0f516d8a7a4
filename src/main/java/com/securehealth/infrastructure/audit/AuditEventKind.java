package com.securehealth.infrastructure.audit;

/**
 * Security-relevant events emitted by the PHI subsystem.
 */
public enum AuditEventKind {
    DATA_KEY_CREATED,
    ENCRYPTION_FAILURE,
    DECRYPTION_FAILURE,
    SCHEMA_DRIFT,
    DOCUMENTATION_MODE_ENABLED,
    RECORD_VIEWED
}
