package com.securehealth.infrastructure.audit;

import java.util.Map;

/**
 * Audit sink for security-relevant events.
 * Metadata values must never contain plaintext PHI or key material.
 */
public interface AuditService {
    void record(AuditEventKind kind, String actor, Map<String, String> metadata);
}
