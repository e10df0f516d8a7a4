package com.securehealth.infrastructure.audit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.TreeMap;

@Service
@Slf4j
public class DefaultAuditService implements AuditService {

    @Override
    public void record(AuditEventKind kind, String actor, Map<String, String> metadata) {
        try {
            log.info("AUDIT kind={} actor={} metadata={}", kind, actor,
                metadata == null ? Map.of() : new TreeMap<>(metadata));
        } catch (RuntimeException e) {
            log.warn("Audit event {} could not be recorded", kind, e);
        }
    }
}
