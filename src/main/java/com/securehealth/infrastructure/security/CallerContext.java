package com.securehealth.infrastructure.security;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable identity and roles of the caller of a request.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Value
@Builder
public class CallerContext {
    UUID requestId;
    String principalId;
    @Singular
    Set<String> roles;
    Instant requestedAt;

    public boolean hasRole(String role) {
        String wanted = ViewPolicy.normalizeRole(role);
        return roles.stream().map(ViewPolicy::normalizeRole).anyMatch(wanted::equals);
    }
}
