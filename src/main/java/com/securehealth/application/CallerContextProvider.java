package com.securehealth.application;

import com.securehealth.infrastructure.security.CallerContext;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;

/**
 * Provider for the current caller from Spring Security.
 *
 * Extracts the principal and granted authorities from Spring Security's
 * SecurityContextHolder and converts them to our CallerContext.
 */
@Component
public class CallerContextProvider {

    /**
     * @throws SecurityException if no authenticated caller is present
     */
    public CallerContext getCurrentCaller() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            throw new SecurityException("No authenticated user");
        }

        return fromAuthentication(authentication);
    }

    public static CallerContext fromAuthentication(Authentication authentication) {
        CallerContext.CallerContextBuilder builder = CallerContext.builder()
            .requestId(UUID.randomUUID())
            .principalId(authentication.getName())
            .requestedAt(Instant.now());
        for (GrantedAuthority authority : authentication.getAuthorities()) {
            builder.role(authority.getAuthority());
        }
        return builder.build();
    }
}
