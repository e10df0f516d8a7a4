package com.securehealth.application;

import com.securehealth.infrastructure.security.CallerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CallerContextProviderTest {

    private final CallerContextProvider provider = new CallerContextProvider();

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void buildsCallerFromAuthenticatedPrincipal() {
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
            "dr-house", "n/a", AuthorityUtils.createAuthorityList("ROLE_DOCTOR", "ROLE_ADMIN")));

        CallerContext caller = provider.getCurrentCaller();

        assertEquals("dr-house", caller.getPrincipalId());
        assertEquals(Set.of("ROLE_DOCTOR", "ROLE_ADMIN"), caller.getRoles());
        assertNotNull(caller.getRequestId());
        assertNotNull(caller.getRequestedAt());
    }

    @Test
    void rejectsMissingAuthentication() {
        assertThrows(SecurityException.class, provider::getCurrentCaller);
    }

    @Test
    void rejectsUnauthenticatedToken() {
        SecurityContextHolder.getContext().setAuthentication(
            new UsernamePasswordAuthenticationToken("anonymous", "n/a"));

        assertThrows(SecurityException.class, provider::getCurrentCaller);
    }
}
