package com.accessgate.backend.global.security;

import java.util.UUID;

import com.accessgate.backend.global.error.ProblemException;
import com.accessgate.backend.modules.authorization.domain.AuthenticatedPrincipal;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static AuthenticatedPrincipal getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof AuthenticatedPrincipal principal)) {
            throw ProblemException.unauthorized("UNAUTHORIZED", "Authentication required");
        }
        return principal;
    }

    public static UUID getCurrentPrincipalId() {
        return getCurrentPrincipal().principalId();
    }

    public static boolean hasRole(String roleName) {
        return getCurrentPrincipal().roles().contains(roleName);
    }
}
