package com.accessgate.backend.modules.authorization.domain;

import java.util.List;
import java.util.UUID;

/**
 * Identity and roles taken from a verified access token.
 */
public record AuthenticatedPrincipal(UUID principalId, String email, List<String> roles) {

    public AuthenticatedPrincipal {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }
}
