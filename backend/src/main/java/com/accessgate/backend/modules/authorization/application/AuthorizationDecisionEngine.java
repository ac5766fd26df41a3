package com.accessgate.backend.modules.authorization.application;

import java.util.Collection;
import java.util.UUID;

import com.accessgate.backend.global.error.ProblemException;
import com.accessgate.backend.modules.auth.application.JwtTokenService;
import com.accessgate.backend.modules.auth.application.JwtTokenService.VerifiedToken;
import com.accessgate.backend.modules.auth.domain.TokenType;
import com.accessgate.backend.modules.authorization.domain.ActionResolution;
import com.accessgate.backend.modules.authorization.domain.AuthenticatedPrincipal;
import com.accessgate.backend.modules.principal.domain.Principal;
import com.accessgate.backend.modules.principal.infrastructure.persistence.PrincipalRepository;
import com.accessgate.backend.modules.role.application.RolePermissionGraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Two independent request checks: {@link #authenticate} turns a bearer token into a principal and fails with 401,
 * {@link #authorize} decides whether that principal's roles grant the request's action and fails with 403.
 * Token failures are never turned into a 403.
 */
@Service
public class AuthorizationDecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationDecisionEngine.class);

    private final JwtTokenService tokenService;
    private final RouteActionResolver routeActionResolver;
    private final RolePermissionGraph rolePermissionGraph;
    private final PrincipalRepository principalRepository;

    public AuthorizationDecisionEngine(
            JwtTokenService tokenService,
            RouteActionResolver routeActionResolver,
            RolePermissionGraph rolePermissionGraph,
            PrincipalRepository principalRepository
    ) {
        this.tokenService = tokenService;
        this.routeActionResolver = routeActionResolver;
        this.rolePermissionGraph = rolePermissionGraph;
        this.principalRepository = principalRepository;
    }

    public AuthenticatedPrincipal authenticate(String accessToken) {
        VerifiedToken verified = tokenService.verify(accessToken, TokenType.ACCESS);
        return new AuthenticatedPrincipal(verified.principalId(), verified.email(), verified.roles());
    }

    /**
     * @throws ProblemException 403 when none of the principal's roles grants the resolved action
     */
    public ActionResolution authorize(AuthenticatedPrincipal principal, String method, String path, String routeTemplate) {
        ActionResolution resolution = routeActionResolver.resolve(method, path, routeTemplate);
        if (!isAuthorized(principal.roles(), method, resolution.action())) {
            log.warn("Denied {} {} for principal {} (action={}, source={})",
                    method, path, principal.principalId(), resolution.action(), resolution.source());
            throw ProblemException.forbidden("FORBIDDEN", "Insufficient permissions for action " + resolution.action());
        }
        log.debug("Allowed {} {} for principal {} (action={})", method, path, principal.principalId(), resolution.action());
        return resolution;
    }

    public boolean isAuthorized(Collection<String> roleNames, String method, String action) {
        return rolePermissionGraph.isAuthorized(roleNames, method, action);
    }

    /**
     * Checks an arbitrary principal against its current role assignments rather than the roles of any token.
     */
    @Transactional(readOnly = true)
    public boolean validateUserPermission(UUID principalId, String method, String action) {
        return principalRepository.findWithRolesByExternalId(principalId)
                .filter(Principal::isActive)
                .map(principal -> isAuthorized(principal.roleNames(), method, action))
                .orElse(false);
    }
}
