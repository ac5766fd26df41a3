package com.accessgate.backend.modules.authorization.application;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import com.accessgate.backend.modules.authorization.domain.ActionNamingConvention;
import com.accessgate.backend.modules.authorization.domain.ActionResolution;
import com.accessgate.backend.modules.permission.application.PermissionCatalog;
import com.accessgate.backend.modules.permission.domain.RoutePaths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps an inbound request to an action: catalog lookups over a few spellings of the path first,
 * then {@link ActionNamingConvention}. Always produces an action.
 */
@Component
public class RouteActionResolver {

    private static final Logger log = LoggerFactory.getLogger(RouteActionResolver.class);

    private final PermissionCatalog permissionCatalog;

    public RouteActionResolver(PermissionCatalog permissionCatalog) {
        this.permissionCatalog = permissionCatalog;
    }

    public ActionResolution resolve(String method, String requestPath) {
        return resolve(method, requestPath, null);
    }

    /**
     * @param requestPath   concrete request path, with or without the version prefix
     * @param routeTemplate matched route template in {@code :param} form, if the framework exposes one
     */
    public ActionResolution resolve(String method, String requestPath, String routeTemplate) {
        String normalized = RoutePaths.stripVersionPrefix(RoutePaths.normalize(requestPath));

        for (String candidate : candidatePaths(normalized, routeTemplate)) {
            Optional<String> action = permissionCatalog.resolveAction(method, candidate);
            if (action.isPresent()) {
                return ActionResolution.fromCatalog(action.get());
            }
        }

        String inferred = ActionNamingConvention.infer(method, normalized);
        log.debug("No catalog entry for {} {}, using convention action {}", method, normalized, inferred);
        return ActionResolution.fromConvention(inferred);
    }

    static Set<String> candidatePaths(String normalizedPath, String routeTemplate) {
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(normalizedPath);
        if (routeTemplate != null && !routeTemplate.isBlank()) {
            candidates.add(RoutePaths.stripVersionPrefix(RoutePaths.normalize(routeTemplate)));
        }
        if (normalizedPath.startsWith("/") && normalizedPath.length() > 1) {
            candidates.add(normalizedPath.substring(1));
        }
        return candidates;
    }
}
