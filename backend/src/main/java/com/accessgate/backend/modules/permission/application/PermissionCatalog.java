package com.accessgate.backend.modules.permission.application;

import java.util.Comparator;
import java.util.Optional;

import com.accessgate.backend.global.error.ProblemException;
import com.accessgate.backend.modules.permission.domain.ActionFormat;
import com.accessgate.backend.modules.permission.domain.HttpMethods;
import com.accessgate.backend.modules.permission.domain.Permission;
import com.accessgate.backend.modules.permission.domain.RoutePaths;
import com.accessgate.backend.modules.permission.domain.RoutePatternMatcher;
import com.accessgate.backend.modules.permission.infrastructure.persistence.PermissionRepository;
import com.accessgate.backend.modules.role.infrastructure.persistence.RolePermissionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Owns permission records and resolves concrete (method, path) pairs to actions.
 *
 * <p>Resolution tries an exact route match first, then every pattern registered for the method. When several
 * patterns match, the most specific one wins (literal segments before parameters, then lowest id), so the outcome
 * does not depend on insertion order.
 */
@Service
@Transactional
public class PermissionCatalog {

    private static final Logger log = LoggerFactory.getLogger(PermissionCatalog.class);
    private static final int ROUTE_MAX_LENGTH = 255;

    private static final Comparator<Permission> MOST_SPECIFIC_FIRST = Comparator
            .comparing(Permission::getRoute, RoutePatternMatcher::compareSpecificity)
            .thenComparing(Permission::getId);

    private final PermissionRepository permissionRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final ActionCache actionCache;

    public PermissionCatalog(
            PermissionRepository permissionRepository,
            RolePermissionRepository rolePermissionRepository,
            ActionCache actionCache
    ) {
        this.permissionRepository = permissionRepository;
        this.rolePermissionRepository = rolePermissionRepository;
        this.actionCache = actionCache;
    }

    @Transactional(readOnly = true)
    public Optional<String> resolveAction(String method, String path) {
        String normalizedMethod = HttpMethods.normalize(method);
        Optional<String> cached = actionCache.get(normalizedMethod, path);
        if (cached.isPresent()) {
            return cached.filter(action -> !action.isEmpty());
        }

        Optional<String> action = permissionRepository.findFirstByMethodAndRouteOrderByIdAsc(normalizedMethod, path)
                .or(() -> findByPattern(normalizedMethod, path))
                .map(Permission::getAction);

        actionCache.put(normalizedMethod, path, action.orElse(ActionCache.NO_ACTION));
        log.debug("Resolved {} {} -> {}", normalizedMethod, path, action.orElse("<none>"));
        return action;
    }

    /**
     * Idempotent registration through the public API: the route must carry the version prefix, which is stripped
     * before storage.
     */
    public Permission registerPermission(String method, String route, String action) {
        PermissionDraft draft = validatePublic(method, route, action);
        return permissionRepository.findByMethodAndRouteAndAction(draft.method(), draft.route(), draft.action())
                .orElseGet(() -> persist(draft));
    }

    /**
     * Idempotent registration for bootstrap code. Accepts routes with or without the version prefix.
     */
    public Permission registerInternalPermission(String method, String route, String action) {
        String normalizedMethod = requireMethod(method);
        if (!hasText(route)) {
            throw ProblemException.badRequest("INVALID_ROUTE", "Route is required");
        }
        requireAction(action);
        PermissionDraft draft = new PermissionDraft(normalizedMethod, storageRoute(route), action);
        return permissionRepository.findByMethodAndRouteAndAction(draft.method(), draft.route(), draft.action())
                .orElseGet(() -> persist(draft));
    }

    public Permission createOrFail(String method, String route, String action) {
        PermissionDraft draft = validatePublic(method, route, action);
        if (permissionRepository.existsByMethodAndRouteAndAction(draft.method(), draft.route(), draft.action())) {
            throw ProblemException.conflict("PERMISSION_ALREADY_EXISTS",
                    "Permission already exists with the same method, route, and action");
        }
        return persist(draft);
    }

    @Transactional(readOnly = true)
    public Permission getPermission(Long id) {
        return permissionRepository.findById(id)
                .orElseThrow(() -> ProblemException.notFound("PERMISSION_NOT_FOUND", "Permission " + id + " not found"));
    }

    @Transactional(readOnly = true)
    public Page<Permission> listPermissions(PermissionFilter filter, Pageable pageable) {
        String method = filter.method() == null ? null : HttpMethods.normalize(filter.method());
        String actionPattern = hasText(filter.action()) ? "%" + filter.action().trim() + "%" : null;
        String modulePattern = hasText(filter.module()) ? filter.module().trim() + ":%" : null;
        return permissionRepository.search(method, actionPattern, modulePattern, pageable);
    }

    public void deletePermission(Long id) {
        Permission permission = getPermission(id);
        int removedGrants = rolePermissionRepository.deleteAllGrantsOfPermission(id);
        permissionRepository.delete(permission);
        invalidateAfterCommit(permission.getMethod());
        log.info("Deleted permission id={} {} {} ({}) with {} grants",
                id, permission.getMethod(), permission.getRoute(), permission.getAction(), removedGrants);
    }

    private Optional<Permission> findByPattern(String method, String path) {
        return permissionRepository.findByMethodOrderByIdAsc(method).stream()
                .filter(permission -> RoutePatternMatcher.matches(permission.getRoute(), path))
                .min(MOST_SPECIFIC_FIRST);
    }

    private Permission persist(PermissionDraft draft) {
        Permission saved = permissionRepository.save(new Permission(draft.method(), draft.route(), draft.action()));
        invalidateAfterCommit(draft.method());
        log.info("Registered permission id={} {} {} -> {}", saved.getId(), draft.method(), draft.route(), draft.action());
        return saved;
    }

    /**
     * A reader that resolves before the commit still sees the old rows and may cache them, so the method's entries
     * are dropped only once the change is visible.
     */
    private void invalidateAfterCommit(String method) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            actionCache.invalidateMethod(method);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                actionCache.invalidateMethod(method);
            }
        });
    }

    private PermissionDraft validatePublic(String method, String route, String action) {
        String normalizedMethod = requireMethod(method);
        if (!hasText(route) || route.length() > ROUTE_MAX_LENGTH) {
            throw ProblemException.badRequest("INVALID_ROUTE", "Route is required and must be at most 255 characters");
        }
        if (!RoutePaths.hasVersionPrefix(route.trim())) {
            throw ProblemException.badRequest("INVALID_ROUTE", "Route must start with /api/v1");
        }
        requireAction(action);
        return new PermissionDraft(normalizedMethod, storageRoute(route), action);
    }

    private String requireMethod(String method) {
        if (!HttpMethods.isSupported(method)) {
            throw ProblemException.badRequest("INVALID_METHOD", "Unsupported HTTP method: " + method);
        }
        return HttpMethods.normalize(method);
    }

    private void requireAction(String action) {
        if (!ActionFormat.isValid(action)) {
            throw ProblemException.badRequest("INVALID_ACTION_FORMAT",
                    "Action must follow the format \"module:operation\" (lowercase letters)");
        }
    }

    private String storageRoute(String route) {
        return RoutePaths.stripVersionPrefix(RoutePaths.normalize(route.trim()));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private record PermissionDraft(String method, String route, String action) {
    }

    public record PermissionFilter(String method, String module, String action) {
    }
}
