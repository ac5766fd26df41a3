package com.accessgate.backend.modules.role.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.accessgate.backend.global.error.ProblemException;
import com.accessgate.backend.modules.permission.domain.HttpMethods;
import com.accessgate.backend.modules.permission.domain.Permission;
import com.accessgate.backend.modules.permission.infrastructure.persistence.PermissionRepository;
import com.accessgate.backend.modules.role.domain.Role;
import com.accessgate.backend.modules.role.domain.RolePermission;
import com.accessgate.backend.modules.role.infrastructure.persistence.RolePermissionRepository;
import com.accessgate.backend.modules.role.infrastructure.persistence.RoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Role to permission grants and the authorization lookups built on them.
 */
@Service
@Transactional
public class RolePermissionGraph {

    private static final Logger log = LoggerFactory.getLogger(RolePermissionGraph.class);

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final Clock clock;

    public RolePermissionGraph(
            RoleRepository roleRepository,
            PermissionRepository permissionRepository,
            RolePermissionRepository rolePermissionRepository,
            Clock clock
    ) {
        this.roleRepository = roleRepository;
        this.permissionRepository = permissionRepository;
        this.rolePermissionRepository = rolePermissionRepository;
        this.clock = clock;
    }

    /**
     * Grants the permission to the role. Granting twice, even concurrently, leaves a single grant.
     *
     * @return {@code true} when a new grant was written
     */
    public boolean grant(Long roleId, Long permissionId) {
        Role role = loadRole(roleId);
        Permission permission = loadPermission(permissionId);
        if (rolePermissionRepository.insertGrantIfAbsent(roleId, permissionId, OffsetDateTime.now(clock)) == 0) {
            return false;
        }
        log.info("Granted permission {} ({}) to role {}", permissionId, permission.getAction(), role.getName());
        return true;
    }

    public int revoke(Long roleId, Collection<Long> permissionIds) {
        Role role = loadRole(roleId);
        if (permissionIds == null || permissionIds.isEmpty()) {
            return 0;
        }
        int removed = rolePermissionRepository.deleteGrants(roleId, permissionIds);
        log.info("Revoked {} grants from role {}", removed, role.getName());
        return removed;
    }

    /**
     * Adds the given permissions to the role, first clearing every existing grant when {@code clearExisting} is set.
     * All permission ids are checked before anything is written, and the whole call runs in one transaction.
     *
     * @return number of grants written
     */
    public int replace(Long roleId, Collection<Long> permissionIds, boolean clearExisting) {
        Role role = loadRole(roleId);
        Set<Long> requested = permissionIds == null ? Set.of() : new LinkedHashSet<>(permissionIds);
        List<Permission> permissions = permissionRepository.findAllById(requested);
        if (permissions.size() != requested.size()) {
            throw ProblemException.badRequest("PERMISSION_NOT_FOUND", "One or more permissions do not exist");
        }

        if (clearExisting) {
            rolePermissionRepository.deleteAllGrants(roleId);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        int written = 0;
        for (Permission permission : permissions) {
            written += rolePermissionRepository.insertGrantIfAbsent(roleId, permission.getId(), now);
        }
        log.info("Assigned {} permissions to role {} (replace={})", written, role.getName(), clearExisting);
        return written;
    }

    @Transactional(readOnly = true)
    public boolean hasPermission(Long roleId, Long permissionId) {
        return rolePermissionRepository.existsGrant(roleId, permissionId);
    }

    @Transactional(readOnly = true)
    public Set<Permission> effectivePermissions(Collection<String> roleNames) {
        if (roleNames == null || roleNames.isEmpty()) {
            return Set.of();
        }
        return new LinkedHashSet<>(rolePermissionRepository.findEffectivePermissions(roleNames));
    }

    /**
     * An empty role set is never authorized and is answered without touching the store.
     */
    @Transactional(readOnly = true)
    public boolean isAuthorized(Collection<String> roleNames, String method, String action) {
        if (roleNames == null || roleNames.isEmpty() || action == null) {
            return false;
        }
        return rolePermissionRepository.existsAuthorized(roleNames, HttpMethods.normalize(method), action);
    }

    @Transactional(readOnly = true)
    public Page<Permission> permissionsOfRole(Long roleId, Pageable pageable) {
        loadRole(roleId);
        return rolePermissionRepository.findPermissionsOfRole(roleId, pageable);
    }

    @Transactional(readOnly = true)
    public Page<Role> rolesOfPermission(Long permissionId, Pageable pageable) {
        loadPermission(permissionId);
        return rolePermissionRepository.findRolesOfPermission(permissionId, pageable);
    }

    @Transactional(readOnly = true)
    public RolePermission findAssignment(Long assignmentId) {
        return rolePermissionRepository.findWithRoleAndPermissionById(assignmentId)
                .orElseThrow(() -> ProblemException.notFound("ROLE_PERMISSION_NOT_FOUND",
                        "Role permission assignment " + assignmentId + " not found"));
    }

    public void removeAssignment(Long assignmentId) {
        RolePermission assignment = findAssignment(assignmentId);
        rolePermissionRepository.delete(assignment);
        log.info("Removed role permission assignment {}", assignmentId);
    }

    private Role loadRole(Long roleId) {
        return roleRepository.findById(roleId)
                .orElseThrow(() -> ProblemException.notFound("ROLE_NOT_FOUND", "Role " + roleId + " not found"));
    }

    private Permission loadPermission(Long permissionId) {
        return permissionRepository.findById(permissionId)
                .orElseThrow(() -> ProblemException.notFound("PERMISSION_NOT_FOUND",
                        "Permission " + permissionId + " not found"));
    }
}
