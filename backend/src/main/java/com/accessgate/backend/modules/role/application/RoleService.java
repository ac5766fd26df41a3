package com.accessgate.backend.modules.role.application;

import com.accessgate.backend.global.error.ProblemException;
import com.accessgate.backend.modules.role.domain.Role;
import com.accessgate.backend.modules.role.domain.RoleNames;
import com.accessgate.backend.modules.role.infrastructure.persistence.PrincipalRoleRepository;
import com.accessgate.backend.modules.role.infrastructure.persistence.RolePermissionRepository;
import com.accessgate.backend.modules.role.infrastructure.persistence.RoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Role registry. Names are validated on every write; a role held by any principal cannot be deleted.
 */
@Service
@Transactional
public class RoleService {

    private static final Logger log = LoggerFactory.getLogger(RoleService.class);
    private static final int DESCRIPTION_MAX_LENGTH = 255;

    private final RoleRepository roleRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final PrincipalRoleRepository principalRoleRepository;

    public RoleService(
            RoleRepository roleRepository,
            RolePermissionRepository rolePermissionRepository,
            PrincipalRoleRepository principalRoleRepository
    ) {
        this.roleRepository = roleRepository;
        this.rolePermissionRepository = rolePermissionRepository;
        this.principalRoleRepository = principalRoleRepository;
    }

    public Role createRole(String name, String description) {
        requireValidName(name);
        if (roleRepository.existsByName(name)) {
            throw ProblemException.conflict("ROLE_ALREADY_EXISTS", "Role " + name + " already exists");
        }
        Role role = new Role();
        role.setName(name);
        role.setDescription(normalizeDescription(description));
        Role saved = roleRepository.save(role);
        log.info("Created role id={} name={}", saved.getId(), saved.getName());
        return saved;
    }

    public Role updateRole(Long id, String name, String description) {
        Role role = getRole(id);
        if (name != null && !name.equals(role.getName())) {
            requireValidName(name);
            if (roleRepository.existsByNameAndIdNot(name, id)) {
                throw ProblemException.conflict("ROLE_ALREADY_EXISTS", "Role " + name + " already exists");
            }
            role.setName(name);
        }
        if (description != null) {
            role.setDescription(normalizeDescription(description));
        }
        return role;
    }

    public void deleteRole(Long id) {
        Role role = getRole(id);
        if (principalRoleRepository.existsByRole(id)) {
            throw ProblemException.conflict("ROLE_IN_USE",
                    "Role " + role.getName() + " is assigned to one or more users");
        }
        int removedGrants = rolePermissionRepository.deleteAllGrants(id);
        roleRepository.delete(role);
        log.info("Deleted role id={} name={} with {} grants", id, role.getName(), removedGrants);
    }

    @Transactional(readOnly = true)
    public Role getRole(Long id) {
        return roleRepository.findById(id)
                .orElseThrow(() -> ProblemException.notFound("ROLE_NOT_FOUND", "Role " + id + " not found"));
    }

    @Transactional(readOnly = true)
    public Role findByName(String name) {
        return roleRepository.findByName(name)
                .orElseThrow(() -> ProblemException.notFound("ROLE_NOT_FOUND", "Role " + name + " not found"));
    }

    @Transactional(readOnly = true)
    public Page<Role> listRoles(String search, Pageable pageable) {
        String pattern = search == null || search.isBlank() ? null : "%" + search.trim() + "%";
        return roleRepository.search(pattern, pageable);
    }

    @Transactional(readOnly = true)
    public long countHolders(Long roleId) {
        return principalRoleRepository.countByRole(roleId);
    }

    @Transactional(readOnly = true)
    public long countPermissions(Long roleId) {
        return rolePermissionRepository.countGrants(roleId);
    }

    private static void requireValidName(String name) {
        if (!RoleNames.isValid(name)) {
            throw ProblemException.badRequest("INVALID_ROLE_NAME",
                    "Role name must contain only uppercase letters and underscores (max 50 characters)");
        }
    }

    private static String normalizeDescription(String description) {
        if (description == null || description.isBlank()) {
            return null;
        }
        String trimmed = description.trim();
        if (trimmed.length() > DESCRIPTION_MAX_LENGTH) {
            throw ProblemException.badRequest("INVALID_ROLE_DESCRIPTION", "Description must be at most 255 characters");
        }
        return trimmed;
    }
}
