package com.accessgate.backend.modules.role.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.accessgate.backend.global.error.ProblemException;
import com.accessgate.backend.modules.principal.domain.Principal;
import com.accessgate.backend.modules.principal.infrastructure.persistence.PrincipalRepository;
import com.accessgate.backend.modules.role.domain.PrincipalRole;
import com.accessgate.backend.modules.role.domain.Role;
import com.accessgate.backend.modules.role.infrastructure.persistence.PrincipalRoleRepository;
import com.accessgate.backend.modules.role.infrastructure.persistence.RoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Assigns roles to principals. Any change here invalidates the principal's outstanding access tokens,
 * since token verification compares the embedded role set with the current one.
 */
@Service
@Transactional
public class PrincipalRoleService {

    private static final Logger log = LoggerFactory.getLogger(PrincipalRoleService.class);

    private final PrincipalRepository principalRepository;
    private final RoleRepository roleRepository;
    private final PrincipalRoleRepository principalRoleRepository;
    private final Clock clock;

    public PrincipalRoleService(
            PrincipalRepository principalRepository,
            RoleRepository roleRepository,
            PrincipalRoleRepository principalRoleRepository,
            Clock clock
    ) {
        this.principalRepository = principalRepository;
        this.roleRepository = roleRepository;
        this.principalRoleRepository = principalRoleRepository;
        this.clock = clock;
    }

    /**
     * Returns the existing assignment when the principal already holds the role. Concurrent assignments of the same
     * role resolve to a single row.
     */
    public PrincipalRole assignRole(UUID principalId, Long roleId, UUID assignedById) {
        Principal principal = loadPrincipal(principalId);
        Role role = roleRepository.findById(roleId)
                .orElseThrow(() -> ProblemException.notFound("ROLE_NOT_FOUND", "Role " + roleId + " not found"));

        int inserted = principalRoleRepository.insertAssignmentIfAbsent(
                principal.getId(), role.getId(), OffsetDateTime.now(clock));
        PrincipalRole assignment = principalRoleRepository.findAssignment(principal.getId(), role.getId())
                .orElseThrow(() -> new IllegalStateException(
                        "Assignment of role " + roleId + " to principal " + principalId + " vanished"));

        if (inserted > 0) {
            if (assignedById != null) {
                principalRepository.findByExternalId(assignedById).ifPresent(assignment::setAssignedBy);
            }
            log.info("Assigned role {} to principal {}", role.getName(), principalId);
        }
        return assignment;
    }

    public void removeRole(UUID principalId, Long roleId) {
        Principal principal = loadPrincipal(principalId);
        PrincipalRole assignment = principalRoleRepository.findAssignment(principal.getId(), roleId)
                .orElseThrow(() -> ProblemException.notFound("USER_ROLE_NOT_FOUND",
                        "User does not have role " + roleId));
        principal.getRoleAssignments().remove(assignment);
        principalRoleRepository.delete(assignment);
        log.info("Removed role {} from principal {}", assignment.getRole().getName(), principalId);
    }

    @Transactional(readOnly = true)
    public List<PrincipalRole> rolesOf(UUID principalId) {
        Principal principal = loadPrincipal(principalId);
        return principalRoleRepository.findByPrincipal(principal.getId());
    }

    @Transactional(readOnly = true)
    public Page<PrincipalRole> principalsWithRole(Long roleId, Pageable pageable) {
        if (!roleRepository.existsById(roleId)) {
            throw ProblemException.notFound("ROLE_NOT_FOUND", "Role " + roleId + " not found");
        }
        return principalRoleRepository.findByRole(roleId, pageable);
    }

    @Transactional(readOnly = true)
    public boolean principalHasRole(UUID principalId, String roleName) {
        return principalRepository.findWithRolesByExternalId(principalId)
                .map(principal -> principal.roleNames().contains(roleName))
                .orElse(false);
    }

    private Principal loadPrincipal(UUID principalId) {
        return principalRepository.findByExternalId(principalId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND", "User " + principalId + " not found"));
    }
}
