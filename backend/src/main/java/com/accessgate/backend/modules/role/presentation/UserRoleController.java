package com.accessgate.backend.modules.role.presentation;

import java.util.List;
import java.util.UUID;

import com.accessgate.backend.global.security.AuthorizeAction;
import com.accessgate.backend.global.security.SecurityUtils;
import com.accessgate.backend.modules.role.application.PrincipalRoleService;
import com.accessgate.backend.modules.role.presentation.dto.PrincipalRoleResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Role assignments per user. Changing a user's roles invalidates that user's outstanding access tokens.
 */
@RestController
@RequestMapping("/api/v1/user-roles")
@AuthorizeAction
public class UserRoleController {

    private final PrincipalRoleService principalRoleService;

    public UserRoleController(PrincipalRoleService principalRoleService) {
        this.principalRoleService = principalRoleService;
    }

    @GetMapping("/{userId}")
    public ResponseEntity<List<PrincipalRoleResponse>> rolesOfUser(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(principalRoleService.rolesOf(userId).stream()
                .map(PrincipalRoleResponse::from)
                .toList());
    }

    @PostMapping("/{userId}/roles/{roleId}")
    public ResponseEntity<PrincipalRoleResponse> assignRole(
            @PathVariable("userId") UUID userId,
            @PathVariable("roleId") Long roleId
    ) {
        UUID assignedBy = SecurityUtils.getCurrentPrincipalId();
        return ResponseEntity.ok(PrincipalRoleResponse.from(principalRoleService.assignRole(userId, roleId, assignedBy)));
    }

    @DeleteMapping("/{userId}/roles/{roleId}")
    public ResponseEntity<Void> removeRole(
            @PathVariable("userId") UUID userId,
            @PathVariable("roleId") Long roleId
    ) {
        principalRoleService.removeRole(userId, roleId);
        return ResponseEntity.noContent().build();
    }
}
