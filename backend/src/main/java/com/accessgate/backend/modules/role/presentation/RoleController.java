package com.accessgate.backend.modules.role.presentation;

import java.util.List;

import com.accessgate.backend.global.security.AuthorizeAction;
import com.accessgate.backend.global.web.PageRequests;
import com.accessgate.backend.modules.role.application.PrincipalRoleService;
import com.accessgate.backend.modules.role.application.RoleService;
import com.accessgate.backend.modules.role.domain.PrincipalRole;
import com.accessgate.backend.modules.role.domain.Role;
import com.accessgate.backend.modules.role.presentation.dto.CreateRoleRequest;
import com.accessgate.backend.modules.role.presentation.dto.PrincipalRolePageResponse;
import com.accessgate.backend.modules.role.presentation.dto.PrincipalRoleResponse;
import com.accessgate.backend.modules.role.presentation.dto.RoleDetailResponse;
import com.accessgate.backend.modules.role.presentation.dto.RolePageResponse;
import com.accessgate.backend.modules.role.presentation.dto.RoleResponse;
import com.accessgate.backend.modules.role.presentation.dto.UpdateRoleRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/roles")
@AuthorizeAction
public class RoleController {

    private final RoleService roleService;
    private final PrincipalRoleService principalRoleService;

    public RoleController(RoleService roleService, PrincipalRoleService principalRoleService) {
        this.roleService = roleService;
        this.principalRoleService = principalRoleService;
    }

    @GetMapping
    public ResponseEntity<RolePageResponse> listRoles(
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        Page<Role> roles = roleService.listRoles(search, PageRequests.of(page, size, Sort.by("name").ascending()));
        return ResponseEntity.ok(RolePageResponse.from(roles));
    }

    @GetMapping("/{roleId}")
    public ResponseEntity<RoleDetailResponse> getRole(@PathVariable("roleId") Long roleId) {
        Role role = roleService.getRole(roleId);
        return ResponseEntity.ok(new RoleDetailResponse(
                RoleResponse.from(role),
                roleService.countPermissions(roleId),
                roleService.countHolders(roleId)
        ));
    }

    @Operation(summary = "Create role", description = "Role names use uppercase letters and underscores only.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "400", description = "Invalid role name"),
            @ApiResponse(responseCode = "409", description = "Role name already taken")
    })
    @PostMapping
    public ResponseEntity<RoleResponse> createRole(@Valid @RequestBody CreateRoleRequest request) {
        Role role = roleService.createRole(request.name(), request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(RoleResponse.from(role));
    }

    @PutMapping("/{roleId}")
    public ResponseEntity<RoleResponse> updateRole(
            @PathVariable("roleId") Long roleId,
            @Valid @RequestBody UpdateRoleRequest request
    ) {
        return ResponseEntity.ok(RoleResponse.from(roleService.updateRole(roleId, request.name(), request.description())));
    }

    @Operation(summary = "Delete role", description = "Fails with 409 while any user still holds the role.")
    @DeleteMapping("/{roleId}")
    public ResponseEntity<Void> deleteRole(@PathVariable("roleId") Long roleId) {
        roleService.deleteRole(roleId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{roleId}/users")
    public ResponseEntity<PrincipalRolePageResponse> usersWithRole(
            @PathVariable("roleId") Long roleId,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        Page<PrincipalRole> assignments = principalRoleService.principalsWithRole(
                roleId, PageRequests.of(page, size, Sort.unsorted()));
        List<PrincipalRoleResponse> items = assignments.getContent().stream()
                .map(PrincipalRoleResponse::from)
                .toList();
        return ResponseEntity.ok(new PrincipalRolePageResponse(
                items, assignments.getNumber(), assignments.getSize(), assignments.getTotalElements()));
    }
}
