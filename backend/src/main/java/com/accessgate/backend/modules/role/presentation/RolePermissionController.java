package com.accessgate.backend.modules.role.presentation;

import java.util.List;

import com.accessgate.backend.global.security.AuthorizeAction;
import com.accessgate.backend.global.web.PageRequests;
import com.accessgate.backend.modules.permission.presentation.dto.PermissionPageResponse;
import com.accessgate.backend.modules.role.application.RolePermissionGraph;
import com.accessgate.backend.modules.role.presentation.dto.AssignPermissionsRequest;
import com.accessgate.backend.modules.role.presentation.dto.AssignPermissionsResponse;
import com.accessgate.backend.modules.role.presentation.dto.PermissionCheckResponse;
import com.accessgate.backend.modules.role.presentation.dto.RevokePermissionsResponse;
import com.accessgate.backend.modules.role.presentation.dto.RolePermissionAssignmentResponse;

import jakarta.validation.Valid;

import org.springframework.data.domain.Sort;
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
@RequestMapping("/api/v1/role-permissions")
@AuthorizeAction
public class RolePermissionController {

    private final RolePermissionGraph rolePermissionGraph;

    public RolePermissionController(RolePermissionGraph rolePermissionGraph) {
        this.rolePermissionGraph = rolePermissionGraph;
    }

    @GetMapping("/{roleId}/permissions")
    public ResponseEntity<PermissionPageResponse> permissionsOfRole(
            @PathVariable("roleId") Long roleId,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(PermissionPageResponse.from(
                rolePermissionGraph.permissionsOfRole(roleId, PageRequests.of(page, size, Sort.unsorted()))));
    }

    @PostMapping("/{roleId}/permissions")
    public ResponseEntity<AssignPermissionsResponse> assignPermissions(
            @PathVariable("roleId") Long roleId,
            @Valid @RequestBody AssignPermissionsRequest request
    ) {
        int assigned = rolePermissionGraph.replace(roleId, request.permissionIds(), request.replace());
        return ResponseEntity.ok(new AssignPermissionsResponse(roleId, assigned, request.replace()));
    }

    @DeleteMapping("/{roleId}/permissions")
    public ResponseEntity<RevokePermissionsResponse> revokePermissions(
            @PathVariable("roleId") Long roleId,
            @RequestParam(name = "permissionIds") List<Long> permissionIds
    ) {
        int revoked = rolePermissionGraph.revoke(roleId, permissionIds);
        return ResponseEntity.ok(new RevokePermissionsResponse(roleId, revoked));
    }

    @GetMapping("/{roleId}/permissions/{permissionId}")
    public ResponseEntity<PermissionCheckResponse> checkPermission(
            @PathVariable("roleId") Long roleId,
            @PathVariable("permissionId") Long permissionId
    ) {
        boolean granted = rolePermissionGraph.hasPermission(roleId, permissionId);
        return ResponseEntity.ok(new PermissionCheckResponse(roleId, permissionId, granted));
    }

    @PutMapping("/{roleId}/permissions/{permissionId}")
    public ResponseEntity<PermissionCheckResponse> grantPermission(
            @PathVariable("roleId") Long roleId,
            @PathVariable("permissionId") Long permissionId
    ) {
        rolePermissionGraph.grant(roleId, permissionId);
        return ResponseEntity.ok(new PermissionCheckResponse(roleId, permissionId, true));
    }

    @GetMapping("/assignments/{assignmentId}")
    public ResponseEntity<RolePermissionAssignmentResponse> getAssignment(@PathVariable("assignmentId") Long assignmentId) {
        return ResponseEntity.ok(RolePermissionAssignmentResponse.from(rolePermissionGraph.findAssignment(assignmentId)));
    }

    @DeleteMapping("/assignments/{assignmentId}")
    public ResponseEntity<Void> removeAssignment(@PathVariable("assignmentId") Long assignmentId) {
        rolePermissionGraph.removeAssignment(assignmentId);
        return ResponseEntity.noContent().build();
    }
}
