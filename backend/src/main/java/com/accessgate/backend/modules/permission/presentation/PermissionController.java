package com.accessgate.backend.modules.permission.presentation;

import java.util.List;
import java.util.Locale;

import com.accessgate.backend.global.security.AuthorizeAction;
import com.accessgate.backend.global.web.PageRequests;
import com.accessgate.backend.modules.authorization.application.AuthorizationDecisionEngine;
import com.accessgate.backend.modules.authorization.application.RouteActionResolver;
import com.accessgate.backend.modules.authorization.domain.ActionResolution;
import com.accessgate.backend.modules.permission.application.PermissionCatalog;
import com.accessgate.backend.modules.permission.application.PermissionCatalog.PermissionFilter;
import com.accessgate.backend.modules.permission.application.PermissionReportService;
import com.accessgate.backend.modules.permission.domain.HttpMethods;
import com.accessgate.backend.modules.permission.domain.Permission;
import com.accessgate.backend.modules.permission.domain.PermissionUsage;
import com.accessgate.backend.modules.permission.presentation.dto.ActionResolutionResponse;
import com.accessgate.backend.modules.permission.presentation.dto.CreatePermissionRequest;
import com.accessgate.backend.modules.permission.presentation.dto.PermissionGroupResponse;
import com.accessgate.backend.modules.permission.presentation.dto.PermissionPageResponse;
import com.accessgate.backend.modules.permission.presentation.dto.PermissionResponse;
import com.accessgate.backend.modules.permission.presentation.dto.PermissionStatsResponse;
import com.accessgate.backend.modules.permission.presentation.dto.RoutePermissionResponse;
import com.accessgate.backend.modules.permission.presentation.dto.ValidatePermissionRequest;
import com.accessgate.backend.modules.permission.presentation.dto.ValidatePermissionResponse;
import com.accessgate.backend.modules.role.application.RolePermissionGraph;
import com.accessgate.backend.modules.role.presentation.dto.RolePageResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/permissions")
@AuthorizeAction
public class PermissionController {

    private final PermissionCatalog permissionCatalog;
    private final PermissionReportService reportService;
    private final RolePermissionGraph rolePermissionGraph;
    private final RouteActionResolver routeActionResolver;
    private final AuthorizationDecisionEngine decisionEngine;

    public PermissionController(
            PermissionCatalog permissionCatalog,
            PermissionReportService reportService,
            RolePermissionGraph rolePermissionGraph,
            RouteActionResolver routeActionResolver,
            AuthorizationDecisionEngine decisionEngine
    ) {
        this.permissionCatalog = permissionCatalog;
        this.reportService = reportService;
        this.rolePermissionGraph = rolePermissionGraph;
        this.routeActionResolver = routeActionResolver;
        this.decisionEngine = decisionEngine;
    }

    @GetMapping
    public ResponseEntity<PermissionPageResponse> listPermissions(
            @RequestParam(name = "method", required = false) String method,
            @RequestParam(name = "module", required = false) String module,
            @RequestParam(name = "action", required = false) String action,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        PermissionFilter filter = new PermissionFilter(method, module, action);
        return ResponseEntity.ok(PermissionPageResponse.from(permissionCatalog.listPermissions(
                filter, PageRequests.of(page, size, Sort.by("action").ascending()))));
    }

    @GetMapping("/{permissionId}")
    public ResponseEntity<PermissionResponse> getPermission(@PathVariable("permissionId") Long permissionId) {
        return ResponseEntity.ok(PermissionResponse.from(permissionCatalog.getPermission(permissionId)));
    }

    @Operation(summary = "Create permission", description = "Registers a (method, route, action) triple. The route must carry the /api/vN prefix.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "400", description = "Invalid method, route or action format"),
            @ApiResponse(responseCode = "409", description = "Identical permission already exists")
    })
    @PostMapping
    public ResponseEntity<PermissionResponse> createPermission(@Valid @RequestBody CreatePermissionRequest request) {
        Permission permission = permissionCatalog.createOrFail(request.method(), request.route(), request.action());
        return ResponseEntity.status(HttpStatus.CREATED).body(PermissionResponse.from(permission));
    }

    @DeleteMapping("/{permissionId}")
    public ResponseEntity<Void> deletePermission(@PathVariable("permissionId") Long permissionId) {
        permissionCatalog.deletePermission(permissionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{permissionId}/roles")
    public ResponseEntity<RolePageResponse> rolesOfPermission(
            @PathVariable("permissionId") Long permissionId,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(RolePageResponse.from(rolePermissionGraph.rolesOfPermission(
                permissionId, PageRequests.of(page, size, Sort.unsorted()))));
    }

    @GetMapping("/grouped")
    public ResponseEntity<List<PermissionGroupResponse>> groupedByModule() {
        return ResponseEntity.ok(reportService.groupedByModule());
    }

    @GetMapping("/routes")
    public ResponseEntity<List<RoutePermissionResponse>> routeOverview() {
        return ResponseEntity.ok(reportService.routeOverview());
    }

    @GetMapping("/stats")
    public ResponseEntity<PermissionStatsResponse> stats() {
        return ResponseEntity.ok(reportService.stats());
    }

    @GetMapping("/unused")
    public ResponseEntity<List<PermissionResponse>> unusedPermissions() {
        return ResponseEntity.ok(reportService.unusedPermissions());
    }

    @GetMapping("/usage")
    public ResponseEntity<List<PermissionUsage>> usage() {
        return ResponseEntity.ok(reportService.usage());
    }

    @Operation(summary = "Resolve action", description = "Shows which action a request would be checked against and where it came from.")
    @GetMapping("/resolve")
    public ResponseEntity<ActionResolutionResponse> resolveAction(
            @RequestParam(name = "method") String method,
            @RequestParam(name = "path") String path
    ) {
        String normalizedMethod = HttpMethods.normalize(method);
        ActionResolution resolution = routeActionResolver.resolve(normalizedMethod, path);
        return ResponseEntity.ok(new ActionResolutionResponse(
                normalizedMethod, path, resolution.action(), resolution.source().name().toLowerCase(Locale.ROOT)));
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidatePermissionResponse> validateUserPermission(
            @Valid @RequestBody ValidatePermissionRequest request
    ) {
        boolean allowed = decisionEngine.validateUserPermission(request.userId(), request.method(), request.action());
        return ResponseEntity.ok(new ValidatePermissionResponse(
                request.userId(), HttpMethods.normalize(request.method()), request.action(), allowed));
    }
}
