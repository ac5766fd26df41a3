package com.accessgate.backend.modules.principal.presentation;

import com.accessgate.backend.global.security.AuthorizeAction;
import com.accessgate.backend.global.web.PageRequests;
import com.accessgate.backend.modules.authorization.domain.AuthenticatedPrincipal;
import com.accessgate.backend.modules.principal.application.PrincipalService;
import com.accessgate.backend.modules.principal.presentation.dto.PrincipalPageResponse;
import com.accessgate.backend.modules.principal.presentation.dto.PrincipalProfileResponse;

import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/users")
public class PrincipalController {

    private final PrincipalService principalService;

    public PrincipalController(PrincipalService principalService) {
        this.principalService = principalService;
    }

    @GetMapping("/profile")
    public ResponseEntity<PrincipalProfileResponse> currentUser(@AuthenticationPrincipal AuthenticatedPrincipal principal) {
        return ResponseEntity.ok(principalService.loadProfile(principal.principalId()));
    }

    @AuthorizeAction
    @GetMapping
    public ResponseEntity<PrincipalPageResponse> listUsers(
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(principalService.listPrincipals(
                search, PageRequests.of(page, size, Sort.by("email").ascending())));
    }
}
