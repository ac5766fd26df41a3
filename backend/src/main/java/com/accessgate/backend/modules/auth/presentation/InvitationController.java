package com.accessgate.backend.modules.auth.presentation;

import java.util.List;

import com.accessgate.backend.global.security.AuthorizeAction;
import com.accessgate.backend.global.security.SecurityUtils;
import com.accessgate.backend.modules.auth.application.InvitationTokenService;
import com.accessgate.backend.modules.auth.domain.InvitationToken;
import com.accessgate.backend.modules.auth.presentation.dto.CreateInvitationRequest;
import com.accessgate.backend.modules.auth.presentation.dto.InvitationResponse;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/invitations")
@AuthorizeAction
public class InvitationController {

    private final InvitationTokenService invitationTokenService;

    public InvitationController(InvitationTokenService invitationTokenService) {
        this.invitationTokenService = invitationTokenService;
    }

    @PostMapping
    public ResponseEntity<InvitationResponse> createInvitation(@Valid @RequestBody CreateInvitationRequest request) {
        InvitationToken invitation = invitationTokenService.createInvitation(
                SecurityUtils.getCurrentPrincipalId(), request.expiresInHoursOrDefault());
        return ResponseEntity.status(HttpStatus.CREATED).body(InvitationResponse.from(invitation));
    }

    @GetMapping
    public ResponseEntity<List<InvitationResponse>> listInvitations() {
        return ResponseEntity.ok(invitationTokenService.listInvitations().stream()
                .map(InvitationResponse::from)
                .toList());
    }
}
