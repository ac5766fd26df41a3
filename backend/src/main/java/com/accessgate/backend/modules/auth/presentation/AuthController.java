package com.accessgate.backend.modules.auth.presentation;

import com.accessgate.backend.modules.auth.application.AuthService;
import com.accessgate.backend.modules.auth.presentation.dto.ForgotPasswordRequest;
import com.accessgate.backend.modules.auth.presentation.dto.LoginRequest;
import com.accessgate.backend.modules.auth.presentation.dto.LoginResponse;
import com.accessgate.backend.modules.auth.presentation.dto.LogoutRequest;
import com.accessgate.backend.modules.auth.presentation.dto.RefreshRequest;
import com.accessgate.backend.modules.auth.presentation.dto.RegisterRequest;
import com.accessgate.backend.modules.auth.presentation.dto.ResetPasswordRequest;
import com.accessgate.backend.modules.auth.presentation.dto.ResetPasswordResponse;
import com.accessgate.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.accessgate.backend.modules.principal.presentation.dto.PrincipalProfileResponse;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @PostMapping("/register")
    public ResponseEntity<PrincipalProfileResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @PostMapping("/refresh")
    public ResponseEntity<TokenPairResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(authService.refresh(request.refreshToken()));
    }

    @Operation(summary = "Logout", description = "Revokes the given tokens. Expired tokens are accepted as long as they decode.")
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@Valid @RequestBody LogoutRequest request) {
        authService.logout(request);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Request password reset", description = "Always returns 202 whether or not the address is registered.")
    @PostMapping("/forgot-password")
    public ResponseEntity<Void> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        authService.forgotPassword(request.email());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/reset-password")
    public ResponseEntity<ResetPasswordResponse> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        if (authService.resetPassword(request.token(), request.newPassword())) {
            return ResponseEntity.ok(new ResetPasswordResponse(true, "Password has been reset"));
        }
        return ResponseEntity.badRequest().body(new ResetPasswordResponse(false, "Invalid or expired reset token"));
    }
}
