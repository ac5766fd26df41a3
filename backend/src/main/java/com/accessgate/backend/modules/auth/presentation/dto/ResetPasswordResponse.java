package com.accessgate.backend.modules.auth.presentation.dto;

public record ResetPasswordResponse(boolean success, String message) {
}
