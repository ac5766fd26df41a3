package com.accessgate.backend.modules.permission.presentation.dto;

public record ActionResolutionResponse(String method, String path, String action, String source) {
}
