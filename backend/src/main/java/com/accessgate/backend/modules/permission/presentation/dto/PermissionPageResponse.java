package com.accessgate.backend.modules.permission.presentation.dto;

import java.util.List;

import com.accessgate.backend.modules.permission.domain.Permission;

import org.springframework.data.domain.Page;

public record PermissionPageResponse(List<PermissionResponse> items, int page, int size, long totalCount) {

    public static PermissionPageResponse from(Page<Permission> page) {
        return new PermissionPageResponse(
                page.getContent().stream().map(PermissionResponse::from).toList(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements()
        );
    }
}
