package com.accessgate.backend.modules.role.presentation.dto;

import java.util.List;

import com.accessgate.backend.modules.role.domain.Role;

import org.springframework.data.domain.Page;

public record RolePageResponse(List<RoleResponse> items, int page, int size, long totalCount) {

    public static RolePageResponse from(Page<Role> page) {
        return new RolePageResponse(
                page.getContent().stream().map(RoleResponse::from).toList(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements()
        );
    }
}
