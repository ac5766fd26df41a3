package com.accessgate.backend.modules.role.presentation.dto;

import java.util.List;

public record PrincipalRolePageResponse(List<PrincipalRoleResponse> items, int page, int size, long totalCount) {
}
