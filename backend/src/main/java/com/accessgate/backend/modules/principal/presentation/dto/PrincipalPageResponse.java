package com.accessgate.backend.modules.principal.presentation.dto;

import java.util.List;

public record PrincipalPageResponse(List<PrincipalProfileResponse> items, int page, int size, long totalCount) {
}
