package com.accessgate.backend.modules.auth.presentation.dto;

import com.accessgate.backend.modules.principal.presentation.dto.PrincipalProfileResponse;

public record LoginResponse(TokenPairResponse tokens, PrincipalProfileResponse user) {
}
