package com.accessgate.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.accessgate.backend.modules.auth.application.JwtTokenService.TokenPair;

public record TokenPairResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        OffsetDateTime expiresAt,
        String refreshToken,
        long refreshExpiresIn,
        OffsetDateTime refreshExpiresAt
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public static TokenPairResponse from(TokenPair pair) {
        return new TokenPairResponse(
                pair.accessToken().value(),
                DEFAULT_TOKEN_TYPE,
                pair.accessToken().expiresInSeconds(),
                pair.accessToken().expiresAt(),
                pair.refreshToken().value(),
                pair.refreshToken().expiresInSeconds(),
                pair.refreshToken().expiresAt()
        );
    }
}
