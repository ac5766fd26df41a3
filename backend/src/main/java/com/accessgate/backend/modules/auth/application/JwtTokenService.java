package com.accessgate.backend.modules.auth.application;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.accessgate.backend.global.error.ProblemException;
import com.accessgate.backend.modules.auth.domain.TokenRejection;
import com.accessgate.backend.modules.auth.domain.TokenType;
import com.accessgate.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.accessgate.backend.modules.principal.domain.Principal;
import com.accessgate.backend.modules.principal.infrastructure.persistence.PrincipalRepository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues and verifies HMAC-signed access and refresh tokens.
 *
 * <p>Verification runs in a fixed order: blacklist lookup, signature and expiry, token type, and for access tokens
 * a fresh look at the principal, which must still be active and hold exactly the roles embedded in the token.
 */
@Service
public class JwtTokenService {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenService.class);

    static final Duration DEFAULT_ACCESS_TTL = Duration.ofMinutes(15);
    static final Duration DEFAULT_REFRESH_TTL = Duration.ofDays(7);

    private static final String CLAIM_TYPE = "type";
    private static final String CLAIM_EMAIL = "email";
    private static final String CLAIM_ROLES = "roles";

    private final JwtTokenProvider tokenProvider;
    private final TokenRevocationService revocationService;
    private final PrincipalRepository principalRepository;
    private final ObjectMapper objectMapper;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            TokenRevocationService revocationService,
            PrincipalRepository principalRepository,
            ObjectMapper objectMapper,
            @Value("${jwt.access-token-expiry:15m}") String accessTokenExpiry,
            @Value("${jwt.refresh-token-expiry:7d}") String refreshTokenExpiry,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.revocationService = revocationService;
        this.principalRepository = principalRepository;
        this.objectMapper = objectMapper;
        this.accessTokenTtl = TokenExpiryParser.parse(accessTokenExpiry, DEFAULT_ACCESS_TTL);
        this.refreshTokenTtl = TokenExpiryParser.parse(refreshTokenExpiry, DEFAULT_REFRESH_TTL);
        this.clock = clock;
    }

    public IssuedToken issueAccessToken(Principal principal) {
        List<String> roles = List.copyOf(principal.roleNames());
        return issue(principal, TokenType.ACCESS, accessTokenTtl, roles);
    }

    public IssuedToken issueRefreshToken(Principal principal) {
        return issue(principal, TokenType.REFRESH, refreshTokenTtl, null);
    }

    public TokenPair issueTokenPair(Principal principal) {
        return new TokenPair(issueAccessToken(principal), issueRefreshToken(principal));
    }

    @Transactional(readOnly = true)
    public VerifiedToken verify(String token, TokenType expectedType) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException(TokenRejection.INVALID);
        }
        if (revocationService.isRevoked(token)) {
            throw new InvalidTokenException(TokenRejection.REVOKED);
        }

        Claims claims = parseClaims(token);
        TokenType actualType = TokenType.fromClaim(claims.get(CLAIM_TYPE, String.class));
        if (actualType != expectedType) {
            throw new InvalidTokenException(TokenRejection.WRONG_TYPE);
        }

        UUID principalId = parseSubject(claims.getSubject());
        List<String> roles = readRoles(claims);
        OffsetDateTime expiresAt = toOffsetDateTime(claims.getExpiration());

        if (expectedType == TokenType.ACCESS) {
            Principal principal = principalRepository.findWithRolesByExternalId(principalId)
                    .filter(Principal::isActive)
                    .orElseThrow(() -> new InvalidTokenException(TokenRejection.PRINCIPAL_INACTIVE));
            if (!new HashSet<>(roles).equals(principal.roleNames())) {
                log.info("Rejected access token for {}: roles changed from {} to {}",
                        principalId, roles, principal.roleNames());
                throw new InvalidTokenException(TokenRejection.ROLES_CHANGED);
            }
        }

        return new VerifiedToken(principalId, actualType, claims.get(CLAIM_EMAIL, String.class), roles, expiresAt);
    }

    /**
     * Reads subject and expiry without checking the signature, so already expired tokens can still be revoked.
     */
    public DecodedToken decode(String token) {
        return tryDecode(token)
                .orElseThrow(() -> ProblemException.badRequest("INVALID_TOKEN", "Token could not be decoded"));
    }

    public Optional<DecodedToken> tryDecode(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String[] parts = token.split("\\.");
        if (parts.length < 2) {
            return Optional.empty();
        }
        try {
            byte[] payload = Base64.getUrlDecoder().decode(parts[1]);
            JsonNode node = objectMapper.readTree(new String(payload, StandardCharsets.UTF_8));
            if (node == null || !node.path("exp").isNumber() || !node.path("sub").isTextual()) {
                return Optional.empty();
            }
            Instant expiresAt = Instant.ofEpochSecond(node.get("exp").asLong());
            return Optional.of(new DecodedToken(node.get("sub").asText(),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())));
        } catch (IllegalArgumentException | IOException ex) {
            log.debug("Token payload could not be decoded: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    public Duration getAccessTokenTtl() {
        return accessTokenTtl;
    }

    public Duration getRefreshTokenTtl() {
        return refreshTokenTtl;
    }

    private IssuedToken issue(Principal principal, TokenType type, Duration ttl, List<String> roles) {
        Instant now = clock.instant();
        Instant expiry = now.plus(ttl);

        JwtBuilder builder = Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(principal.getExternalId().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(CLAIM_TYPE, type.claimValue());
        if (type == TokenType.ACCESS) {
            builder.claim(CLAIM_EMAIL, principal.getEmail())
                    .claim(CLAIM_ROLES, roles);
        }

        String token = builder.signWith(tokenProvider.getSecretKey(), SIG.HS256).compact();
        return new IssuedToken(token, OffsetDateTime.ofInstant(expiry, clock.getZone()), ttl.toSeconds());
    }

    private Claims parseClaims(String token) {
        try {
            return Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException(TokenRejection.INVALID, e);
        }
    }

    private static UUID parseSubject(String subject) {
        if (subject == null) {
            throw new InvalidTokenException(TokenRejection.INVALID);
        }
        try {
            return UUID.fromString(subject);
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException(TokenRejection.INVALID, e);
        }
    }

    private static List<String> readRoles(Claims claims) {
        List<?> rolesClaim = claims.get(CLAIM_ROLES, List.class);
        return rolesClaim == null ? List.of() : rolesClaim.stream()
                .filter(Objects::nonNull)
                .map(Object::toString)
                .toList();
    }

    private OffsetDateTime toOffsetDateTime(Date date) {
        Instant instant = date != null ? date.toInstant() : clock.instant();
        return OffsetDateTime.ofInstant(instant, clock.getZone());
    }

    public record IssuedToken(String value, OffsetDateTime expiresAt, long expiresInSeconds) {
    }

    public record TokenPair(IssuedToken accessToken, IssuedToken refreshToken) {
    }

    public record VerifiedToken(UUID principalId, TokenType type, String email, List<String> roles, OffsetDateTime expiresAt) {
    }

    public record DecodedToken(String subject, OffsetDateTime expiresAt) {
    }
}
