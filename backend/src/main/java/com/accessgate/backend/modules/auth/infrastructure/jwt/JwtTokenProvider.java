package com.accessgate.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;

import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * HMAC signing key derived from {@code jwt.secret}. Base64 secrets are decoded, anything else is used as raw UTF-8.
 */
@Component
public class JwtTokenProvider {

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secretString) {
        this.secretKey = Keys.hmacShaKeyFor(keyBytes(secretString));
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    static byte[] keyBytes(String secretString) {
        if (secretString == null || secretString.isBlank()) {
            throw new IllegalStateException("jwt.secret must be configured");
        }
        byte[] decoded = decodeBase64(secretString);
        if (decoded != null && decoded.length >= 32) {
            return decoded;
        }
        return secretString.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] decodeBase64(String value) {
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
