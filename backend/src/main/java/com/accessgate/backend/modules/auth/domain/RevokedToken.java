package com.accessgate.backend.modules.auth.domain;

import java.time.OffsetDateTime;

import com.accessgate.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Blacklist entry. Only the SHA-256 of the token is stored; {@code createdAt} is the revocation time.
 */
@Entity
@Table(name = "revoked_token")
public class RevokedToken extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "token_hash", nullable = false, unique = true, length = 64, updatable = false)
    private String tokenHash;

    @Column(name = "subject", nullable = false, length = 64, updatable = false)
    private String subject;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "reason", nullable = false, length = 50, updatable = false)
    private String reason;

    protected RevokedToken() {
    }

    public RevokedToken(String tokenHash, String subject, OffsetDateTime expiresAt, String reason) {
        this.tokenHash = tokenHash;
        this.subject = subject;
        this.expiresAt = expiresAt;
        this.reason = reason;
    }

    public Long getId() {
        return id;
    }

    public String getTokenHash() {
        return tokenHash;
    }

    public String getSubject() {
        return subject;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public String getReason() {
        return reason;
    }
}
