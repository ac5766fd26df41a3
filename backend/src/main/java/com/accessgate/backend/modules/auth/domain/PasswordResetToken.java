package com.accessgate.backend.modules.auth.domain;

import java.time.OffsetDateTime;

import com.accessgate.backend.global.jpa.AbstractTimestampedEntity;
import com.accessgate.backend.modules.principal.domain.Principal;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * Single-use password reset token. Once used it stays invalid regardless of expiry.
 */
@Entity
@Table(name = "password_reset_token")
public class PasswordResetToken extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "token", nullable = false, unique = true, length = 64, updatable = false)
    private String token;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "principal_id", nullable = false, updatable = false)
    private Principal principal;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "used", nullable = false)
    private boolean used;

    @Column(name = "used_at")
    private OffsetDateTime usedAt;

    protected PasswordResetToken() {
    }

    public PasswordResetToken(String token, Principal principal, OffsetDateTime expiresAt) {
        this.token = token;
        this.principal = principal;
        this.expiresAt = expiresAt;
    }

    public boolean isUsable(OffsetDateTime now) {
        return !used && expiresAt.isAfter(now);
    }

    public void markUsed(OffsetDateTime now) {
        this.used = true;
        this.usedAt = now;
    }

    public Long getId() {
        return id;
    }

    public String getToken() {
        return token;
    }

    public Principal getPrincipal() {
        return principal;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public boolean isUsed() {
        return used;
    }

    public OffsetDateTime getUsedAt() {
        return usedAt;
    }
}
