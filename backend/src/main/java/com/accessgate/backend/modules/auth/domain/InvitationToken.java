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

@Entity
@Table(name = "invitation_token")
public class InvitationToken extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "token", nullable = false, unique = true, length = 64, updatable = false)
    private String token;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "created_by", nullable = false, updatable = false)
    private Principal createdBy;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "used", nullable = false)
    private boolean used;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "used_by")
    private Principal usedBy;

    @Column(name = "used_at")
    private OffsetDateTime usedAt;

    protected InvitationToken() {
    }

    public InvitationToken(String token, Principal createdBy, OffsetDateTime expiresAt) {
        this.token = token;
        this.createdBy = createdBy;
        this.expiresAt = expiresAt;
    }

    public boolean isUsable(OffsetDateTime now) {
        return !used && expiresAt.isAfter(now);
    }

    public void consume(Principal principal, OffsetDateTime now) {
        this.used = true;
        this.usedBy = principal;
        this.usedAt = now;
    }

    public Long getId() {
        return id;
    }

    public String getToken() {
        return token;
    }

    public Principal getCreatedBy() {
        return createdBy;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public boolean isUsed() {
        return used;
    }

    public Principal getUsedBy() {
        return usedBy;
    }

    public OffsetDateTime getUsedAt() {
        return usedAt;
    }
}
