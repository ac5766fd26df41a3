package com.accessgate.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.accessgate.backend.global.error.ProblemException;
import com.accessgate.backend.modules.auth.domain.InvitationToken;
import com.accessgate.backend.modules.auth.infrastructure.persistence.InvitationTokenRepository;
import com.accessgate.backend.modules.principal.domain.Principal;
import com.accessgate.backend.modules.principal.infrastructure.persistence.PrincipalRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class InvitationTokenService implements InvitationTokenGateway {

    private static final Logger log = LoggerFactory.getLogger(InvitationTokenService.class);
    private static final int MAX_EXPIRY_HOURS = 24 * 30;

    private final InvitationTokenRepository invitationTokenRepository;
    private final PrincipalRepository principalRepository;
    private final Clock clock;

    public InvitationTokenService(
            InvitationTokenRepository invitationTokenRepository,
            PrincipalRepository principalRepository,
            Clock clock
    ) {
        this.invitationTokenRepository = invitationTokenRepository;
        this.principalRepository = principalRepository;
        this.clock = clock;
    }

    public InvitationToken createInvitation(UUID creatorId, int expiresInHours) {
        if (expiresInHours < 1 || expiresInHours > MAX_EXPIRY_HOURS) {
            throw ProblemException.badRequest("INVALID_EXPIRY", "expiresInHours must be between 1 and " + MAX_EXPIRY_HOURS);
        }
        Principal creator = principalRepository.findByExternalId(creatorId)
                .orElseThrow(() -> ProblemException.unauthorized("UNAUTHORIZED", "Unknown principal"));
        OffsetDateTime expiresAt = OffsetDateTime.now(clock).plusHours(expiresInHours);
        InvitationToken saved = invitationTokenRepository.save(
                new InvitationToken(UUID.randomUUID().toString(), creator, expiresAt));
        log.info("Invitation {} created by {} expiring at {}", saved.getId(), creatorId, expiresAt);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<InvitationToken> listInvitations() {
        return invitationTokenRepository.findAllWithPrincipals();
    }

    @Override
    @Transactional(readOnly = true)
    public boolean validate(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        return invitationTokenRepository.findByToken(token)
                .map(invitation -> invitation.isUsable(now))
                .orElse(false);
    }

    @Override
    public boolean consume(String token, Principal principal) {
        if (token == null || token.isBlank()) {
            return false;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        return invitationTokenRepository.findByToken(token)
                .filter(invitation -> invitation.isUsable(now))
                .map(invitation -> {
                    invitation.consume(principal, now);
                    log.info("Invitation {} consumed by {}", invitation.getId(), principal.getExternalId());
                    return true;
                })
                .orElse(false);
    }

    public int purgeExpired(OffsetDateTime now) {
        return invitationTokenRepository.deleteExpiredUnused(now);
    }
}
