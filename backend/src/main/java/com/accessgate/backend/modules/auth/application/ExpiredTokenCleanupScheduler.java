package com.accessgate.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.accessgate.backend.modules.auth.infrastructure.persistence.PasswordResetTokenRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class ExpiredTokenCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExpiredTokenCleanupScheduler.class);

    private final TokenRevocationService revocationService;
    private final PasswordResetTokenRepository passwordResetTokenRepository;
    private final InvitationTokenService invitationTokenService;
    private final Clock clock;

    public ExpiredTokenCleanupScheduler(
            TokenRevocationService revocationService,
            PasswordResetTokenRepository passwordResetTokenRepository,
            InvitationTokenService invitationTokenService,
            Clock clock
    ) {
        this.revocationService = revocationService;
        this.passwordResetTokenRepository = passwordResetTokenRepository;
        this.invitationTokenService = invitationTokenService;
        this.clock = clock;
    }

    @Scheduled(cron = "${app.cleanup.cron:0 0 * * * *}")
    @Transactional
    public void purgeExpiredTokens() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int revoked = revocationService.purgeExpired(now);
        int resets = passwordResetTokenRepository.deleteExpiredOrUsed(now);
        int invitations = invitationTokenService.purgeExpired(now);
        if (revoked + resets + invitations > 0) {
            log.info("Purged {} revoked tokens, {} password reset tokens, {} invitations", revoked, resets, invitations);
        }
    }
}
