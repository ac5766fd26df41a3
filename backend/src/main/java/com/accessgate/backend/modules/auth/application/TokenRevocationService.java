package com.accessgate.backend.modules.auth.application;

import java.time.OffsetDateTime;

import com.accessgate.backend.modules.auth.domain.RevokedToken;
import com.accessgate.backend.modules.auth.infrastructure.persistence.RevokedTokenRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Token blacklist keyed by the SHA-256 of the raw token.
 */
@Service
public class TokenRevocationService {

    private static final Logger log = LoggerFactory.getLogger(TokenRevocationService.class);

    private final RevokedTokenRepository revokedTokenRepository;

    public TokenRevocationService(RevokedTokenRepository revokedTokenRepository) {
        this.revokedTokenRepository = revokedTokenRepository;
    }

    @Transactional(readOnly = true)
    public boolean isRevoked(String token) {
        return revokedTokenRepository.existsByTokenHash(TokenDigests.sha256Hex(token));
    }

    /**
     * Runs in its own transaction so a concurrent duplicate insert only fails this unit of work.
     *
     * @return {@code false} when the token was already revoked
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean revoke(String token, String subject, OffsetDateTime expiresAt, String reason) {
        String tokenHash = TokenDigests.sha256Hex(token);
        if (revokedTokenRepository.existsByTokenHash(tokenHash)) {
            return false;
        }
        revokedTokenRepository.save(new RevokedToken(tokenHash, subject, expiresAt, reason));
        log.info("Revoked token for subject={} reason={} expiresAt={}", subject, reason, expiresAt);
        return true;
    }

    @Transactional
    public int purgeExpired(OffsetDateTime now) {
        return revokedTokenRepository.deleteExpired(now);
    }
}
