package com.accessgate.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;

import com.accessgate.backend.modules.auth.domain.RevokedToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RevokedTokenRepository extends JpaRepository<RevokedToken, Long> {

    boolean existsByTokenHash(String tokenHash);

    @Modifying
    @Query("delete from RevokedToken rt where rt.expiresAt < :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}
