package com.accessgate.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.accessgate.backend.modules.auth.domain.PasswordResetToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PasswordResetTokenRepository extends JpaRepository<PasswordResetToken, Long> {

    @Query("select prt from PasswordResetToken prt join fetch prt.principal where prt.token = :token")
    Optional<PasswordResetToken> findWithPrincipalByToken(@Param("token") String token);

    @Modifying
    @Query("delete from PasswordResetToken prt where prt.expiresAt < :now or prt.used = true")
    int deleteExpiredOrUsed(@Param("now") OffsetDateTime now);
}
