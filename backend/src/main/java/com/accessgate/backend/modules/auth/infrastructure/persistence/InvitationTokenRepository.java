package com.accessgate.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import com.accessgate.backend.modules.auth.domain.InvitationToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InvitationTokenRepository extends JpaRepository<InvitationToken, Long> {

    Optional<InvitationToken> findByToken(String token);

    @Query("""
            select it
              from InvitationToken it
              join fetch it.createdBy
              left join fetch it.usedBy
             order by it.createdAt desc
            """)
    List<InvitationToken> findAllWithPrincipals();

    @Modifying
    @Query("delete from InvitationToken it where it.expiresAt < :now and it.used = false")
    int deleteExpiredUnused(@Param("now") OffsetDateTime now);
}
