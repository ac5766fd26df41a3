package com.accessgate.backend.modules.principal.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.accessgate.backend.modules.principal.domain.Principal;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PrincipalRepository extends JpaRepository<Principal, Long> {

    Optional<Principal> findByExternalId(UUID externalId);

    @EntityGraph(attributePaths = {"roleAssignments", "roleAssignments.role"})
    @Query("select p from Principal p where p.externalId = :externalId")
    Optional<Principal> findWithRolesByExternalId(@Param("externalId") UUID externalId);

    @Query("select p from Principal p where lower(p.email) = lower(:email)")
    Optional<Principal> findByEmailIgnoreCase(@Param("email") String email);

    @EntityGraph(attributePaths = {"roleAssignments", "roleAssignments.role"})
    @Query("select p from Principal p where lower(p.email) = lower(:email)")
    Optional<Principal> findWithRolesByEmailIgnoreCase(@Param("email") String email);

    boolean existsByEmailIgnoreCase(String email);

    @Query("""
            select p
              from Principal p
             where (:searchPattern is null
                    or lower(p.email) like :searchPattern
                    or lower(p.firstName) like :searchPattern
                    or lower(p.lastName) like :searchPattern)
            """)
    Page<Principal> search(@Param("searchPattern") String searchPattern, Pageable pageable);
}
