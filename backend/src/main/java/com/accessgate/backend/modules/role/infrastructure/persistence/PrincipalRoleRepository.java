package com.accessgate.backend.modules.role.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import com.accessgate.backend.modules.role.domain.PrincipalRole;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PrincipalRoleRepository extends JpaRepository<PrincipalRole, Long> {

    /**
     * @return 1 when the assignment was written, 0 when the principal already held the role
     */
    @Modifying(flushAutomatically = true)
    @Query(value = """
            insert into principal_role (principal_id, role_id, assigned_at, created_at, updated_at)
            values (:principalId, :roleId, :now, :now, :now)
            on conflict (principal_id, role_id) do nothing
            """, nativeQuery = true)
    int insertAssignmentIfAbsent(
            @Param("principalId") Long principalId,
            @Param("roleId") Long roleId,
            @Param("now") OffsetDateTime now
    );

    @Query("""
            select pr
              from PrincipalRole pr
              join fetch pr.role
              join fetch pr.principal
              left join fetch pr.assignedBy
             where pr.principal.id = :principalId
               and pr.role.id = :roleId
            """)
    Optional<PrincipalRole> findAssignment(@Param("principalId") Long principalId, @Param("roleId") Long roleId);

    @Query("""
            select pr
              from PrincipalRole pr
              join fetch pr.role
              join fetch pr.principal
              left join fetch pr.assignedBy
             where pr.principal.id = :principalId
             order by pr.assignedAt desc
            """)
    List<PrincipalRole> findByPrincipal(@Param("principalId") Long principalId);

    @Query(value = """
            select pr
              from PrincipalRole pr
              join fetch pr.principal
              join fetch pr.role
              left join fetch pr.assignedBy
             where pr.role.id = :roleId
             order by pr.assignedAt desc
            """,
            countQuery = "select count(pr) from PrincipalRole pr where pr.role.id = :roleId")
    Page<PrincipalRole> findByRole(@Param("roleId") Long roleId, Pageable pageable);

    @Query("select case when count(pr) > 0 then true else false end from PrincipalRole pr where pr.role.id = :roleId")
    boolean existsByRole(@Param("roleId") Long roleId);

    @Query("select count(pr) from PrincipalRole pr where pr.role.id = :roleId")
    long countByRole(@Param("roleId") Long roleId);

    @Query("select count(pr) from PrincipalRole pr where pr.role.id = :roleId and pr.principal.active = true")
    long countActiveByRole(@Param("roleId") Long roleId);
}
