package com.accessgate.backend.modules.role.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.accessgate.backend.modules.permission.domain.Permission;
import com.accessgate.backend.modules.role.domain.Role;
import com.accessgate.backend.modules.role.domain.RolePermission;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RolePermissionRepository extends JpaRepository<RolePermission, Long> {

    @Query("""
            select case when count(rp) > 0 then true else false end
              from RolePermission rp
             where rp.role.id = :roleId
               and rp.permission.id = :permissionId
            """)
    boolean existsGrant(@Param("roleId") Long roleId, @Param("permissionId") Long permissionId);

    /**
     * @return 1 when the grant was written, 0 when it already existed
     */
    @Modifying(flushAutomatically = true)
    @Query(value = """
            insert into role_permission (role_id, permission_id, created_at, updated_at)
            values (:roleId, :permissionId, :now, :now)
            on conflict (role_id, permission_id) do nothing
            """, nativeQuery = true)
    int insertGrantIfAbsent(
            @Param("roleId") Long roleId,
            @Param("permissionId") Long permissionId,
            @Param("now") OffsetDateTime now
    );

    @Query("select rp from RolePermission rp join fetch rp.role join fetch rp.permission where rp.id = :id")
    Optional<RolePermission> findWithRoleAndPermissionById(@Param("id") Long id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from RolePermission rp where rp.role.id = :roleId and rp.permission.id in :permissionIds")
    int deleteGrants(@Param("roleId") Long roleId, @Param("permissionIds") Collection<Long> permissionIds);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from RolePermission rp where rp.role.id = :roleId")
    int deleteAllGrants(@Param("roleId") Long roleId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from RolePermission rp where rp.permission.id = :permissionId")
    int deleteAllGrantsOfPermission(@Param("permissionId") Long permissionId);

    @Query("""
            select case when count(rp) > 0 then true else false end
              from RolePermission rp
              join rp.role r
              join rp.permission p
             where r.name in :roleNames
               and p.method = :method
               and p.action = :action
            """)
    boolean existsAuthorized(
            @Param("roleNames") Collection<String> roleNames,
            @Param("method") String method,
            @Param("action") String action
    );

    @Query("""
            select distinct p
              from RolePermission rp
              join rp.role r
              join rp.permission p
             where r.name in :roleNames
             order by p.id
            """)
    List<Permission> findEffectivePermissions(@Param("roleNames") Collection<String> roleNames);

    @Query(value = """
            select p
              from RolePermission rp
              join rp.permission p
             where rp.role.id = :roleId
             order by p.action asc, p.id asc
            """,
            countQuery = "select count(rp) from RolePermission rp where rp.role.id = :roleId")
    Page<Permission> findPermissionsOfRole(@Param("roleId") Long roleId, Pageable pageable);

    @Query(value = """
            select r
              from RolePermission rp
              join rp.role r
             where rp.permission.id = :permissionId
             order by r.name asc
            """,
            countQuery = "select count(rp) from RolePermission rp where rp.permission.id = :permissionId")
    Page<Role> findRolesOfPermission(@Param("permissionId") Long permissionId, Pageable pageable);

    @Query("select r.name from RolePermission rp join rp.role r where rp.permission.id = :permissionId order by r.name")
    List<String> findRoleNamesOfPermission(@Param("permissionId") Long permissionId);

    @Query("select count(rp) from RolePermission rp where rp.role.id = :roleId")
    long countGrants(@Param("roleId") Long roleId);
}
