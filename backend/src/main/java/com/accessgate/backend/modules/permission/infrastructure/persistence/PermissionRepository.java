package com.accessgate.backend.modules.permission.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.accessgate.backend.modules.permission.domain.Permission;
import com.accessgate.backend.modules.permission.domain.PermissionUsage;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PermissionRepository extends JpaRepository<Permission, Long> {

    Optional<Permission> findFirstByMethodAndRouteOrderByIdAsc(String method, String route);

    List<Permission> findByMethodOrderByIdAsc(String method);

    Optional<Permission> findByMethodAndRouteAndAction(String method, String route, String action);

    boolean existsByMethodAndRouteAndAction(String method, String route, String action);

    List<Permission> findAllByOrderByActionAsc();

    List<Permission> findAllByOrderByRouteAscMethodAsc();

    @Query("""
            select p
              from Permission p
             where (:method is null or p.method = :method)
               and (:actionPattern is null or p.action like :actionPattern)
               and (:modulePattern is null or p.action like :modulePattern)
            """)
    Page<Permission> search(
            @Param("method") String method,
            @Param("actionPattern") String actionPattern,
            @Param("modulePattern") String modulePattern,
            Pageable pageable
    );

    @Query("""
            select p
              from Permission p
             where not exists (
                    select 1
                      from RolePermission rp
                     where rp.permission = p
             )
             order by p.id
            """)
    List<Permission> findUnused();

    @Query("""
            select new com.accessgate.backend.modules.permission.domain.PermissionUsage(p.action, count(rp))
              from RolePermission rp
              join rp.permission p
             group by p.action
             order by count(rp) desc, p.action asc
            """)
    List<PermissionUsage> findUsageByAction();
}
