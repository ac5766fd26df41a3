package com.accessgate.backend.modules.role.infrastructure.persistence;

import java.util.Optional;

import com.accessgate.backend.modules.role.domain.Role;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoleRepository extends JpaRepository<Role, Long> {

    Optional<Role> findByName(String name);

    boolean existsByName(String name);

    boolean existsByNameAndIdNot(String name, Long id);

    @Query("""
            select r
              from Role r
             where (:searchPattern is null
                    or r.name like :searchPattern
                    or lower(r.description) like lower(:searchPattern))
            """)
    Page<Role> search(@Param("searchPattern") String searchPattern, Pageable pageable);
}
