package com.accessgate.backend.modules.role.domain;

import java.util.ArrayList;
import java.util.List;

import com.accessgate.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.Table;

/**
 * Named role. Names are uppercase letters and underscores and unique across the system.
 */
@Entity
@Table(name = "role")
public class Role extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "name", nullable = false, unique = true, length = 50)
    private String name;

    @Column(name = "description", length = 255)
    private String description;

    @OneToMany(mappedBy = "role")
    private List<RolePermission> permissionGrants = new ArrayList<>();

    @OneToMany(mappedBy = "role")
    private List<PrincipalRole> principalAssignments = new ArrayList<>();

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<RolePermission> getPermissionGrants() {
        return permissionGrants;
    }

    public List<PrincipalRole> getPrincipalAssignments() {
        return principalAssignments;
    }
}
