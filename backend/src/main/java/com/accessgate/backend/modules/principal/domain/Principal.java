package com.accessgate.backend.modules.principal.domain;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.accessgate.backend.global.jpa.AbstractTimestampedEntity;
import com.accessgate.backend.modules.role.domain.PrincipalRole;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

/**
 * Authenticated actor. {@code externalId} is the only identifier that ever leaves the service;
 * the numeric {@code id} is storage-only.
 */
@Entity
@Table(name = "principal")
public class Principal extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "external_id", nullable = false, unique = true, updatable = false, columnDefinition = "uuid")
    private UUID externalId;

    @Column(name = "email", nullable = false, unique = true, length = 320)
    private String email;

    @Column(name = "first_name", nullable = false, length = 100)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 100)
    private String lastName;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @OneToMany(mappedBy = "principal", fetch = FetchType.LAZY)
    @OrderBy("assignedAt ASC")
    private List<PrincipalRole> roleAssignments = new ArrayList<>();

    @PrePersist
    protected void assignExternalId() {
        if (externalId == null) {
            externalId = UUID.randomUUID();
        }
    }

    public Long getId() {
        return id;
    }

    public UUID getExternalId() {
        return externalId;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getFirstName() {
        return firstName;
    }

    public void setFirstName(String firstName) {
        this.firstName = firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public void setLastName(String lastName) {
        this.lastName = lastName;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public List<PrincipalRole> getRoleAssignments() {
        return roleAssignments;
    }

    /**
     * Role names in assignment order.
     */
    public Set<String> roleNames() {
        Set<String> names = new LinkedHashSet<>();
        for (PrincipalRole assignment : roleAssignments) {
            if (assignment.getRole() != null) {
                names.add(assignment.getRole().getName());
            }
        }
        return names;
    }
}
