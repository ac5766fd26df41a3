package com.accessgate.backend.modules.permission.domain;

import com.accessgate.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * (method, route pattern, action) triple. Route patterns use {@code :name} segments as single-segment wildcards
 * and are stored without the API version prefix.
 */
@Entity
@Table(
        name = "permission",
        uniqueConstraints = @UniqueConstraint(name = "uq_permission_triple", columnNames = {"method", "route", "action"})
)
public class Permission extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "method", nullable = false, length = 10)
    private String method;

    @Column(name = "route", nullable = false, length = 255)
    private String route;

    @Column(name = "action", nullable = false, length = 100)
    private String action;

    protected Permission() {
    }

    public Permission(String method, String route, String action) {
        this.method = method;
        this.route = route;
        this.action = action;
    }

    public Long getId() {
        return id;
    }

    public String getMethod() {
        return method;
    }

    public String getRoute() {
        return route;
    }

    public String getAction() {
        return action;
    }

    public String module() {
        int separator = action.indexOf(':');
        return separator > 0 ? action.substring(0, separator) : "unknown";
    }
}
