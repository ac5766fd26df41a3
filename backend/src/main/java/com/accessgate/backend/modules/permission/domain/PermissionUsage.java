package com.accessgate.backend.modules.permission.domain;

/**
 * Number of role grants referencing an action.
 */
public record PermissionUsage(String action, long count) {
}
