package com.accessgate.backend.modules.auth.domain;

/**
 * Why a bearer token was refused. Each value maps to the problem code returned to the client.
 */
public enum TokenRejection {
    REVOKED("TOKEN_REVOKED", "Token has been invalidated"),
    INVALID("INVALID_TOKEN", "Token is invalid or expired"),
    WRONG_TYPE("INVALID_TOKEN_TYPE", "Invalid token type"),
    PRINCIPAL_INACTIVE("USER_INACTIVE", "User no longer exists or is inactive"),
    ROLES_CHANGED("ROLES_CHANGED", "User roles have changed");

    private final String code;
    private final String message;

    TokenRejection(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String code() {
        return code;
    }

    public String message() {
        return message;
    }
}
