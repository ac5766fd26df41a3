package com.accessgate.backend.modules.auth.domain;

public enum RegistrationMode {
    PUBLIC,
    INVITATION,
    DOMAIN_WHITELIST,
    CLOSED
}
