package com.accessgate.backend.modules.auth.application;

import com.accessgate.backend.modules.principal.domain.Principal;

/**
 * Invitation check used by registration when the registration mode is {@code INVITATION}.
 */
public interface InvitationTokenGateway {

    boolean validate(String token);

    boolean consume(String token, Principal principal);
}
