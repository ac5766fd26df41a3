package com.accessgate.backend.modules.auth.application;

import com.accessgate.backend.global.error.ProblemException;
import com.accessgate.backend.modules.auth.domain.TokenRejection;

import org.springframework.http.HttpStatus;

public class InvalidTokenException extends ProblemException {

    private final TokenRejection rejection;

    public InvalidTokenException(TokenRejection rejection) {
        this(rejection, null);
    }

    public InvalidTokenException(TokenRejection rejection, Throwable cause) {
        super(HttpStatus.UNAUTHORIZED, rejection.code(), rejection.message(), cause);
        this.rejection = rejection;
    }

    public TokenRejection getRejection() {
        return rejection;
    }
}
