package com.lingolink.core.auth;

import lombok.Getter;

/**
 * Raised when a credential cannot be turned into an active identity.
 */
@Getter
public class CredentialException extends RuntimeException {
    private final CredentialFailure failure;

    public CredentialException(CredentialFailure failure, String detail) {
        super(failure.code() + ": " + detail);
        this.failure = failure;
    }

    public CredentialException(CredentialFailure failure, String detail, Throwable cause) {
        super(failure.code() + ": " + detail, cause);
        this.failure = failure;
    }
}
