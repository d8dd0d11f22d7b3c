package com.lingolink.core.auth;

/**
 * Closed set of credential verification failures.
 * <p>
 * The code is only ever logged server-side; clients receive
 * {@code authentication_failed} regardless of which failure occurred.
 * </p>
 */
public enum CredentialFailure {
    MISSING_TOKEN("missing_token"),
    INVALID_TOKEN_FORMAT("invalid_token_format"),
    INVALID_TEST_TOKEN("invalid_test_token"),
    INVALID_TEST_CREDENTIALS("invalid_test_credentials"),
    MALFORMED("malformed"),
    INVALID_SIGNATURE("invalid_signature"),
    EXPIRED("expired"),
    REVOKED("revoked"),
    NOT_FOUND("not_found"),
    INACTIVE("inactive"),
    VERIFICATION_TIMEOUT("verification_timeout");

    private final String code;

    CredentialFailure(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
