package com.lingolink.gateway.auth;

import lombok.Value;

/**
 * Settled result of an authentication attempt.
 */
@Value
public class AuthOutcome {
    boolean success;
    String userId;
    /**
     * Server-side failure code; {@code null} on success.
     */
    String failureCode;

    public static AuthOutcome success(String userId) {
        return new AuthOutcome(true, userId, null);
    }

    public static AuthOutcome failure(String failureCode) {
        return new AuthOutcome(false, null, failureCode);
    }
}
