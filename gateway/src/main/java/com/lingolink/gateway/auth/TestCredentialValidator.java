package com.lingolink.gateway.auth;

import com.lingolink.core.model.Identity;
import reactor.core.publisher.Mono;

/**
 * Accepts development credentials of the form {@code test_<secret>_<userId>}.
 */
public interface TestCredentialValidator {

    /**
     * @return the identity of {@code userId}, or empty when the secret is rejected,
     * test mode is off or the user is unknown or inactive
     */
    Mono<Identity> validateTestSecret(String secret, String userId);
}
