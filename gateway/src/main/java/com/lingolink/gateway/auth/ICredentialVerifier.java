package com.lingolink.gateway.auth;

import com.lingolink.core.model.Identity;
import reactor.core.publisher.Mono;

/**
 * Turns a bearer credential into an active identity.
 */
public interface ICredentialVerifier {

    /**
     * @param credential raw credential as the client sent it
     * @return the identity, or an error carrying a
     * {@link com.lingolink.core.auth.CredentialException}
     */
    Mono<Identity> verify(String credential);
}
