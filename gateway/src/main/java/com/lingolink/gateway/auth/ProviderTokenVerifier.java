package com.lingolink.gateway.auth;

import reactor.core.publisher.Mono;

/**
 * Cryptographic verification of identity provider tokens.
 * <p>
 * Implementations signal {@link com.lingolink.core.auth.CredentialException} for
 * rejected tokens; other errors are treated as malformed tokens.
 * </p>
 */
public interface ProviderTokenVerifier {

    Mono<VerifiedToken> verify(String token);
}
