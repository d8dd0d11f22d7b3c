package com.lingolink.gateway.auth;

import com.lingolink.core.model.Identity;
import com.lingolink.gateway.backend.IdentityLookup;
import com.lingolink.gateway.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Test credential validation against the operator-configured secret.
 * Never accepts anything in production.
 */
public class ConfiguredTestCredentialValidator implements TestCredentialValidator {
    private static final Logger log = LoggerFactory.getLogger(ConfiguredTestCredentialValidator.class);

    static final int MIN_SECRET_LENGTH = 32;

    private final GatewayConfig config;
    private final IdentityLookup identityLookup;
    private final byte[] secret;

    public ConfiguredTestCredentialValidator(GatewayConfig config, IdentityLookup identityLookup) {
        this.config = config;
        this.identityLookup = identityLookup;
        String configured = config.getTestAuthSecret();
        this.secret = configured == null ? new byte[0] : configured.getBytes(StandardCharsets.UTF_8);

        if (isEnabled()) {
            log.warn("Test authentication is enabled for environment {}", config.getEnvironment());
            if (configured == null || configured.length() < MIN_SECRET_LENGTH) {
                log.warn("TEST_AUTH_SECRET is shorter than {} characters", MIN_SECRET_LENGTH);
            }
        }
    }

    private boolean isEnabled() {
        return config.isTestModeEnabled() && !config.isProduction();
    }

    @Override
    public Mono<Identity> validateTestSecret(String candidate, String userId) {
        if (!isEnabled()) {
            log.warn("Test credential presented while test authentication is disabled");
            return Mono.empty();
        }
        if (secret.length == 0 || candidate == null
            || !MessageDigest.isEqual(secret, candidate.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Invalid test secret presented for user {}", userId);
            return Mono.empty();
        }

        return identityLookup.findById(userId)
            .filter(Identity::isActive)
            .doOnNext(identity -> log.debug("Test credential accepted for user {}", identity.getUserId()))
            .switchIfEmpty(Mono.fromRunnable(() -> log.warn("Test user {} not found or inactive", userId)));
    }
}
