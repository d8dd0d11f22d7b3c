package com.lingolink.gateway.auth;

import com.lingolink.core.auth.CredentialException;
import com.lingolink.core.auth.CredentialFailure;
import com.lingolink.core.model.Identity;
import com.lingolink.gateway.backend.IdentityLookup;
import com.lingolink.gateway.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves bearer credentials to active identities.
 * <p>
 * Two credential kinds are accepted:
 * <ul>
 *   <li>provider tokens: signed JWTs, verified by a {@link ProviderTokenVerifier} within
 *   the verification timeout, then checked for expiry, issue time, audience and issuer</li>
 *   <li>development credentials {@code test_<secret>_<userId>}, recognized only outside
 *   production</li>
 * </ul>
 * Every rejection is a {@link CredentialException}; errors from identity lookup are
 * propagated as they are.
 * </p>
 */
public class CredentialVerifier implements ICredentialVerifier {
    private static final Logger log = LoggerFactory.getLogger(CredentialVerifier.class);

    static final String TEST_PREFIX = "test_";
    static final String ISSUER_PREFIX = "https://securetoken.google.com/";

    private final GatewayConfig config;
    private final ProviderTokenVerifier providerVerifier;
    private final TestCredentialValidator testValidator;
    private final IdentityLookup identityLookup;
    private final Scheduler scheduler;

    public CredentialVerifier(GatewayConfig config,
                              ProviderTokenVerifier providerVerifier,
                              TestCredentialValidator testValidator,
                              IdentityLookup identityLookup,
                              Scheduler scheduler) {
        this.config = config;
        this.providerVerifier = providerVerifier;
        this.testValidator = testValidator;
        this.identityLookup = identityLookup;
        this.scheduler = scheduler;
    }

    @Override
    public Mono<Identity> verify(String credential) {
        return Mono.defer(() -> {
            if (credential == null || credential.isBlank()) {
                return Mono.error(new CredentialException(CredentialFailure.MISSING_TOKEN, "no credential supplied"));
            }
            String token = credential.trim();
            if (!config.isProduction() && token.startsWith(TEST_PREFIX)) {
                return verifyTestCredential(token);
            }
            return verifyProviderToken(token);
        });
    }

    private Mono<Identity> verifyTestCredential(String token) {
        String[] parts = token.split("_", -1);
        if (parts.length != 3 || parts[1].isEmpty() || parts[2].isEmpty()) {
            return Mono.error(new CredentialException(
                CredentialFailure.INVALID_TEST_TOKEN, "expected test_<secret>_<userId>"
            ));
        }
        String userId = parts[2];
        log.debug("Verifying test credential for user {}", userId);

        return testValidator.validateTestSecret(parts[1], userId)
            .switchIfEmpty(Mono.error(() -> new CredentialException(
                CredentialFailure.INVALID_TEST_CREDENTIALS, "test credential rejected for user " + userId
            )));
    }

    private Mono<Identity> verifyProviderToken(String token) {
        if (!hasJwtShape(token)) {
            return Mono.error(new CredentialException(
                CredentialFailure.INVALID_TOKEN_FORMAT, "expected three dot-separated segments"
            ));
        }

        return providerVerifier.verify(token)
            .timeout(config.getVerifyTimeout(), scheduler)
            .onErrorMap(err -> !(err instanceof CredentialException), err -> err instanceof TimeoutException
                ? new CredentialException(CredentialFailure.VERIFICATION_TIMEOUT,
                    "no answer within " + config.getVerifyTimeout().toMillis() + "ms", err)
                : new CredentialException(CredentialFailure.MALFORMED, "provider rejected token", err))
            .map(this::checkClaims)
            .flatMap(verified -> identityLookup.findByFirebaseUid(verified.getSubject())
                .switchIfEmpty(Mono.error(() -> new CredentialException(
                    CredentialFailure.NOT_FOUND, "no user for subject " + verified.getSubject()
                ))))
            .flatMap(identity -> identity.isActive()
                ? Mono.just(identity)
                : Mono.error(new CredentialException(
                    CredentialFailure.INACTIVE, "user " + identity.getUserId() + " is deactivated"
                )));
    }

    private VerifiedToken checkClaims(VerifiedToken token) {
        Instant now = Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS));

        if (token.getSubject() == null || token.getSubject().isBlank()) {
            throw new CredentialException(CredentialFailure.MALFORMED, "token has no subject");
        }
        if (token.getExpiresAt() != null && token.getExpiresAt().isBefore(now)) {
            throw new CredentialException(CredentialFailure.EXPIRED, "expired at " + token.getExpiresAt());
        }
        if (token.getIssuedAt() != null && token.getIssuedAt().isAfter(now.plus(config.getClockSkewTolerance()))) {
            throw new CredentialException(CredentialFailure.MALFORMED, "issued in the future: " + token.getIssuedAt());
        }

        String projectId = config.getFirebaseProjectId();
        if (projectId != null && !projectId.isBlank()) {
            if (!token.getAudience().contains(projectId)) {
                throw new CredentialException(CredentialFailure.MALFORMED, "audience " + token.getAudience());
            }
            if (!(ISSUER_PREFIX + projectId).equals(token.getIssuer())) {
                throw new CredentialException(CredentialFailure.MALFORMED, "issuer " + token.getIssuer());
            }
        }
        return token;
    }

    static boolean hasJwtShape(String token) {
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            return false;
        }
        for (String part : parts) {
            if (part.isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
