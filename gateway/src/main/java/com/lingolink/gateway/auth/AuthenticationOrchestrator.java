package com.lingolink.gateway.auth;

import com.lingolink.core.auth.CredentialException;
import com.lingolink.core.auth.CredentialFailure;
import com.lingolink.core.model.DisconnectReason;
import com.lingolink.core.model.Identity;
import com.lingolink.core.msg.ErrorPayload;
import com.lingolink.core.msg.Events;
import com.lingolink.gateway.config.GatewayConfig;
import com.lingolink.gateway.metrics.MetricsService;
import com.lingolink.gateway.redis.ActivityRecorder;
import com.lingolink.gateway.session.Connection;
import com.lingolink.gateway.session.ConnectionRegistry;
import com.lingolink.gateway.session.RegistrationResult;
import com.lingolink.gateway.transport.ClientConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Drives each connection through its authentication handshake.
 * <p>
 * Guarantees, per connection:
 * <ul>
 *   <li>at most one credential verification, however many {@code authenticate} signals
 *   arrive; later signals observe the first attempt's outcome</li>
 *   <li>the deadline and authentication are mutually exclusive: whichever moves the
 *   state out of {@link AuthState#CONNECTED} first wins</li>
 *   <li>a terminal failure produces exactly one {@code error} frame, then a close</li>
 * </ul>
 * </p>
 */
public class AuthenticationOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(AuthenticationOrchestrator.class);

    private final ConnectionRegistry registry;
    private final ICredentialVerifier verifier;
    private final ActivityRecorder activityRecorder;
    private final MetricsService metricsService;
    private final Scheduler scheduler;
    private final Duration authTimeout;
    private final Duration failureCloseDelay;

    public AuthenticationOrchestrator(GatewayConfig config,
                                      ConnectionRegistry registry,
                                      ICredentialVerifier verifier,
                                      ActivityRecorder activityRecorder,
                                      MetricsService metricsService,
                                      Scheduler scheduler) {
        this.registry = registry;
        this.verifier = verifier;
        this.activityRecorder = activityRecorder;
        this.metricsService = metricsService;
        this.scheduler = scheduler;
        this.authTimeout = config.authTimeout();
        this.failureCloseDelay = config.getAuthFailureCloseDelay();
    }

    /**
     * Tracks a freshly accepted transport, arms its authentication deadline and greets
     * the client with {@code connect}.
     *
     * @param transport accepted transport
     * @return the tracked connection
     */
    public Connection accept(ClientConnection transport) {
        Connection connection = registry.track(transport);
        try {
            connection.authDeadline(Mono.delay(authTimeout, scheduler)
                .subscribe(tick -> onDeadline(connection)));

            Map<String, Object> greeting = new LinkedHashMap<>();
            greeting.put("connectionId", connection.getId());
            greeting.put("timestamp", now());
            greeting.put("authTimeoutMs", authTimeout.toMillis());
            connection.emit(Events.Server.CONNECT, greeting);

            log.info("Accepted connection {} from {}, authentication due within {}ms",
                connection.getId(), connection.getRemoteAddress(), authTimeout.toMillis());
        } catch (RuntimeException e) {
            log.error("Failed to set up connection {}", connection.getId(), e);
            registry.close(connection.getId(), DisconnectReason.CONNECTION_SETUP_FAILED);
        }
        return connection;
    }

    /**
     * Handles an {@code authenticate} signal. Starts verification immediately; the
     * returned Mono only reports the outcome.
     *
     * @param connection connection that sent the signal
     * @param credential raw credential, may be {@code null}
     * @return outcome of the connection's (single) authentication attempt
     */
    public Mono<AuthOutcome> authenticate(Connection connection, String credential) {
        if (connection.isClosed()) {
            return Mono.just(AuthOutcome.failure(AuthenticationAttempt.ABANDONED));
        }

        if (connection.authState() == AuthState.AUTHENTICATED) {
            Identity identity = registry.identityOf(connection.getId());
            if (identity != null) {
                connection.emit(Events.Server.AUTHENTICATED, authenticatedPayload(identity));
                return Mono.just(AuthOutcome.success(identity.getUserId()));
            }
        }

        AuthenticationAttempt existing = connection.attempt();
        if (existing != null) {
            log.debug("Connection {} already has an authentication attempt, awaiting it", connection.getId());
            return existing.result();
        }

        AuthenticationAttempt attempt = new AuthenticationAttempt(scheduler.now(TimeUnit.MILLISECONDS));
        if (!connection.installAttempt(attempt)) {
            return connection.attempt().result();
        }

        if (!connection.transition(AuthState.CONNECTED, AuthState.AUTHENTICATING)) {
            // The deadline fired first.
            log.debug("Authentication of {} arrived after state {}", connection.getId(), connection.authState());
            attempt.settle(AuthOutcome.failure(Events.ErrorCodes.AUTHENTICATION_TIMEOUT));
            return attempt.result();
        }
        connection.cancelAuthDeadline();

        attempt.start(verifier.verify(credential)
            .map(identity -> complete(connection, identity))
            .onErrorResume(err -> Mono.just(reject(connection, err))));
        return attempt.result();
    }

    private AuthOutcome complete(Connection connection, Identity identity) {
        RegistrationResult result = registry.register(connection.getId(), identity);
        if (result == RegistrationResult.CONNECTION_CLOSED) {
            log.info("Connection {} closed while authenticating user {}", connection.getId(), identity.getUserId());
            return AuthOutcome.failure(AuthenticationAttempt.ABANDONED);
        }

        connection.transition(AuthState.AUTHENTICATING, AuthState.AUTHENTICATED);
        metricsService.recordAuthSuccess();
        connection.emit(Events.Server.AUTHENTICATED, authenticatedPayload(identity));
        AuthenticationAttempt attempt = connection.attempt();
        log.info("Connection {} authenticated as user {} in {}ms", connection.getId(), identity.getUserId(),
            attempt == null ? 0 : scheduler.now(TimeUnit.MILLISECONDS) - attempt.getStartedAtMillis());

        activityRecorder.touch(identity.getUserId(), now())
            .onErrorResume(err -> {
                log.warn("Failed to record activity for user {}: {}", identity.getUserId(), err.getMessage());
                return Mono.empty();
            })
            .subscribe();
        return AuthOutcome.success(identity.getUserId());
    }

    private AuthOutcome reject(Connection connection, Throwable err) {
        CredentialFailure failure = err instanceof CredentialException credentialError
            ? credentialError.getFailure()
            : null;
        if (failure != null) {
            log.warn("Authentication failed for connection {}: {}", connection.getId(), err.getMessage());
        } else {
            log.error("Unexpected error authenticating connection {}", connection.getId(), err);
        }
        metricsService.recordAuthFailure(failure);

        connection.transition(AuthState.AUTHENTICATING, AuthState.REJECTED);
        if (connection.isOpen()) {
            connection.emit(Events.Server.ERROR, new ErrorPayload(
                Events.ErrorCodes.AUTHENTICATION_FAILED, "Authentication failed"
            ));
            Mono.delay(failureCloseDelay, scheduler)
                .subscribe(tick -> registry.close(connection.getId(), DisconnectReason.AUTHENTICATION_FAILED));
        }
        return AuthOutcome.failure(failure == null ? "internal_error" : failure.code());
    }

    private void onDeadline(Connection connection) {
        if (!connection.transition(AuthState.CONNECTED, AuthState.REJECTED)) {
            return;
        }
        log.warn("Connection {} did not authenticate within {}ms", connection.getId(), authTimeout.toMillis());
        connection.emit(Events.Server.ERROR, new ErrorPayload(
            Events.ErrorCodes.AUTHENTICATION_TIMEOUT, "Authentication timeout"
        ));
        registry.close(connection.getId(), DisconnectReason.AUTHENTICATION_TIMEOUT);
    }

    /**
     * Resolves the identity of a connection for a guarded event. If authentication is
     * still running, waits for it.
     *
     * @return the identity, or empty when the connection is not (and will not become)
     * authenticated
     */
    public Mono<Identity> awaitIdentity(Connection connection) {
        AuthState state = connection.authState();
        if (state == AuthState.AUTHENTICATED) {
            return Mono.justOrEmpty(registry.identityOf(connection.getId()));
        }
        AuthenticationAttempt attempt = connection.attempt();
        if (state == AuthState.AUTHENTICATING && attempt != null) {
            return attempt.result()
                .filter(AuthOutcome::isSuccess)
                .flatMap(outcome -> Mono.justOrEmpty(registry.identityOf(connection.getId())));
        }
        return Mono.empty();
    }

    public boolean isAuthenticated(String connectionId) {
        Connection connection = registry.connection(connectionId);
        return connection != null && connection.authState() == AuthState.AUTHENTICATED;
    }

    public Identity identityOf(String connectionId) {
        return isAuthenticated(connectionId) ? registry.identityOf(connectionId) : null;
    }

    private Map<String, Object> authenticatedPayload(Identity identity) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", true);
        payload.put("userId", identity.getUserId());
        payload.put("timestamp", now());
        return payload;
    }

    private Instant now() {
        return Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS));
    }
}
