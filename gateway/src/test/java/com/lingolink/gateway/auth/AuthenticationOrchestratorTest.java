package com.lingolink.gateway.auth;

import com.lingolink.core.metrics.MetricsNames;
import com.lingolink.core.metrics.MetricsTags;
import com.lingolink.core.model.DisconnectReason;
import com.lingolink.core.model.Identity;
import com.lingolink.core.msg.Events;
import com.lingolink.core.msg.Frame;
import com.lingolink.gateway.session.Connection;
import com.lingolink.gateway.support.GatewayFixture;
import com.lingolink.gateway.support.RecordingClientConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link AuthenticationOrchestrator}: one verification per connection,
 * deadline exclusivity and the failure sequence.
 */
class AuthenticationOrchestratorTest {

    private GatewayFixture fixture;
    private Identity alice;

    @BeforeEach
    void setUp() {
        fixture = new GatewayFixture();
        alice = fixture.backend.addUser("alice", "Alice");
    }

    @Test
    void testAccept_GreetsWithConnectionIdAndDeadline() {
        RecordingClientConnection transport = fixture.newTransport();

        Connection connection = fixture.accept(transport);

        Frame connect = transport.lastFrame();
        assertEquals(Events.Server.CONNECT, connect.getEvent());
        assertEquals(connection.getId(), connect.getData().get("connectionId").asText());
        assertEquals(60_000L, connect.getData().get("authTimeoutMs").asLong());
        assertEquals(AuthState.CONNECTED, connection.authState());
    }

    @Test
    void testAccept_ProductionUsesShorterDeadline() {
        GatewayFixture production = new GatewayFixture(GatewayFixture.developmentConfig()
            .environment("production")
            .build());
        RecordingClientConnection transport = production.newTransport();

        production.accept(transport);

        assertEquals(30_000L, transport.lastFrame().getData().get("authTimeoutMs").asLong());
    }

    @Test
    void testAuthenticate_SuccessRegistersAndConfirms() {
        RecordingClientConnection transport = fixture.newTransport();
        Connection connection = fixture.accept(transport);

        AuthOutcome outcome = fixture.orchestrator
            .authenticate(connection, GatewayFixture.testCredential("alice"))
            .block(Duration.ofSeconds(1));

        assertTrue(outcome.isSuccess());
        assertEquals("alice", outcome.getUserId());
        assertEquals(AuthState.AUTHENTICATED, connection.authState());
        assertEquals(List.of(Events.Server.CONNECT, Events.Server.AUTHENTICATED), transport.events());
        assertTrue(transport.lastFrame().getData().get("success").asBoolean());
        assertEquals("alice", transport.lastFrame().getData().get("userId").asText());
        assertEquals(List.of(connection.getId()), fixture.registry.socketsFor("alice"));
        assertEquals(List.of("alice"), fixture.activity.touchedUsers());
        assertEquals(1.0, fixture.meterRegistry.get(MetricsNames.AUTH_TOTAL)
            .tag(MetricsTags.OUTCOME, "success").counter().count());
    }

    @Test
    void testAuthenticate_ActivityFailureDoesNotFailAuthentication() {
        fixture.activity.fail();
        RecordingClientConnection transport = fixture.newTransport();
        Connection connection = fixture.accept(transport);

        AuthOutcome outcome = fixture.orchestrator
            .authenticate(connection, GatewayFixture.testCredential("alice"))
            .block(Duration.ofSeconds(1));

        assertTrue(outcome.isSuccess());
        assertEquals(AuthState.AUTHENTICATED, connection.authState());
    }

    @Test
    void testAuthenticate_ConcurrentSignalsShareOneVerification() {
        ControlledVerifier verifier = new ControlledVerifier();
        GatewayFixture controlled = new GatewayFixture(GatewayFixture.developmentConfig().build(), verifier);
        RecordingClientConnection transport = controlled.newTransport();
        Connection connection = controlled.accept(transport);

        Mono<AuthOutcome> first = controlled.orchestrator.authenticate(connection, "token-a");
        Mono<AuthOutcome> second = controlled.orchestrator.authenticate(connection, "token-b");
        assertEquals(AuthState.AUTHENTICATING, connection.authState());

        verifier.succeed(alice);

        assertEquals("alice", first.block(Duration.ofSeconds(1)).getUserId());
        assertEquals("alice", second.block(Duration.ofSeconds(1)).getUserId());
        assertEquals(1, verifier.calls.get());
        assertEquals(1, transport.framesOf(Events.Server.AUTHENTICATED).size());
    }

    @Test
    void testAuthenticate_RepeatAfterSuccessReconfirmsWithoutVerifying() {
        ControlledVerifier verifier = new ControlledVerifier();
        GatewayFixture controlled = new GatewayFixture(GatewayFixture.developmentConfig().build(), verifier);
        RecordingClientConnection transport = controlled.newTransport();
        Connection connection = controlled.accept(transport);
        controlled.orchestrator.authenticate(connection, "token");
        verifier.succeed(alice);

        AuthOutcome again = controlled.orchestrator.authenticate(connection, "token").block(Duration.ofSeconds(1));

        assertTrue(again.isSuccess());
        assertEquals(1, verifier.calls.get());
        assertEquals(2, transport.framesOf(Events.Server.AUTHENTICATED).size());
    }

    @Test
    void testDeadline_ClosesUnauthenticatedConnection() {
        RecordingClientConnection transport = fixture.newTransport();
        Connection connection = fixture.accept(transport);

        fixture.scheduler.advanceTimeBy(Duration.ofSeconds(59));
        assertTrue(transport.isConnected());

        fixture.scheduler.advanceTimeBy(Duration.ofSeconds(1));

        assertEquals(List.of(Events.Server.CONNECT, Events.Server.ERROR, Events.Server.DISCONNECT_REASON),
            transport.events());
        assertEquals(Events.ErrorCodes.AUTHENTICATION_TIMEOUT,
            transport.framesOf(Events.Server.ERROR).get(0).getData().get("code").asText());
        assertEquals(DisconnectReason.AUTHENTICATION_TIMEOUT, transport.disconnectReason());
        assertEquals(AuthState.REJECTED, connection.authState());
        assertNull(fixture.registry.connection(connection.getId()));
    }

    @Test
    void testDeadline_DoesNotFireOnceVerificationStarted() {
        ControlledVerifier verifier = new ControlledVerifier();
        GatewayFixture controlled = new GatewayFixture(GatewayFixture.developmentConfig().build(), verifier);
        RecordingClientConnection transport = controlled.newTransport();
        Connection connection = controlled.accept(transport);

        Mono<AuthOutcome> outcome = controlled.orchestrator.authenticate(connection, "slow-token");
        controlled.scheduler.advanceTimeBy(Duration.ofMinutes(5));

        assertTrue(transport.isConnected());
        assertTrue(transport.framesOf(Events.Server.ERROR).isEmpty());

        verifier.succeed(alice);
        assertTrue(outcome.block(Duration.ofSeconds(1)).isSuccess());
        assertEquals(AuthState.AUTHENTICATED, connection.authState());
    }

    @Test
    void testAuthenticate_AfterDeadlineIsAbandoned() {
        RecordingClientConnection transport = fixture.newTransport();
        Connection connection = fixture.accept(transport);
        fixture.scheduler.advanceTimeBy(Duration.ofSeconds(60));

        AuthOutcome outcome = fixture.orchestrator
            .authenticate(connection, GatewayFixture.testCredential("alice"))
            .block(Duration.ofSeconds(1));

        assertFalse(outcome.isSuccess());
        assertEquals(AuthenticationAttempt.ABANDONED, outcome.getFailureCode());
        assertTrue(fixture.registry.socketsFor("alice").isEmpty());
    }

    @Test
    void testAuthenticate_FailureSendsOneErrorThenClosesAfterDelay() {
        RecordingClientConnection transport = fixture.newTransport();
        Connection connection = fixture.accept(transport);

        AuthOutcome outcome = fixture.orchestrator
            .authenticate(connection, "test_wrong-secret_alice")
            .block(Duration.ofSeconds(1));

        assertEquals("invalid_test_credentials", outcome.getFailureCode());
        assertEquals(AuthState.REJECTED, connection.authState());
        assertEquals(Events.ErrorCodes.AUTHENTICATION_FAILED,
            transport.lastFrame().getData().get("code").asText());
        assertTrue(transport.isConnected());

        // A retry observes the settled attempt and produces nothing new
        fixture.orchestrator.authenticate(connection, GatewayFixture.testCredential("alice"))
            .block(Duration.ofSeconds(1));

        fixture.scheduler.advanceTimeBy(Duration.ofSeconds(1));

        assertEquals(DisconnectReason.AUTHENTICATION_FAILED, transport.disconnectReason());
        assertEquals(1, transport.framesOf(Events.Server.ERROR).size());
        assertTrue(fixture.registry.socketsFor("alice").isEmpty());

        fixture.scheduler.advanceTimeBy(Duration.ofMinutes(2));
        assertEquals(1, transport.framesOf(Events.Server.ERROR).size());
        assertEquals(1.0, fixture.meterRegistry.get(MetricsNames.AUTH_TOTAL)
            .tag(MetricsTags.REASON, "invalid_test_credentials").counter().count());
    }

    @Test
    void testAuthenticate_MissingCredentialFails() {
        RecordingClientConnection transport = fixture.newTransport();
        Connection connection = fixture.accept(transport);

        AuthOutcome outcome = fixture.orchestrator.authenticate(connection, null).block(Duration.ofSeconds(1));

        assertEquals("missing_token", outcome.getFailureCode());
        assertEquals(Events.Server.ERROR, transport.lastFrame().getEvent());
    }

    @Test
    void testClose_DuringVerificationAbandonsAttempt() {
        ControlledVerifier verifier = new ControlledVerifier();
        GatewayFixture controlled = new GatewayFixture(GatewayFixture.developmentConfig().build(), verifier);
        RecordingClientConnection transport = controlled.newTransport();
        Connection connection = controlled.accept(transport);
        Mono<AuthOutcome> outcome = controlled.orchestrator.authenticate(connection, "token");

        transport.dropFromClientSide();
        controlled.registry.close(connection.getId(), DisconnectReason.TRANSPORT_CLOSED);
        verifier.succeed(alice);

        assertEquals(AuthenticationAttempt.ABANDONED, outcome.block(Duration.ofSeconds(1)).getFailureCode());
        assertTrue(controlled.registry.socketsFor("alice").isEmpty());
        assertFalse(controlled.registry.isRegistered(connection.getId()));
        assertTrue(transport.framesOf(Events.Server.AUTHENTICATED).isEmpty());
    }

    @Test
    void testAwaitIdentity_WaitsForInFlightAuthentication() {
        ControlledVerifier verifier = new ControlledVerifier();
        GatewayFixture controlled = new GatewayFixture(GatewayFixture.developmentConfig().build(), verifier);
        Connection connection = controlled.accept(controlled.newTransport());
        controlled.orchestrator.authenticate(connection, "token");

        StepVerifier.create(controlled.orchestrator.awaitIdentity(connection))
            .then(() -> verifier.succeed(alice))
            .expectNextMatches(identity -> "alice".equals(identity.getUserId()))
            .verifyComplete();
    }

    @Test
    void testAwaitIdentity_EmptyBeforeAuthenticate() {
        Connection connection = fixture.accept(fixture.newTransport());

        StepVerifier.create(fixture.orchestrator.awaitIdentity(connection))
            .verifyComplete();
        assertFalse(fixture.orchestrator.isAuthenticated(connection.getId()));
        assertNull(fixture.orchestrator.identityOf(connection.getId()));
    }

    /**
     * Verifier whose answer the test controls; counts invocations.
     */
    private static class ControlledVerifier implements ICredentialVerifier {
        private final Sinks.One<Identity> result = Sinks.one();
        private final AtomicInteger calls = new AtomicInteger();

        @Override
        public Mono<Identity> verify(String credential) {
            calls.incrementAndGet();
            return result.asMono();
        }

        void succeed(Identity identity) {
            result.tryEmitValue(identity);
        }
    }
}
