package com.lingolink.gateway.support;

import com.lingolink.core.auth.CredentialException;
import com.lingolink.core.auth.CredentialFailure;
import com.lingolink.gateway.RealtimeGateway;
import com.lingolink.gateway.auth.AuthenticationOrchestrator;
import com.lingolink.gateway.auth.ConfiguredTestCredentialValidator;
import com.lingolink.gateway.auth.CredentialVerifier;
import com.lingolink.gateway.auth.ICredentialVerifier;
import com.lingolink.gateway.config.GatewayConfig;
import com.lingolink.gateway.drain.ShutdownCoordinator;
import com.lingolink.gateway.handler.ClientEventDispatcher;
import com.lingolink.gateway.handler.ConversationEventHandler;
import com.lingolink.gateway.handler.PresenceEventHandler;
import com.lingolink.gateway.liveness.LivenessMonitor;
import com.lingolink.gateway.metrics.MetricsService;
import com.lingolink.gateway.notify.NotificationService;
import com.lingolink.gateway.presence.PresenceTracker;
import com.lingolink.gateway.room.RoomRouter;
import com.lingolink.gateway.session.Connection;
import com.lingolink.gateway.session.ConnectionRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import reactor.core.publisher.Mono;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A gateway node wired the way {@code GatewayApp} wires it, over in-memory
 * collaborators and a virtual clock.
 */
public class GatewayFixture {
    public static final String TEST_SECRET = "fixture-secret-0123456789abcdef-xyz";

    public final VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
    public final GatewayConfig config;
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final MetricsService metrics;
    public final StubBackend backend = new StubBackend();
    public final RecordingActivityRecorder activity = new RecordingActivityRecorder();
    public final RecordingNotificationSink notificationSink = new RecordingNotificationSink();

    public final ConnectionRegistry registry;
    public final RoomRouter router;
    public final PresenceTracker presence;
    public final ICredentialVerifier verifier;
    public final AuthenticationOrchestrator orchestrator;
    public final LivenessMonitor liveness;
    public final ShutdownCoordinator shutdown;
    public final NotificationService notifications;
    public final RealtimeGateway gateway;
    public final ClientEventDispatcher dispatcher;

    private final AtomicInteger connectionIds = new AtomicInteger();

    public GatewayFixture() {
        this(developmentConfig().build(), null);
    }

    public GatewayFixture(GatewayConfig config) {
        this(config, null);
    }

    /**
     * @param verifierOverride verifier to use instead of the configured one, or {@code null}
     */
    public GatewayFixture(GatewayConfig config, ICredentialVerifier verifierOverride) {
        this.config = config;
        this.metrics = new MetricsService(meterRegistry, config);
        this.registry = new ConnectionRegistry(config.getMaxConnectionsPerUser(), scheduler, metrics);
        this.router = new RoomRouter(registry);
        this.presence = new PresenceTracker(registry, router, backend, activity, scheduler);
        registry.addListener(router);
        registry.addListener(presence);

        this.verifier = verifierOverride != null ? verifierOverride : new CredentialVerifier(
            config,
            token -> Mono.error(new CredentialException(CredentialFailure.INVALID_SIGNATURE, "no provider in tests")),
            new ConfiguredTestCredentialValidator(config, backend),
            backend,
            scheduler
        );
        this.orchestrator = new AuthenticationOrchestrator(config, registry, verifier, activity, metrics, scheduler);
        this.liveness = new LivenessMonitor(registry, config.getHeartbeatInterval(), scheduler);
        this.shutdown = new ShutdownCoordinator(registry, router, config.getShutdownGrace(), scheduler);
        this.notifications = new NotificationService(router, notificationSink, config.getNodeId(), scheduler);
        this.gateway = new RealtimeGateway(registry, router, presence, notifications, shutdown, scheduler);
        this.dispatcher = new ClientEventDispatcher(
            orchestrator,
            registry,
            liveness,
            new ConversationEventHandler(router, backend, backend),
            new PresenceEventHandler(presence, router)
        );
    }

    public static GatewayConfig.GatewayConfigBuilder developmentConfig() {
        return GatewayConfig.builder()
            .nodeId("test-node")
            .httpPort(0)
            .environment("development")
            .authTimeoutProduction(Duration.ofSeconds(30))
            .authTimeoutDevelopment(Duration.ofSeconds(60))
            .authFailureCloseDelay(Duration.ofSeconds(1))
            .maxConnectionsPerUser(5)
            .heartbeatInterval(Duration.ofSeconds(30))
            .shutdownGrace(Duration.ofSeconds(1))
            .perConnBufferSize(16)
            .testModeEnabled(true)
            .testAuthSecret(TEST_SECRET)
            .tokenSigningKey("")
            .firebaseProjectId("")
            .verifyTimeout(Duration.ofSeconds(10))
            .clockSkewTolerance(Duration.ofMinutes(5))
            .backendBaseUrl("http://localhost:0")
            .backendTimeout(Duration.ofSeconds(5))
            .kafkaBootstrap("localhost:0")
            .notificationTopic("notifications")
            .deliveryTopic("deliveries")
            .redisUrl("redis://localhost:0")
            .activityTtlSec(60);
    }

    public static String testCredential(String userId) {
        return "test_" + TEST_SECRET + "_" + userId;
    }

    public RecordingClientConnection newTransport() {
        return new RecordingClientConnection("conn-" + connectionIds.incrementAndGet());
    }

    /**
     * Accepts a new connection without authenticating it.
     */
    public Connection accept(RecordingClientConnection transport) {
        return orchestrator.accept(transport);
    }

    /**
     * Accepts a new connection and authenticates it as {@code userId} with a test
     * credential. The user must exist in the backend.
     */
    public Connection connectAs(String userId, RecordingClientConnection transport) {
        Connection connection = orchestrator.accept(transport);
        orchestrator.authenticate(connection, testCredential(userId)).block(Duration.ofSeconds(1));
        return connection;
    }

    /**
     * Feeds a raw client frame through the dispatcher.
     */
    public void receive(Connection connection, String text) {
        dispatcher.dispatch(connection, text).block(Duration.ofSeconds(1));
    }

    public void receive(Connection connection, String event, String dataJson) {
        receive(connection, "{\"event\":\"" + event + "\",\"data\":" + dataJson + "}");
    }
}
