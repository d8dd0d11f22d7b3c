package com.lingolink.gateway;

import com.lingolink.core.auth.CredentialException;
import com.lingolink.core.auth.CredentialFailure;
import com.lingolink.gateway.auth.AuthenticationOrchestrator;
import com.lingolink.gateway.auth.ConfiguredTestCredentialValidator;
import com.lingolink.gateway.auth.CredentialVerifier;
import com.lingolink.gateway.auth.JwtProviderTokenVerifier;
import com.lingolink.gateway.auth.ProviderTokenVerifier;
import com.lingolink.gateway.backend.BackendApiClient;
import com.lingolink.gateway.config.GatewayConfig;
import com.lingolink.gateway.drain.ShutdownCoordinator;
import com.lingolink.gateway.handler.ClientEventDispatcher;
import com.lingolink.gateway.handler.ConversationEventHandler;
import com.lingolink.gateway.handler.PresenceEventHandler;
import com.lingolink.gateway.http.HttpServer;
import com.lingolink.gateway.kafka.KafkaService;
import com.lingolink.gateway.liveness.LivenessMonitor;
import com.lingolink.gateway.metrics.MetricsService;
import com.lingolink.gateway.metrics.PrometheusMetricsExporter;
import com.lingolink.gateway.notify.NotificationService;
import com.lingolink.gateway.presence.PresenceTracker;
import com.lingolink.gateway.redis.RedisActivityRecorder;
import com.lingolink.gateway.room.RoomRouter;
import com.lingolink.gateway.session.ConnectionRegistry;
import com.lingolink.gateway.ws.ClientConnectionFactory;
import com.lingolink.gateway.ws.WebSocketHandler;
import com.lingolink.gateway.ws.WebSocketUpgradeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Main entry point for a gateway node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve WebSockets at /ws and authenticate each connection once</li>
 *   <li>Track per-user connections, rooms and presence</li>
 *   <li>Apply delivery commands from business services (Kafka)</li>
 *   <li>Evict silent connections and shut down gracefully</li>
 *   <li>Expose /healthz, /readyz, /stats and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class GatewayApp {
    private static final Logger log = LoggerFactory.getLogger(GatewayApp.class);

    public static void main(String[] args) {
        GatewayConfig config = GatewayConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting gateway node: {} ({})", config.getNodeId(), config.getEnvironment());
        log.info("  Backend: {}", config.getBackendBaseUrl());
        log.info("  Kafka: {}", config.getKafkaBootstrap());
        log.info("  Redis: {}", config.getRedisUrl());

        Scheduler scheduler = Schedulers.parallel();

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config);
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config);

        BackendApiClient backend = new BackendApiClient(config);
        RedisActivityRecorder activityRecorder = new RedisActivityRecorder(config);
        KafkaService kafkaService = new KafkaService(config, metricsService);

        ConnectionRegistry registry = new ConnectionRegistry(config.getMaxConnectionsPerUser(), scheduler, metricsService);
        RoomRouter router = new RoomRouter(registry);
        PresenceTracker presenceTracker = new PresenceTracker(registry, router, backend, activityRecorder, scheduler);
        registry.addListener(router);
        registry.addListener(presenceTracker);

        CredentialVerifier credentialVerifier = new CredentialVerifier(
            config,
            providerTokenVerifier(config, scheduler),
            new ConfiguredTestCredentialValidator(config, backend),
            backend,
            scheduler
        );
        AuthenticationOrchestrator orchestrator = new AuthenticationOrchestrator(
            config, registry, credentialVerifier, activityRecorder, metricsService, scheduler
        );
        LivenessMonitor livenessMonitor = new LivenessMonitor(registry, config.getHeartbeatInterval(), scheduler);
        ShutdownCoordinator shutdownCoordinator = new ShutdownCoordinator(
            registry, router, config.getShutdownGrace(), scheduler
        );
        NotificationService notificationService = new NotificationService(
            router, kafkaService, config.getNodeId(), scheduler
        );
        RealtimeGateway gateway = new RealtimeGateway(
            registry, router, presenceTracker, notificationService, shutdownCoordinator, scheduler
        );

        ClientEventDispatcher dispatcher = new ClientEventDispatcher(
            orchestrator,
            registry,
            livenessMonitor,
            new ConversationEventHandler(router, backend, backend),
            new PresenceEventHandler(presenceTracker, router)
        );
        WebSocketHandler wsHandler = new WebSocketHandler(
            config, new ClientConnectionFactory(config, metricsService), registry, orchestrator, dispatcher
        );
        HttpServer httpServer = new HttpServer(
            config, gateway, shutdownCoordinator, metricsExporter,
            new WebSocketUpgradeHandler(wsHandler, shutdownCoordinator)
        );

        kafkaService.start(gateway::apply).block();
        httpServer.start();
        livenessMonitor.start();

        log.info("Gateway node {} is ready", config.getNodeId());

        handleShutdown(config, shutdownCoordinator, livenessMonitor, kafkaService, httpServer, activityRecorder,
            metricsExporter);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static ProviderTokenVerifier providerTokenVerifier(GatewayConfig config, Scheduler scheduler) {
        String signingKey = config.getTokenSigningKey();
        if (signingKey != null && !signingKey.isBlank()) {
            return new JwtProviderTokenVerifier(signingKey, scheduler);
        }
        if (config.isProduction()) {
            throw new IllegalStateException("TOKEN_SIGNING_KEY must be set in production");
        }
        log.warn("TOKEN_SIGNING_KEY not set, provider tokens will be rejected");
        return token -> Mono.error(new CredentialException(
            CredentialFailure.INVALID_SIGNATURE, "no signing key configured"
        ));
    }

    private static void handleShutdown(GatewayConfig config,
                                       ShutdownCoordinator shutdownCoordinator,
                                       LivenessMonitor livenessMonitor,
                                       KafkaService kafkaService,
                                       HttpServer httpServer,
                                       RedisActivityRecorder activityRecorder,
                                       PrometheusMetricsExporter metricsExporter) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, initiating graceful shutdown...");

            livenessMonitor.stop();

            // Notify and close every connection
            try {
                shutdownCoordinator.shutdown().block(Duration.ofSeconds(30));
            } catch (RuntimeException e) {
                log.warn("Connections not fully drained: {}", e.getMessage());
            }

            // Stop WS server
            httpServer.stop();

            kafkaService.stop().block(Duration.ofSeconds(10));
            activityRecorder.close();
            metricsExporter.close();

            log.info("Shutdown complete");
        }));
    }
}
