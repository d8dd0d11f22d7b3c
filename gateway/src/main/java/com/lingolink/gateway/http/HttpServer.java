package com.lingolink.gateway.http;

import com.lingolink.core.util.JsonUtils;
import com.lingolink.gateway.RealtimeGateway;
import com.lingolink.gateway.config.GatewayConfig;
import com.lingolink.gateway.drain.ShutdownCoordinator;
import com.lingolink.gateway.metrics.PrometheusMetricsExporter;
import com.lingolink.gateway.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.function.Function;

/**
 * HTTP server for health checks, stats, metrics, shutdown and WebSocket upgrades.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final GatewayConfig config;
    private final RealtimeGateway gateway;
    private final ShutdownCoordinator shutdownCoordinator;
    private final PrometheusMetricsExporter metricsExporter;
    private final WebSocketUpgradeHandler upgradeHandler;
    private DisposableServer server;

    /**
     * Starts the HTTP server.
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                // Liveness - fails while shutting down
                .get("/healthz", (req, res) -> {
                    if (shutdownCoordinator.isDraining()) {
                        return res.status(503).sendString(Mono.just("Draining"));
                    }
                    return res.status(200).sendString(Mono.just("OK"));
                })
                .get("/readyz", (req, res) -> {
                    if (shutdownCoordinator.isDraining()) {
                        return res.status(503).sendString(Mono.just("Not Ready - Draining"));
                    }
                    return res.status(200).sendString(Mono.just("Ready"));
                })
                .get("/stats", (req, res) -> res.status(200)
                    .header("Content-Type", "application/json")
                    .sendString(Mono.fromCallable(() -> JsonUtils.writeValueAsString(gateway.getConnectionStats()))))
                // Called by the Kubernetes preStop hook
                .post("/drain", (req, res) -> {
                    log.warn("Drain endpoint called - starting graceful shutdown");
                    int connections = shutdownCoordinator.getRemainingConnections();
                    shutdownCoordinator.shutdown()
                        .doOnError(err -> log.error("Graceful shutdown failed", err))
                        .onErrorResume(err -> Mono.empty())
                        .subscribe();
                    return res.status(202).sendString(Mono.just(String.format(
                        "Shutdown started - %d connections to close", connections
                    )));
                })
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", PrometheusMetricsExporter.CONTENT_TYPE)
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
                .get("/ws", upgradeHandler::handle)
            )
            .bindNow(Duration.ofSeconds(45));

        log.info("HTTP server started on port {}", server.port());
        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }
}
