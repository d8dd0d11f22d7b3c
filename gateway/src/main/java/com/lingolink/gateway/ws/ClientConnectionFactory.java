package com.lingolink.gateway.ws;

import com.lingolink.gateway.config.GatewayConfig;
import com.lingolink.gateway.metrics.MetricsService;
import reactor.core.publisher.Sinks;

import java.util.UUID;

/**
 * Creates transport-side connections for accepted WebSockets.
 * <p>
 * Separated from the handler so buffer sizing lives in one place.
 * </p>
 */
public class ClientConnectionFactory {
    private final GatewayConfig config;
    private final MetricsService metricsService;

    public ClientConnectionFactory(GatewayConfig config, MetricsService metricsService) {
        this.config = config;
        this.metricsService = metricsService;
    }

    /**
     * @param remoteAddress client address as seen by the gateway
     * @return connection with a fresh id and a bounded outbound buffer
     */
    public WebSocketClientConnection create(String remoteAddress) {
        Sinks.Many<String> sink = Sinks.many().multicast().onBackpressureBuffer(
            config.getPerConnBufferSize(), false
        );

        return new WebSocketClientConnection(UUID.randomUUID().toString(), remoteAddress, sink, metricsService);
    }
}
