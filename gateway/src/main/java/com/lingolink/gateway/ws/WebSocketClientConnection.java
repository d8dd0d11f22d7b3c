package com.lingolink.gateway.ws;

import com.lingolink.core.model.DisconnectReason;
import com.lingolink.gateway.metrics.MetricsService;
import com.lingolink.gateway.transport.ClientConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ClientConnection} over a Reactor Netty WebSocket.
 * <p>
 * Frames go through a bounded multicast sink that the WebSocket outbound subscribes to;
 * frames queued before the outbound subscribes are kept until it does.
 * </p>
 */
public class WebSocketClientConnection implements ClientConnection {
    private static final Logger log = LoggerFactory.getLogger(WebSocketClientConnection.class);

    /** Normal closure. */
    static final int CLOSE_NORMAL = 1000;
    /** Endpoint going away (shutdown). */
    static final int CLOSE_GOING_AWAY = 1001;
    /** Policy violation (authentication, limits, liveness). */
    static final int CLOSE_POLICY_VIOLATION = 1008;

    private final String id;
    private final String remoteAddress;
    private final Sinks.Many<String> sink;
    private final MetricsService metricsService;
    private final AtomicBoolean connected = new AtomicBoolean(true);
    private volatile DisconnectReason closeReason;

    public WebSocketClientConnection(String id, String remoteAddress, Sinks.Many<String> sink,
                                     MetricsService metricsService) {
        this.id = id;
        this.remoteAddress = remoteAddress;
        this.sink = sink;
        this.metricsService = metricsService;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String remoteAddress() {
        return remoteAddress;
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    @Override
    public boolean send(String frame) {
        if (!connected.get()) {
            metricsService.recordFrameDropped();
            return false;
        }
        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(frame);
        }
        if (result.isFailure()) {
            log.warn("Dropping frame for connection {}: {}", id, result);
            metricsService.recordFrameDropped();
            return false;
        }
        metricsService.recordFrameDelivered();
        return true;
    }

    @Override
    public void disconnect(DisconnectReason reason) {
        if (connected.compareAndSet(true, false)) {
            closeReason = reason;
            synchronized (sink) {
                sink.tryEmitComplete();
            }
        }
    }

    /**
     * Called when the socket is gone; completes the outbound stream without a close frame.
     */
    void markTransportClosed() {
        disconnect(DisconnectReason.TRANSPORT_CLOSED);
    }

    Flux<String> outboundFlux() {
        return sink.asFlux();
    }

    /**
     * @return WebSocket close status for the reason the gateway closed with
     */
    int closeStatus() {
        DisconnectReason reason = closeReason;
        if (reason == null) {
            return CLOSE_NORMAL;
        }
        return switch (reason) {
            case SERVER_SHUTDOWN -> CLOSE_GOING_AWAY;
            case AUTHENTICATION_FAILED, AUTHENTICATION_TIMEOUT, CONNECTION_LIMIT_EXCEEDED, HEARTBEAT_TIMEOUT ->
                CLOSE_POLICY_VIOLATION;
            default -> CLOSE_NORMAL;
        };
    }

    String closeReasonText() {
        DisconnectReason reason = closeReason;
        return reason == null ? "" : reason.code();
    }
}
