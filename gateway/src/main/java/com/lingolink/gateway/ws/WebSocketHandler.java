package com.lingolink.gateway.ws;

import com.lingolink.core.model.DisconnectReason;
import com.lingolink.gateway.auth.AuthenticationOrchestrator;
import com.lingolink.gateway.config.GatewayConfig;
import com.lingolink.gateway.handler.ClientEventDispatcher;
import com.lingolink.gateway.session.Connection;
import com.lingolink.gateway.session.ConnectionRegistry;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

/**
 * WebSocket handler for client connections.
 * <p>
 * Frames in both directions are JSON {@code {"event", "data"}} text frames. Inbound
 * frames of one connection are handled strictly in order.
 * </p>
 */
public class WebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

    private final GatewayConfig config;
    private final ClientConnectionFactory connectionFactory;
    private final ConnectionRegistry registry;
    private final AuthenticationOrchestrator orchestrator;
    private final ClientEventDispatcher dispatcher;

    public WebSocketHandler(GatewayConfig config,
                            ClientConnectionFactory connectionFactory,
                            ConnectionRegistry registry,
                            AuthenticationOrchestrator orchestrator,
                            ClientEventDispatcher dispatcher) {
        this.config = config;
        this.connectionFactory = connectionFactory;
        this.registry = registry;
        this.orchestrator = orchestrator;
        this.dispatcher = dispatcher;
    }

    /**
     * Handles the lifecycle of one WebSocket.
     *
     * @param inbound             WebSocket inbound
     * @param outbound            WebSocket outbound
     * @param remoteAddress       client address
     * @param handshakeCredential credential from the upgrade request, or {@code null}
     * @return Publisher completing when the socket is done
     */
    public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound,
                                  String remoteAddress, String handshakeCredential) {
        WebSocketClientConnection transport = connectionFactory.create(remoteAddress);
        Connection connection = orchestrator.accept(transport);
        String connectionId = connection.getId();

        MDC.put("connectionId", connectionId);
        try {
            inbound.withConnection(nettyConnection -> nettyConnection.onDispose(() -> {
                log.debug("WebSocket disposed for connection {}", connectionId);
                transport.markTransportClosed();
                registry.close(connectionId, DisconnectReason.TRANSPORT_CLOSED);
            }));

            if (handshakeCredential != null) {
                orchestrator.authenticate(connection, handshakeCredential);
            }
        } finally {
            MDC.remove("connectionId");
        }

        Mono<Void> send = outbound.sendString(transport.outboundFlux())
            .then()
            .then(Mono.defer(() -> outbound.sendClose(transport.closeStatus(), transport.closeReasonText())))
            .onErrorResume(err -> {
                if (!(err instanceof AbortedException)) {
                    log.warn("Outbound stream of connection {} failed: {}", connectionId, err.getMessage());
                }
                return Mono.empty();
            });

        Mono<Void> receive = receiveFrames(connection, inbound.aggregateFrames().receive().asString());

        return Mono.when(send, receive)
            .doFinally(signal -> registry.close(connectionId, DisconnectReason.TRANSPORT_CLOSED));
    }

    /**
     * Dispatches inbound text frames one at a time. A frame whose handling fails, even
     * synchronously, is logged and skipped; the stream only ends with the socket.
     */
    Mono<Void> receiveFrames(Connection connection, Flux<String> frames) {
        String connectionId = connection.getId();
        return frames
            .onBackpressureBuffer(config.getPerConnBufferSize())
            .concatMap(text -> Mono.defer(() -> dispatcher.dispatch(connection, text)).onErrorResume(err -> {
                log.warn("Error processing frame from {}: {}", connectionId, err.getMessage());
                return Mono.empty();
            }))
            .doOnError(err -> {
                // AbortedException is expected on close
                if (!(err instanceof AbortedException)) {
                    log.error("Fatal error in inbound stream for {}", connectionId, err);
                }
            })
            .onErrorResume(err -> Mono.empty())
            .then();
    }
}
