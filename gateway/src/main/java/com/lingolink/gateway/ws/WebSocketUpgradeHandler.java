package com.lingolink.gateway.ws;

import com.lingolink.gateway.auth.CredentialExtractor;
import com.lingolink.gateway.drain.ShutdownCoordinator;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.net.InetSocketAddress;

/**
 * Handles WebSocket upgrades: refuses them while draining and picks up an optional
 * credential from the request before upgrading.
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    private final WebSocketHandler wsHandler;
    private final ShutdownCoordinator shutdownCoordinator;

    public WebSocketUpgradeHandler(WebSocketHandler wsHandler, ShutdownCoordinator shutdownCoordinator) {
        this.wsHandler = wsHandler;
        this.shutdownCoordinator = shutdownCoordinator;
    }

    /**
     * Handles WebSocket upgrade request.
     *
     * @param req HTTP request
     * @param res HTTP response
     * @return Mono for upgrade
     */
    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        if (shutdownCoordinator.isDraining()) {
            log.warn("Rejecting new WebSocket connection - node is shutting down");
            return res.status(503)
                .sendString(Mono.just("Service unavailable - node is shutting down"))
                .then();
        }

        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        String credential = CredentialExtractor.fromHandshake(
            req.requestHeaders().get(HttpHeaderNames.AUTHORIZATION), decoder.parameters()
        );
        String remoteAddress = clientAddress(req);

        return res.sendWebsocket((inbound, outbound) ->
            wsHandler.handle(inbound, outbound, remoteAddress, credential)
        );
    }

    static String clientAddress(HttpServerRequest req) {
        String forwarded = req.requestHeaders().get("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        String realIp = req.requestHeaders().get("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        InetSocketAddress remote = req.remoteAddress();
        if (remote != null && remote.getAddress() != null) {
            return remote.getAddress().getHostAddress();
        }
        return "unknown";
    }
}
