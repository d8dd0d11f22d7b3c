package com.lingolink.gateway.handler;

import com.lingolink.core.model.DisconnectReason;
import com.lingolink.core.model.Identity;
import com.lingolink.core.msg.ErrorPayload;
import com.lingolink.core.msg.Events;
import com.lingolink.core.msg.Frame;
import com.lingolink.core.msg.FrameCodec;
import com.lingolink.gateway.auth.AuthenticationOrchestrator;
import com.lingolink.gateway.auth.CredentialExtractor;
import com.lingolink.gateway.liveness.LivenessMonitor;
import com.lingolink.gateway.session.Connection;
import com.lingolink.gateway.session.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Routes inbound client frames to their handlers.
 * <p>
 * {@code authenticate}, {@code heartbeat} and {@code graceful_disconnect} are always
 * accepted. Every other event needs an authenticated connection; while authentication
 * is in flight the event waits for its outcome.
 * </p>
 */
public class ClientEventDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ClientEventDispatcher.class);

    private final AuthenticationOrchestrator orchestrator;
    private final ConnectionRegistry registry;
    private final LivenessMonitor livenessMonitor;
    private final ConversationEventHandler conversations;
    private final PresenceEventHandler presence;

    public ClientEventDispatcher(AuthenticationOrchestrator orchestrator,
                                 ConnectionRegistry registry,
                                 LivenessMonitor livenessMonitor,
                                 ConversationEventHandler conversations,
                                 PresenceEventHandler presence) {
        this.orchestrator = orchestrator;
        this.registry = registry;
        this.livenessMonitor = livenessMonitor;
        this.conversations = conversations;
        this.presence = presence;
    }

    /**
     * Handles one inbound text frame.
     *
     * @param connection sending connection
     * @param text       raw frame
     * @return Mono completing when the frame has been handled
     */
    public Mono<Void> dispatch(Connection connection, String text) {
        Frame frame;
        try {
            frame = FrameCodec.decode(text);
        } catch (IllegalArgumentException e) {
            log.debug("Unreadable frame from {}: {}", connection.getId(), e.getMessage());
            return invalidFrame(connection);
        }
        String event = frame.getEvent();
        if (event == null || event.isBlank()) {
            return invalidFrame(connection);
        }

        switch (event) {
            case Events.Client.AUTHENTICATE -> {
                // Not awaited: a second authenticate must reach the in-flight attempt.
                orchestrator.authenticate(connection, CredentialExtractor.fromPayload(frame.getData()));
                return Mono.empty();
            }
            case Events.Client.HEARTBEAT -> {
                livenessMonitor.heartbeat(connection);
                return Mono.empty();
            }
            case Events.Client.GRACEFUL_DISCONNECT -> {
                log.info("Connection {} requested disconnect", connection.getId());
                registry.close(connection.getId(), DisconnectReason.GRACEFUL_DISCONNECT);
                return Mono.empty();
            }
            default -> {
                return orchestrator.awaitIdentity(connection)
                    .switchIfEmpty(Mono.fromRunnable(() -> unauthorized(connection, event)))
                    .flatMap(identity -> handleAuthenticated(connection, identity, frame));
            }
        }
    }

    private Mono<Void> handleAuthenticated(Connection connection, Identity identity, Frame frame) {
        String event = frame.getEvent();
        return switch (event) {
            case Events.Client.JOIN_CONVERSATION -> conversations.join(connection, identity, frame.getData());
            case Events.Client.LEAVE_CONVERSATION -> conversations.leave(connection, identity, frame.getData());
            case Events.Client.SEND_MESSAGE -> conversations.sendMessage(connection, identity, frame.getData());
            case Events.Client.TYPING_START -> conversations.typing(connection, identity, frame.getData(), true);
            case Events.Client.TYPING_END -> conversations.typing(connection, identity, frame.getData(), false);
            case Events.Client.SET_STATUS -> presence.setStatus(connection, identity, frame.getData());
            case Events.Client.SUBSCRIBE_NOTIFICATIONS -> presence.subscribeNotifications(connection, identity);
            default -> {
                log.warn("Unknown event '{}' from connection {}", event, connection.getId());
                yield Mono.empty();
            }
        };
    }

    private void unauthorized(Connection connection, String event) {
        log.debug("Rejecting {} from unauthenticated connection {}", event, connection.getId());
        connection.emit(Events.Server.ERROR, new ErrorPayload(
            Events.ErrorCodes.UNAUTHORIZED, "Authentication required"
        ));
    }

    private static Mono<Void> invalidFrame(Connection connection) {
        connection.emit(Events.Server.ERROR, new ErrorPayload(
            Events.ErrorCodes.INVALID_FRAME, "Frames must be JSON objects with an event name"
        ));
        return Mono.empty();
    }
}
