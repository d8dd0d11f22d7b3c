package com.lingolink.gateway.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.lingolink.core.model.Identity;
import com.lingolink.core.msg.ErrorPayload;
import com.lingolink.core.msg.Events;
import com.lingolink.core.util.JsonUtils;
import com.lingolink.gateway.backend.ConversationAccess;
import com.lingolink.gateway.backend.ConversationMessages;
import com.lingolink.gateway.room.RoomRouter;
import com.lingolink.gateway.session.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conversation room membership, chat messages and typing indicators.
 */
public class ConversationEventHandler {
    private static final Logger log = LoggerFactory.getLogger(ConversationEventHandler.class);

    private final RoomRouter router;
    private final ConversationAccess access;
    private final ConversationMessages messages;

    public ConversationEventHandler(RoomRouter router, ConversationAccess access, ConversationMessages messages) {
        this.router = router;
        this.access = access;
        this.messages = messages;
    }

    public Mono<Void> join(Connection connection, Identity identity, JsonNode data) {
        String conversationId = JsonUtils.textField(data, "conversationId");
        if (conversationId == null) {
            return invalidRequest(connection, "conversationId is required");
        }
        String userId = identity.getUserId();

        return access.userHasAccess(userId, conversationId)
            .defaultIfEmpty(false)
            .doOnNext(allowed -> {
                if (!allowed) {
                    log.warn("User {} tried to join conversation {} without access", userId, conversationId);
                    connection.emit(Events.Server.ERROR, new ErrorPayload(
                        Events.ErrorCodes.NOT_PARTICIPANT, "You do not have access to this conversation"
                    ));
                    return;
                }
                if (router.addToConversation(connection.getId(), conversationId)) {
                    connection.emit(Events.Server.CONVERSATION_JOINED, Map.of("conversationId", conversationId));
                    log.debug("User {} joined conversation {}", userId, conversationId);
                }
            })
            .then()
            .onErrorResume(err -> {
                log.error("Failed to join conversation {} for user {}", conversationId, userId, err);
                connection.emit(Events.Server.ERROR, new ErrorPayload(
                    Events.ErrorCodes.INTERNAL_ERROR, "Failed to join conversation"
                ));
                return Mono.empty();
            });
    }

    public Mono<Void> leave(Connection connection, Identity identity, JsonNode data) {
        String conversationId = JsonUtils.textField(data, "conversationId");
        if (conversationId == null) {
            return invalidRequest(connection, "conversationId is required");
        }
        if (router.removeFromConversation(connection.getId(), conversationId)) {
            log.debug("User {} left conversation {}", identity.getUserId(), conversationId);
        }
        return Mono.empty();
    }

    /**
     * Persists a message, then broadcasts it to the conversation room, sender included.
     */
    public Mono<Void> sendMessage(Connection connection, Identity identity, JsonNode data) {
        String conversationId = JsonUtils.textField(data, "conversationId");
        JsonNode message = data == null ? null : data.get("message");
        if (conversationId == null || message == null || message.isNull()) {
            return invalidRequest(connection, "conversationId and message are required");
        }
        String userId = identity.getUserId();

        return access.userHasAccess(userId, conversationId)
            .defaultIfEmpty(false)
            .flatMap(allowed -> {
                if (!allowed) {
                    connection.emit(Events.Server.ERROR, new ErrorPayload(
                        Events.ErrorCodes.NOT_PARTICIPANT, "You do not have access to this conversation"
                    ));
                    return Mono.empty();
                }
                return messages.createMessage(userId, conversationId, message)
                    .doOnNext(stored -> {
                        Map<String, Object> payload = new LinkedHashMap<>();
                        payload.put("conversationId", conversationId);
                        payload.put("message", stored);
                        int delivered = router.sendToConversation(
                            conversationId, Events.Server.MESSAGE_RECEIVED, payload, null
                        );
                        log.debug("Message from {} in {} reached {} connections", userId, conversationId, delivered);
                    });
            })
            .then()
            .onErrorResume(err -> {
                log.error("Failed to send message from {} to conversation {}", userId, conversationId, err);
                connection.emit(Events.Server.ERROR, new ErrorPayload(
                    Events.ErrorCodes.MESSAGE_FAILED, "Failed to send message"
                ));
                return Mono.empty();
            });
    }

    /**
     * Relays a typing indicator to everyone in the conversation except the typist's
     * own connections.
     */
    public Mono<Void> typing(Connection connection, Identity identity, JsonNode data, boolean started) {
        String conversationId = JsonUtils.textField(data, "conversationId");
        if (conversationId == null) {
            return invalidRequest(connection, "conversationId is required");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("conversationId", conversationId);
        payload.put("userId", identity.getUserId());
        payload.put("displayName", identity.getDisplayName());
        router.sendToConversation(
            conversationId,
            started ? Events.Server.USER_TYPING : Events.Server.USER_STOPPED_TYPING,
            payload,
            identity.getUserId()
        );
        return Mono.empty();
    }

    private static Mono<Void> invalidRequest(Connection connection, String message) {
        connection.emit(Events.Server.ERROR, new ErrorPayload(Events.ErrorCodes.INVALID_REQUEST, message));
        return Mono.empty();
    }
}
