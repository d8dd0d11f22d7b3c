package com.lingolink.gateway.backend;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Conversation history owned by the backend.
 */
public interface ConversationMessages {

    /**
     * Persists a message sent by a participant.
     *
     * @param userId         sender
     * @param conversationId target conversation
     * @param message        client-supplied message body
     * @return the stored message as the backend returns it
     */
    Mono<JsonNode> createMessage(String userId, String conversationId, JsonNode message);
}
