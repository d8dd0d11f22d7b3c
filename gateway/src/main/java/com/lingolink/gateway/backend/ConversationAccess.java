package com.lingolink.gateway.backend;

import reactor.core.publisher.Mono;

public interface ConversationAccess {

    /**
     * @return whether the user participates in the conversation
     */
    Mono<Boolean> userHasAccess(String userId, String conversationId);
}
