package com.lingolink.gateway.backend;

import reactor.core.publisher.Flux;

public interface SocialGraph {

    /**
     * @param userId followed user
     * @return ids of users following {@code userId}
     */
    Flux<String> followersOf(String userId);
}
