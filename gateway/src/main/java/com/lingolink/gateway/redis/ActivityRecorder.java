package com.lingolink.gateway.redis;

import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Best-effort "last active" bookkeeping. Callers never wait on it or fail because of it.
 */
public interface ActivityRecorder {

    Mono<Void> touch(String userId, Instant at);

    /**
     * Releases underlying connections.
     */
    default void close() {
    }
}
