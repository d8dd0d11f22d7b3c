package com.lingolink.gateway.redis;

import com.lingolink.core.redis.Keys;
import com.lingolink.gateway.config.GatewayConfig;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;

/**
 * Writes last-active timestamps to Redis with the Lettuce reactive API.
 */
public class RedisActivityRecorder implements ActivityRecorder {
    private static final Logger log = LoggerFactory.getLogger(RedisActivityRecorder.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;
    private final GatewayConfig config;

    public RedisActivityRecorder(GatewayConfig config) {
        this.config = config;
        this.client = RedisClient.create(config.getRedisUrl());
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("Connected to Redis: {}", config.getRedisUrl());
    }

    /**
     * Records the user's last activity.
     *
     * @param userId User identifier
     * @param at     Activity time
     * @return Mono completing when written
     */
    @Override
    public Mono<Void> touch(String userId, Instant at) {
        String key = Keys.activity(userId);
        return commands.hset(key, Map.of(
                "lastActive", String.valueOf(at.toEpochMilli()),
                "nodeId", config.getNodeId()
            ))
            .then(commands.expire(key, config.getActivityTtlSec()))
            .then()
            .doOnError(err -> log.debug("Failed to record activity for {}", userId, err));
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
