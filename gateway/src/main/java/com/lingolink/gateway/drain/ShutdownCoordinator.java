package com.lingolink.gateway.drain;

import com.lingolink.core.model.DisconnectReason;
import com.lingolink.core.msg.Events;
import com.lingolink.gateway.room.RoomRouter;
import com.lingolink.gateway.session.Connection;
import com.lingolink.gateway.session.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Graceful shutdown of a gateway node.
 * <p>
 * 1. Enter draining mode: upgrades and health checks answer 503<br>
 * 2. Tell every client {@code server_shutdown}<br>
 * 3. Wait the grace period so the notice flushes<br>
 * 4. Close every remaining connection with {@code server_shutdown}
 * </p>
 * Pending authentications are abandoned by the close, not awaited.
 */
public class ShutdownCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ShutdownCoordinator.class);

    private final ConnectionRegistry registry;
    private final RoomRouter router;
    private final Duration grace;
    private final Scheduler scheduler;
    private final AtomicBoolean isDraining = new AtomicBoolean(false);
    private final AtomicBoolean isDrainComplete = new AtomicBoolean(false);
    private final Sinks.Empty<Void> drained = Sinks.empty();

    public ShutdownCoordinator(ConnectionRegistry registry, RoomRouter router, Duration grace, Scheduler scheduler) {
        this.registry = registry;
        this.router = router;
        this.grace = grace;
        this.scheduler = scheduler;
    }

    /**
     * Starts the shutdown sequence. Later calls start nothing and only wait for the
     * sequence already running.
     *
     * @return Mono completing when every connection has been closed
     */
    public Mono<Void> shutdown() {
        if (!isDraining.compareAndSet(false, true)) {
            log.warn("Shutdown already in progress");
            return drained.asMono();
        }

        log.warn("Shutting down: notifying {} connections, closing them in {}ms", registry.size(), grace.toMillis());

        Map<String, Object> notice = new LinkedHashMap<>();
        notice.put("message", "Server is shutting down");
        notice.put("timestamp", Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS)));
        router.broadcastToAll(Events.Server.SERVER_SHUTDOWN, notice);

        return Mono.delay(grace, scheduler)
            .then(Mono.fromRunnable(this::closeAll));
    }

    private void closeAll() {
        int closed = 0;
        for (Connection connection : registry.connections()) {
            try {
                if (registry.close(connection.getId(), DisconnectReason.SERVER_SHUTDOWN)) {
                    closed++;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to close connection {} during shutdown: {}", connection.getId(), e.getMessage());
            }
        }
        isDrainComplete.set(true);
        drained.tryEmitEmpty();
        log.info("Shutdown drain complete, closed {} connections", closed);
    }

    public boolean isDraining() {
        return isDraining.get();
    }

    public boolean isDrainComplete() {
        return isDrainComplete.get();
    }

    public int getRemainingConnections() {
        return registry.size();
    }
}
