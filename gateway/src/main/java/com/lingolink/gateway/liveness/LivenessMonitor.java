package com.lingolink.gateway.liveness;

import com.lingolink.core.model.DisconnectReason;
import com.lingolink.gateway.auth.AuthState;
import com.lingolink.gateway.session.Connection;
import com.lingolink.gateway.session.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Evicts authenticated connections that stopped sending heartbeats.
 * <p>
 * A connection is stale once its last heartbeat (initially its creation time) is older
 * than three intervals. Unauthenticated connections are left to the authentication
 * deadline.
 * </p>
 */
public class LivenessMonitor {
    private static final Logger log = LoggerFactory.getLogger(LivenessMonitor.class);

    static final int MISSED_INTERVALS = 3;

    private final ConnectionRegistry registry;
    private final Duration interval;
    private final Scheduler scheduler;
    private Disposable sweeps;

    public LivenessMonitor(ConnectionRegistry registry, Duration interval, Scheduler scheduler) {
        this.registry = registry;
        this.interval = interval;
        this.scheduler = scheduler;
    }

    public void start() {
        sweeps = Flux.interval(interval, interval, scheduler)
            .subscribe(tick -> sweep());
        log.info("Liveness monitor started: interval {}s, timeout {}s",
            interval.toSeconds(), interval.toSeconds() * MISSED_INTERVALS);
    }

    /**
     * Records a heartbeat for a connection.
     */
    public void heartbeat(Connection connection) {
        connection.recordHeartbeat(scheduler.now(TimeUnit.MILLISECONDS));
    }

    /**
     * Closes every stale authenticated connection.
     *
     * @return number of connections closed
     */
    public int sweep() {
        long now = scheduler.now(TimeUnit.MILLISECONDS);
        long timeoutMillis = interval.toMillis() * MISSED_INTERVALS;
        int evicted = 0;

        for (Connection connection : registry.connections()) {
            try {
                if (connection.authState() != AuthState.AUTHENTICATED) {
                    continue;
                }
                long silentFor = now - connection.lastHeartbeatMillis();
                if (silentFor > timeoutMillis
                    && registry.close(connection.getId(), DisconnectReason.HEARTBEAT_TIMEOUT)) {
                    log.warn("Connection {} silent for {}ms, closed", connection.getId(), silentFor);
                    evicted++;
                }
            } catch (RuntimeException e) {
                log.error("Liveness check failed for connection {}", connection.getId(), e);
            }
        }

        if (evicted > 0) {
            log.info("Liveness sweep evicted {} connections", evicted);
        }
        return evicted;
    }

    public void stop() {
        if (sweeps != null) {
            sweeps.dispose();
        }
        log.info("Liveness monitor stopped");
    }
}
