package com.lingolink.gateway.session;

import com.lingolink.core.model.DisconnectReason;
import com.lingolink.core.model.Identity;
import com.lingolink.core.msg.Events;
import com.lingolink.gateway.auth.AuthenticationAttempt;
import com.lingolink.gateway.metrics.MetricsService;
import com.lingolink.gateway.transport.ClientConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Owns every live connection on this node and the connection/identity mappings.
 * <p>
 * A user's connection list is replaced as a whole inside
 * {@link ConcurrentHashMap#compute}, so cap enforcement (choosing the victim and adding
 * the newcomer) is one atomic step per user. {@link #close} is the only teardown path.
 * </p>
 */
public class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private static final Comparator<Connection> OLDEST_FIRST = Comparator
        .comparingLong(Connection::getCreatedAtMillis)
        .thenComparingLong(Connection::getAcceptSequence);

    private final int maxConnectionsPerUser;
    private final Scheduler scheduler;
    private final MetricsService metricsService;

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final Map<String, Identity> identities = new ConcurrentHashMap<>();
    private final Map<String, List<String>> userConnections = new ConcurrentHashMap<>();
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong acceptSequence = new AtomicLong();

    public ConnectionRegistry(int maxConnectionsPerUser, Scheduler scheduler, MetricsService metricsService) {
        if (maxConnectionsPerUser < 1) {
            throw new IllegalArgumentException("maxConnectionsPerUser must be positive: " + maxConnectionsPerUser);
        }
        this.maxConnectionsPerUser = maxConnectionsPerUser;
        this.scheduler = scheduler;
        this.metricsService = metricsService;
        metricsService.registerConnectionGauge(connections::size);
    }

    public void addListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    /**
     * Records a freshly accepted transport.
     *
     * @param transport accepted client transport
     * @return the tracked connection
     */
    public Connection track(ClientConnection transport) {
        Connection connection = new Connection(
            transport, scheduler.now(TimeUnit.MILLISECONDS), acceptSequence.incrementAndGet()
        );
        connections.put(connection.getId(), connection);
        metricsService.recordConnectionAccepted();
        log.debug("Tracking connection {} from {}", connection.getId(), connection.getRemoteAddress());
        return connection;
    }

    /**
     * Binds an identity to a tracked connection, enforcing the per-user cap.
     * <p>
     * When the user is at the cap, the oldest connection (creation time, then accept
     * sequence) is closed with {@link DisconnectReason#CONNECTION_LIMIT_EXCEEDED} before
     * this method returns.
     * </p>
     *
     * @param connectionId connection to register
     * @param identity     verified identity
     * @return registration result
     */
    public RegistrationResult register(String connectionId, Identity identity) {
        Connection connection = connections.get(connectionId);
        if (connection == null || connection.isClosed()) {
            return RegistrationResult.CONNECTION_CLOSED;
        }
        if (identities.putIfAbsent(connectionId, identity) != null) {
            return RegistrationResult.ALREADY_REGISTERED;
        }

        String userId = identity.getUserId();
        AtomicBoolean firstConnection = new AtomicBoolean(false);
        List<String> evicted = new ArrayList<>(1);

        userConnections.compute(userId, (uid, current) -> {
            List<String> next = current == null ? new ArrayList<>() : new ArrayList<>(current);
            firstConnection.set(next.isEmpty());
            evicted.clear();
            while (next.size() >= maxConnectionsPerUser) {
                String oldest = oldestOf(next);
                next.remove(oldest);
                evicted.add(oldest);
            }
            next.add(connectionId);
            return List.copyOf(next);
        });

        for (String victim : evicted) {
            log.warn("User {} exceeded {} connections, evicting oldest connection {}",
                userId, maxConnectionsPerUser, victim);
            close(victim, DisconnectReason.CONNECTION_LIMIT_EXCEEDED);
        }

        if (connection.isClosed()) {
            // Closed while registering; its own close may have run before the mapping existed.
            identities.remove(connectionId, identity);
            if (detachFromUser(userId, connectionId) && !firstConnection.get()) {
                notifyListeners(listener -> listener.userOffline(userId));
            }
            return RegistrationResult.CONNECTION_CLOSED;
        }

        log.info("Registered connection {} for user {}", connectionId, userId);
        if (firstConnection.get()) {
            notifyListeners(listener -> listener.userOnline(identity));
        }
        return RegistrationResult.REGISTERED;
    }

    private String oldestOf(List<String> connectionIds) {
        // Ids whose connection is already gone sort first; they are the cheapest to drop.
        String oldest = null;
        Connection oldestConnection = null;
        for (String candidateId : connectionIds) {
            Connection candidate = connections.get(candidateId);
            if (candidate == null) {
                return candidateId;
            }
            if (oldestConnection == null || OLDEST_FIRST.compare(candidate, oldestConnection) < 0) {
                oldest = candidateId;
                oldestConnection = candidate;
            }
        }
        return oldest;
    }

    /**
     * Removes a connection's identity mapping and room memberships. Idempotent.
     *
     * @param connectionId connection to unregister
     * @return false if it was not registered
     */
    public boolean unregister(String connectionId) {
        Identity identity = identities.remove(connectionId);
        if (identity == null) {
            return false;
        }

        Connection connection = connections.get(connectionId);
        if (connection != null) {
            notifyListeners(listener -> listener.connectionRemoved(connection));
        }

        String userId = identity.getUserId();
        boolean lastConnection = detachFromUser(userId, connectionId);

        log.debug("Unregistered connection {} of user {}", connectionId, userId);
        if (lastConnection) {
            notifyListeners(listener -> listener.userOffline(userId));
        }
        return true;
    }

    /**
     * @return true if this removed the user's last connection
     */
    private boolean detachFromUser(String userId, String connectionId) {
        AtomicBoolean lastConnection = new AtomicBoolean(false);
        userConnections.computeIfPresent(userId, (uid, current) -> {
            if (!current.contains(connectionId)) {
                return current;
            }
            List<String> next = new ArrayList<>(current);
            next.remove(connectionId);
            if (next.isEmpty()) {
                lastConnection.set(true);
                return null;
            }
            return List.copyOf(next);
        });
        return lastConnection.get();
    }

    /**
     * Tears a connection down: marks it closed, cancels its authentication deadline,
     * tells the client why and closes the transport, then unregisters and untracks it.
     * Only the first call for a connection does anything.
     *
     * @param connectionId connection to close
     * @param reason       close reason
     * @return true if this call closed the connection
     */
    public boolean close(String connectionId, DisconnectReason reason) {
        Connection connection = connections.get(connectionId);
        if (connection == null || !connection.markClosed()) {
            return false;
        }

        connection.cancelAuthDeadline();
        AuthenticationAttempt attempt = connection.attempt();
        if (attempt != null) {
            attempt.abandon();
        }

        ClientConnection transport = connection.getTransport();
        try {
            if (reason.isServerInitiated() && transport.isConnected()) {
                transport.emit(Events.Server.DISCONNECT_REASON, Map.of("reason", reason.code()));
            }
        } catch (RuntimeException e) {
            log.warn("Failed to send disconnect reason to connection {}: {}", connectionId, e.getMessage());
        }
        try {
            transport.disconnect(reason);
        } catch (RuntimeException e) {
            log.warn("Failed to close transport of connection {}: {}", connectionId, e.getMessage());
        }

        unregister(connectionId);
        connections.remove(connectionId);
        metricsService.recordClose(reason);

        if (reason.isServerInitiated()) {
            log.info("Closed connection {} ({})", connectionId, reason.code());
        } else {
            log.debug("Connection {} closed by client", connectionId);
        }
        return true;
    }

    /**
     * @return live connection ids of the user; closed connections are filtered out
     */
    public List<String> socketsFor(String userId) {
        List<String> ids = userConnections.get(userId);
        if (ids == null) {
            return List.of();
        }
        List<String> live = new ArrayList<>(ids.size());
        for (String id : ids) {
            Connection connection = connections.get(id);
            if (connection != null && connection.isOpen()) {
                live.add(id);
            }
        }
        return live;
    }

    public Connection connection(String connectionId) {
        return connections.get(connectionId);
    }

    public Identity identityOf(String connectionId) {
        return identities.get(connectionId);
    }

    public boolean isRegistered(String connectionId) {
        return identities.containsKey(connectionId);
    }

    /**
     * @return snapshot of tracked connections
     */
    public Collection<Connection> connections() {
        return List.copyOf(connections.values());
    }

    public int size() {
        return connections.size();
    }

    /**
     * @return number of tracked connections per connected user
     */
    public Map<String, Integer> connectionsPerUser() {
        Map<String, Integer> counts = new HashMap<>();
        userConnections.forEach((userId, ids) -> counts.put(userId, ids.size()));
        return counts;
    }

    private void notifyListeners(Consumer<ConnectionListener> callback) {
        for (ConnectionListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                log.error("Connection listener {} failed", listener.getClass().getSimpleName(), e);
            }
        }
    }
}
