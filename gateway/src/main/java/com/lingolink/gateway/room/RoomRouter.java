package com.lingolink.gateway.room;

import com.lingolink.core.model.Identity;
import com.lingolink.core.msg.FrameCodec;
import com.lingolink.core.room.RoomKeys;
import com.lingolink.gateway.session.Connection;
import com.lingolink.gateway.session.ConnectionListener;
import com.lingolink.gateway.session.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Logical rooms and fan-out.
 * <p>
 * Room membership and each connection's room list are updated together; rooms are
 * created on first join and dropped when the last member leaves. Delivery is
 * at-most-once: a user with no live connection simply receives nothing.
 * </p>
 */
public class RoomRouter implements ConnectionListener {
    private static final Logger log = LoggerFactory.getLogger(RoomRouter.class);

    private final ConnectionRegistry registry;
    private final Map<String, Set<String>> rooms = new ConcurrentHashMap<>();

    public RoomRouter(ConnectionRegistry registry) {
        this.registry = registry;
    }

    /**
     * Adds a registered connection to a room.
     *
     * @return false when the connection is closed, unknown or not authenticated
     */
    public boolean join(String connectionId, String roomKey) {
        Connection connection = registry.connection(connectionId);
        if (connection == null || !connection.isOpen() || !registry.isRegistered(connectionId)) {
            log.debug("Ignoring join of {} to {}: connection not live", connectionId, roomKey);
            return false;
        }

        rooms.compute(roomKey, (key, members) -> {
            Set<String> next = members == null ? ConcurrentHashMap.newKeySet() : members;
            next.add(connectionId);
            return next;
        });
        connection.trackRoom(roomKey);

        // Lost a race with unregister: its room cleanup may already have run.
        if (!registry.isRegistered(connectionId)) {
            leave(connectionId, roomKey);
            return false;
        }

        log.debug("Connection {} joined room {}", connectionId, roomKey);
        return true;
    }

    /**
     * @return whether the connection was a member
     */
    public boolean leave(String connectionId, String roomKey) {
        AtomicBoolean removed = new AtomicBoolean(false);
        rooms.computeIfPresent(roomKey, (key, members) -> {
            removed.set(members.remove(connectionId));
            return members.isEmpty() ? null : members;
        });

        Connection connection = registry.connection(connectionId);
        if (connection != null) {
            connection.untrackRoom(roomKey);
        }
        return removed.get();
    }

    /**
     * Removes a connection from every room it is in.
     */
    public void leaveAll(Connection connection) {
        for (String roomKey : List.copyOf(connection.rooms())) {
            leave(connection.getId(), roomKey);
        }
    }

    @Override
    public void connectionRemoved(Connection connection) {
        leaveAll(connection);
    }

    public boolean addToConversation(String connectionId, String conversationId) {
        return join(connectionId, RoomKeys.conversation(conversationId));
    }

    public boolean removeFromConversation(String connectionId, String conversationId) {
        return leave(connectionId, RoomKeys.conversation(conversationId));
    }

    /**
     * Delivers an event to every live member of a room.
     *
     * @param excludeUserId user whose connections are skipped, or {@code null}
     * @return number of connections the frame was queued to
     */
    public int broadcastToRoom(String roomKey, String event, Object payload, String excludeUserId) {
        Set<String> members = rooms.get(roomKey);
        if (members == null || members.isEmpty()) {
            log.debug("No members in room {} for {}", roomKey, event);
            return 0;
        }

        String frame = FrameCodec.encode(event, payload);
        int delivered = 0;
        for (String connectionId : List.copyOf(members)) {
            if (excludeUserId != null) {
                Identity owner = registry.identityOf(connectionId);
                if (owner != null && excludeUserId.equals(owner.getUserId())) {
                    continue;
                }
            }
            if (deliver(connectionId, frame, event)) {
                delivered++;
            }
        }
        return delivered;
    }

    public int sendToConversation(String conversationId, String event, Object payload, String excludeUserId) {
        return broadcastToRoom(RoomKeys.conversation(conversationId), event, payload, excludeUserId);
    }

    /**
     * Delivers an event to all of a user's live connections.
     *
     * @return number of connections the frame was queued to
     */
    public int sendToUser(String userId, String event, Object payload) {
        List<String> connectionIds = registry.socketsFor(userId);
        if (connectionIds.isEmpty()) {
            log.debug("User {} has no live connections, dropping {}", userId, event);
            return 0;
        }

        String frame = FrameCodec.encode(event, payload);
        int delivered = 0;
        for (String connectionId : connectionIds) {
            if (deliver(connectionId, frame, event)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Delivers an event to every tracked connection, authenticated or not.
     */
    public int broadcastToAll(String event, Object payload) {
        String frame = FrameCodec.encode(event, payload);
        int delivered = 0;
        for (Connection connection : registry.connections()) {
            if (deliver(connection.getId(), frame, event)) {
                delivered++;
            }
        }
        return delivered;
    }

    private boolean deliver(String connectionId, String frame, String event) {
        Connection connection = registry.connection(connectionId);
        if (connection == null || !connection.isOpen()) {
            return false;
        }
        try {
            return connection.send(frame);
        } catch (RuntimeException e) {
            log.error("Failed to deliver {} to connection {}", event, connectionId, e);
            return false;
        }
    }

    public int roomCount() {
        return rooms.size();
    }

    /**
     * @return snapshot of a room's members; empty for unknown rooms
     */
    public Set<String> members(String roomKey) {
        Set<String> members = rooms.get(roomKey);
        return members == null ? Set.of() : Set.copyOf(members);
    }
}
