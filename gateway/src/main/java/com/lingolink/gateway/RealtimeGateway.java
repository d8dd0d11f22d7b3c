package com.lingolink.gateway;

import com.lingolink.core.model.ConnectionStats;
import com.lingolink.core.model.PresenceStatus;
import com.lingolink.core.msg.DeliveryCommand;
import com.lingolink.gateway.auth.AuthState;
import com.lingolink.gateway.drain.ShutdownCoordinator;
import com.lingolink.gateway.notify.NotificationService;
import com.lingolink.gateway.presence.PresenceTracker;
import com.lingolink.gateway.room.RoomRouter;
import com.lingolink.gateway.session.Connection;
import com.lingolink.gateway.session.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Push API offered to business services, in process or through delivery commands.
 * Every push is at-most-once and returns the number of connections reached.
 */
public class RealtimeGateway {
    private static final Logger log = LoggerFactory.getLogger(RealtimeGateway.class);

    private final ConnectionRegistry registry;
    private final RoomRouter router;
    private final PresenceTracker presenceTracker;
    private final NotificationService notificationService;
    private final ShutdownCoordinator shutdownCoordinator;
    private final Scheduler scheduler;

    public RealtimeGateway(ConnectionRegistry registry,
                           RoomRouter router,
                           PresenceTracker presenceTracker,
                           NotificationService notificationService,
                           ShutdownCoordinator shutdownCoordinator,
                           Scheduler scheduler) {
        this.registry = registry;
        this.router = router;
        this.presenceTracker = presenceTracker;
        this.notificationService = notificationService;
        this.shutdownCoordinator = shutdownCoordinator;
        this.scheduler = scheduler;
    }

    public int sendToUser(String userId, String event, Object payload) {
        return router.sendToUser(userId, event, payload);
    }

    public int broadcastToRoom(String roomKey, String event, Object payload, String excludeUserId) {
        return router.broadcastToRoom(roomKey, event, payload, excludeUserId);
    }

    public int sendToConversation(String conversationId, String event, Object payload, String excludeUserId) {
        return router.sendToConversation(conversationId, event, payload, excludeUserId);
    }

    public boolean addToConversation(String connectionId, String conversationId) {
        return router.addToConversation(connectionId, conversationId);
    }

    public boolean removeFromConversation(String connectionId, String conversationId) {
        return router.removeFromConversation(connectionId, conversationId);
    }

    public int sendNotification(String userId, Object notification) {
        return notificationService.sendNotification(userId, notification);
    }

    public int updateNotificationCount(String userId, long count) {
        return notificationService.updateNotificationCount(userId, count);
    }

    public PresenceStatus statusOf(String userId) {
        return presenceTracker.statusOf(userId);
    }

    public ConnectionStats getConnectionStats() {
        int authenticated = 0;
        int authenticating = 0;
        int total = 0;
        for (Connection connection : registry.connections()) {
            total++;
            AuthState state = connection.authState();
            if (state == AuthState.AUTHENTICATED) {
                authenticated++;
            } else if (state == AuthState.AUTHENTICATING) {
                authenticating++;
            }
        }
        Map<String, Integer> perUser = registry.connectionsPerUser();

        return ConnectionStats.builder()
            .totalConnections(total)
            .authenticatedConnections(authenticated)
            .authenticatingConnections(authenticating)
            .connectedUsers(perUser.size())
            .connectionsPerUser(perUser)
            .rooms(router.roomCount())
            .draining(shutdownCoordinator.isDraining())
            .timestamp(Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS)))
            .build();
    }

    /**
     * Applies a delivery command from a business service.
     *
     * @return false when the command is incomplete
     */
    public boolean apply(DeliveryCommand command) {
        if (command.getKind() == null || command.getTarget() == null || command.getTarget().isBlank()) {
            log.warn("Ignoring delivery command without kind or target");
            return false;
        }
        String target = command.getTarget();
        switch (command.getKind()) {
            case NOTIFICATION -> sendNotification(target, command.getPayload());
            case NOTIFICATION_COUNT -> updateNotificationCount(target, command.getCount());
            default -> {
                if (command.getEvent() == null || command.getEvent().isBlank()) {
                    log.warn("Ignoring {} delivery command for {} without event", command.getKind(), target);
                    return false;
                }
                int delivered = switch (command.getKind()) {
                    case USER -> sendToUser(target, command.getEvent(), command.getPayload());
                    case ROOM -> broadcastToRoom(target, command.getEvent(), command.getPayload(),
                        command.getExcludeUserId());
                    default -> sendToConversation(target, command.getEvent(), command.getPayload(),
                        command.getExcludeUserId());
                };
                log.debug("Delivery command {} {} reached {} connections", command.getKind(), target, delivered);
            }
        }
        return true;
    }
}
