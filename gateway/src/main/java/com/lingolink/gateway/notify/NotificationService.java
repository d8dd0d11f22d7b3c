package com.lingolink.gateway.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.lingolink.core.msg.Events;
import com.lingolink.core.util.JsonUtils;
import com.lingolink.gateway.room.RoomRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Live notification delivery to a user's connections.
 */
public class NotificationService {
    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final RoomRouter router;
    private final NotificationSink sink;
    private final String nodeId;
    private final Scheduler scheduler;

    public NotificationService(RoomRouter router, NotificationSink sink, String nodeId, Scheduler scheduler) {
        this.router = router;
        this.sink = sink;
        this.nodeId = nodeId;
        this.scheduler = scheduler;
    }

    /**
     * Pushes {@code new_notification} to the user, then hands a record to the sink
     * without waiting for it.
     *
     * @return number of connections reached
     */
    public int sendNotification(String userId, Object notification) {
        int delivered = router.sendToUser(userId, Events.Server.NEW_NOTIFICATION, notification);

        JsonNode body = notification instanceof JsonNode node ? node : JsonUtils.valueToTree(notification);
        NotificationRecord record = NotificationRecord.builder()
            .userId(userId)
            .notification(body)
            .deliveredConnections(delivered)
            .nodeId(nodeId)
            .timestamp(Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS)))
            .build();
        sink.publish(record)
            .onErrorResume(err -> {
                log.warn("Failed to hand off notification record for {}: {}", userId, err.getMessage());
                return Mono.empty();
            })
            .subscribe();

        log.debug("Notification for {} reached {} connections", userId, delivered);
        return delivered;
    }

    /**
     * @return number of connections reached
     */
    public int updateNotificationCount(String userId, long count) {
        return router.sendToUser(userId, Events.Server.NOTIFICATION_COUNT_UPDATED, Map.of("count", count));
    }
}
