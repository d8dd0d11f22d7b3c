package com.lingolink.gateway.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.lingolink.core.model.Identity;
import com.lingolink.core.model.PresenceStatus;
import com.lingolink.core.msg.ErrorPayload;
import com.lingolink.core.msg.Events;
import com.lingolink.core.room.RoomKeys;
import com.lingolink.core.util.JsonUtils;
import com.lingolink.gateway.presence.PresenceTracker;
import com.lingolink.gateway.room.RoomRouter;
import com.lingolink.gateway.session.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Status changes and notification subscriptions.
 */
public class PresenceEventHandler {
    private static final Logger log = LoggerFactory.getLogger(PresenceEventHandler.class);

    private final PresenceTracker presenceTracker;
    private final RoomRouter router;

    public PresenceEventHandler(PresenceTracker presenceTracker, RoomRouter router) {
        this.presenceTracker = presenceTracker;
        this.router = router;
    }

    public Mono<Void> setStatus(Connection connection, Identity identity, JsonNode data) {
        String raw = data != null && data.isTextual() ? data.asText() : JsonUtils.textField(data, "status");
        Optional<PresenceStatus> status = PresenceStatus.fromWire(raw);
        if (status.isEmpty()) {
            log.debug("Invalid status '{}' from user {}", raw, identity.getUserId());
            connection.emit(Events.Server.ERROR, new ErrorPayload(
                Events.ErrorCodes.INVALID_STATUS, "Status must be one of online, away, offline"
            ));
            return Mono.empty();
        }
        return presenceTracker.setStatus(identity.getUserId(), status.get());
    }

    public Mono<Void> subscribeNotifications(Connection connection, Identity identity) {
        if (router.join(connection.getId(), RoomKeys.notifications(identity.getUserId()))) {
            log.debug("User {} subscribed to notifications on {}", identity.getUserId(), connection.getId());
        }
        return Mono.empty();
    }
}
