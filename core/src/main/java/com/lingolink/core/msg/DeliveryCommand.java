package com.lingolink.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/**
 * Push request published by a business service that does not run inside the gateway.
 * <p>
 * Delivery is at-most-once: a command whose target has no live connection on a node is
 * dropped by that node.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class DeliveryCommand {

    public enum Kind {
        /** {@code target} is a user id. */
        USER,
        /** {@code target} is a room key. */
        ROOM,
        /** {@code target} is a conversation id. */
        CONVERSATION,
        /** {@code target} is a user id; payload is the notification. */
        NOTIFICATION,
        /** {@code target} is a user id; {@code count} is the unread count. */
        NOTIFICATION_COUNT
    }

    @JsonProperty("kind")
    Kind kind;

    @JsonProperty("target")
    String target;

    /**
     * Server event name; ignored for notification kinds.
     */
    @JsonProperty("event")
    String event;

    @JsonProperty("payload")
    JsonNode payload;

    /**
     * Optional user whose connections must not receive a room/conversation broadcast.
     */
    @JsonProperty("excludeUserId")
    String excludeUserId;

    @JsonProperty("count")
    long count;

    @JsonCreator
    public DeliveryCommand(
        @JsonProperty("kind") Kind kind,
        @JsonProperty("target") String target,
        @JsonProperty("event") String event,
        @JsonProperty("payload") JsonNode payload,
        @JsonProperty("excludeUserId") String excludeUserId,
        @JsonProperty("count") long count
    ) {
        this.kind = kind;
        this.target = target;
        this.event = event;
        this.payload = payload;
        this.excludeUserId = excludeUserId;
        this.count = count;
    }
}
