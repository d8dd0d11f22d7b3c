package com.lingolink.gateway.notify;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Notification handed to the persistence service after live delivery.
 */
@Value
@Builder
public class NotificationRecord {
    String userId;
    JsonNode notification;
    /**
     * Live connections the notification reached; 0 means the user was offline here.
     */
    int deliveredConnections;
    String nodeId;
    Instant timestamp;
}
