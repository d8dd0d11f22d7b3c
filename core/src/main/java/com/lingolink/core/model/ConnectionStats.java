package com.lingolink.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Diagnostic snapshot of a gateway node, counts only.
 */
@Value
@Builder(toBuilder = true)
public class ConnectionStats {
    int totalConnections;
    int authenticatedConnections;
    int authenticatingConnections;
    int connectedUsers;
    int rooms;
    Map<String, Integer> connectionsPerUser;
    boolean draining;
    Instant timestamp;
}
