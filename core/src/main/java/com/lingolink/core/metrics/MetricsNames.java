package com.lingolink.core.metrics;

/**
 * Micrometer metric names used by the gateway.
 * <p>
 * <b>Naming convention:</b> {@code lingo.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: Live transport connections on this node, authenticated or not.
     */
    public static final String CONNECTIONS = "lingo.gateway.connections";

    /**
     * Counter: Accepted WebSocket connections.
     */
    public static final String CONNECTIONS_ACCEPTED_TOTAL = "lingo.gateway.connections.accepted.total";

    /**
     * Counter: Authentication outcomes.
     * <p>
     * Tags: outcome (success/failure), reason (credential failure code)
     * </p>
     */
    public static final String AUTH_TOTAL = "lingo.gateway.auth.total";

    /**
     * Counter: Server-side connection closes.
     * <p>
     * Tags: reason (disconnect reason code)
     * </p>
     */
    public static final String CLOSES_TOTAL = "lingo.gateway.closes.total";

    /**
     * Counter: Frames queued for delivery to clients.
     */
    public static final String FRAMES_DELIVERED_TOTAL = "lingo.gateway.frames.delivered.total";

    /**
     * Counter: Frames dropped because a connection's outbound buffer was full or closed.
     */
    public static final String FRAMES_DROPPED_TOTAL = "lingo.gateway.frames.dropped.total";

    /**
     * Counter: Delivery commands consumed from Kafka.
     * <p>
     * Tags: outcome (applied/rejected)
     * </p>
     */
    public static final String DELIVERY_COMMANDS_TOTAL = "lingo.gateway.delivery.commands.total";
}
