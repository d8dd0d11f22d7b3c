package com.lingolink.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for node identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for an outcome (success/failure).
     */
    public static final String OUTCOME = "outcome";

    /**
     * Tag key for failure/close reason.
     */
    public static final String REASON = "reason";
}
