package com.lingolink.core.redis;

/**
 * Redis keyspace definitions.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Use namespace prefixes to avoid collisions with the backend's own keys</li>
 *   <li>Set TTLs so abandoned users do not accumulate</li>
 * </ul>
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Activity key for a user: {@code user:{userId}:activity}
     * <p>
     * <b>Type:</b> Hash
     * <br>
     * <b>Fields:</b>
     * <ul>
     *   <li>{@code lastActive}: Last authentication or status change (epoch millis)</li>
     *   <li>{@code nodeId}: Gateway node that recorded it</li>
     * </ul>
     * <b>TTL:</b> refreshed on every write.
     * </p>
     *
     * @param userId User identifier
     * @return Redis key
     */
    public static String activity(String userId) {
        return "user:" + userId + ":activity";
    }
}
