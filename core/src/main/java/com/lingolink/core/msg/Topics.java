package com.lingolink.core.msg;

public final class Topics {
    private Topics() {
    }

    /**
     * Delivery commands published by business services (DeliveryCommand messages).
     * Every gateway node consumes the full topic with its own consumer group, since the
     * target user may be connected to any node.
     */
    public static final String DELIVERIES = "lingo.realtime.deliveries";

    /**
     * Notification records handed to the notification persistence service, keyed by
     * user id.
     */
    public static final String NOTIFICATIONS = "lingo.notifications";
}
