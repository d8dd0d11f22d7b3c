package com.lingolink.core.room;

/**
 * Room key definitions.
 * <p>
 * <b>Key design:</b> namespace prefixes keep the room kinds apart; the suffix is the
 * backend identifier as-is.
 * </p>
 */
public final class RoomKeys {
    private RoomKeys() {
    }

    public static final String CONVERSATION_PREFIX = "conversation:";
    public static final String NOTIFICATIONS_PREFIX = "notifications:";

    /**
     * Chat room of a conversation: {@code conversation:{conversationId}}
     *
     * @param conversationId Conversation identifier
     * @return room key
     */
    public static String conversation(String conversationId) {
        return CONVERSATION_PREFIX + conversationId;
    }

    /**
     * Notification channel a user subscribes to explicitly: {@code notifications:{userId}}
     *
     * @param userId User identifier
     * @return room key
     */
    public static String notifications(String userId) {
        return NOTIFICATIONS_PREFIX + userId;
    }
}
