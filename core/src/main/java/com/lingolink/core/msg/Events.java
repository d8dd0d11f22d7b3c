package com.lingolink.core.msg;

/**
 * Event names of the client protocol. The names are the contract; payload shapes are
 * documented next to each constant.
 */
public final class Events {
    private Events() {
    }

    /**
     * Events sent by clients.
     */
    public static final class Client {
        private Client() {
        }

        /** Raw credential string or {@code {token}}. */
        public static final String AUTHENTICATE = "authenticate";
        public static final String HEARTBEAT = "heartbeat";
        public static final String GRACEFUL_DISCONNECT = "graceful_disconnect";
        /** {@code {conversationId}} */
        public static final String JOIN_CONVERSATION = "join_conversation";
        /** {@code {conversationId}} */
        public static final String LEAVE_CONVERSATION = "leave_conversation";
        /** {@code {conversationId, message}} */
        public static final String SEND_MESSAGE = "send_message";
        /** {@code {conversationId}} */
        public static final String TYPING_START = "typing_start";
        /** {@code {conversationId}} */
        public static final String TYPING_END = "typing_end";
        /** {@code {status: online|away|offline}} */
        public static final String SET_STATUS = "set_status";
        public static final String SUBSCRIBE_NOTIFICATIONS = "subscribe_notifications";
    }

    /**
     * Events sent by the gateway.
     */
    public static final class Server {
        private Server() {
        }

        /** {@code {connectionId, timestamp, authTimeoutMs}} */
        public static final String CONNECT = "connect";
        /** {@code {success, userId, timestamp}} */
        public static final String AUTHENTICATED = "authenticated";
        /** {@code {code, message}} */
        public static final String ERROR = "error";
        /** {@code {conversationId}} */
        public static final String CONVERSATION_JOINED = "conversation_joined";
        /** {@code {conversationId, message}} */
        public static final String MESSAGE_RECEIVED = "message_received";
        public static final String USER_TYPING = "user_typing";
        public static final String USER_STOPPED_TYPING = "user_stopped_typing";
        public static final String NEW_NOTIFICATION = "new_notification";
        /** {@code {count}} */
        public static final String NOTIFICATION_COUNT_UPDATED = "notification_count_updated";
        /** {@code {userId, status, timestamp}} */
        public static final String FRIEND_STATUS_CHANGED = "friend_status_changed";
        /** {@code {reason}} */
        public static final String DISCONNECT_REASON = "disconnect_reason";
        /** {@code {message, timestamp}} */
        public static final String SERVER_SHUTDOWN = "server_shutdown";
    }

    /**
     * Codes carried by {@link Server#ERROR} frames.
     */
    public static final class ErrorCodes {
        private ErrorCodes() {
        }

        public static final String AUTHENTICATION_FAILED = "authentication_failed";
        public static final String AUTHENTICATION_TIMEOUT = "authentication_timeout";
        public static final String UNAUTHORIZED = "unauthorized";
        public static final String NOT_PARTICIPANT = "not_participant";
        public static final String INVALID_FRAME = "invalid_frame";
        public static final String INVALID_STATUS = "invalid_status";
        public static final String INVALID_REQUEST = "invalid_request";
        public static final String MESSAGE_FAILED = "message_failed";
        public static final String INTERNAL_ERROR = "internal_error";
    }
}
