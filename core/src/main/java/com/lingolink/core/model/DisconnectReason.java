package com.lingolink.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reasons for which the gateway tears a connection down.
 * <p>
 * The code is what clients receive in {@code disconnect_reason}.
 * </p>
 */
public enum DisconnectReason {
    AUTHENTICATION_FAILED("authentication_failed"),
    AUTHENTICATION_TIMEOUT("authentication_timeout"),
    CONNECTION_LIMIT_EXCEEDED("connection_limit_exceeded"),
    HEARTBEAT_TIMEOUT("heartbeat_timeout"),
    SERVER_SHUTDOWN("server_shutdown"),
    GRACEFUL_DISCONNECT("graceful_disconnect"),
    CONNECTION_SETUP_FAILED("connection_setup_failed"),
    /**
     * The client or the network closed the socket; nothing is sent back.
     */
    TRANSPORT_CLOSED("transport_closed");

    private final String code;

    DisconnectReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * @return whether the gateway initiated the close and should tell the client why
     */
    public boolean isServerInitiated() {
        return this != TRANSPORT_CLOSED;
    }
}
