package com.lingolink.gateway.session;

public enum RegistrationResult {
    REGISTERED,
    /**
     * The connection already has an identity; nothing changed.
     */
    ALREADY_REGISTERED,
    /**
     * The connection was closed before registration; nothing was recorded.
     */
    CONNECTION_CLOSED
}
