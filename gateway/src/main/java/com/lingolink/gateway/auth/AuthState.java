package com.lingolink.gateway.auth;

/**
 * Handshake state of a connection. Transitions only move forward:
 * {@code CONNECTED -> AUTHENTICATING -> AUTHENTICATED | REJECTED}, or
 * {@code CONNECTED -> REJECTED} when the deadline fires first.
 */
public enum AuthState {
    CONNECTED,
    AUTHENTICATING,
    AUTHENTICATED,
    REJECTED
}
