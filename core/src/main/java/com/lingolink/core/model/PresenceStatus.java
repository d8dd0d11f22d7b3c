package com.lingolink.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Advisory, in-memory user status. Never used for access control.
 */
public enum PresenceStatus {
    ONLINE,
    AWAY,
    OFFLINE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<PresenceStatus> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (PresenceStatus status : values()) {
            if (status.wireValue().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
