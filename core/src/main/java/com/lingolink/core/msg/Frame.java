package com.lingolink.core.msg;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A single event frame exchanged over a client WebSocket.
 * <p>
 * Both directions use {@code {"event": "...", "data": ...}}. Inbound frames keep
 * {@code data} as a raw tree so every handler can read the shape it expects.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Frame {
    /**
     * Event name, see {@link Events}.
     */
    private String event;

    /**
     * Event payload; may be a JSON string, object, or absent.
     */
    private JsonNode data;
}
