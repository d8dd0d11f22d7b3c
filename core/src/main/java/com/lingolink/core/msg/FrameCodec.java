package com.lingolink.core.msg;

import com.fasterxml.jackson.databind.JsonNode;
import com.lingolink.core.util.JsonUtils;

/**
 * Encodes and decodes {@link Frame}s to and from their JSON text form.
 */
public final class FrameCodec {
    private FrameCodec() {
    }

    /**
     * Encodes an outbound frame. The payload is serialized with the shared mapper; a
     * {@code null} payload is written as {@code null}.
     *
     * @param event   event name
     * @param payload event payload
     * @return JSON text frame
     */
    public static String encode(String event, Object payload) {
        JsonNode data = payload == null ? null : JsonUtils.valueToTree(payload);
        return JsonUtils.writeValueAsString(new Frame(event, data));
    }

    /**
     * Decodes an inbound text frame.
     *
     * @param text raw frame text
     * @return decoded frame
     * @throws IllegalArgumentException if the text is not a JSON frame
     */
    public static Frame decode(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Empty frame");
        }
        Frame frame = JsonUtils.readValue(text, Frame.class);
        if (frame == null) {
            throw new IllegalArgumentException("Frame is JSON null");
        }
        return frame;
    }
}
