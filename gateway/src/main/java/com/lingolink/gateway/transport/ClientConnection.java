package com.lingolink.gateway.transport;

import com.lingolink.core.model.DisconnectReason;
import com.lingolink.core.msg.FrameCodec;

/**
 * Capability the gateway needs from a bidirectional client transport.
 * <p>
 * Implementations must accept {@link #send(String)} from any thread and keep frames in
 * call order per connection.
 * </p>
 */
public interface ClientConnection {

    /**
     * @return opaque connection identifier, unique for the life of the process
     */
    String id();

    String remoteAddress();

    /**
     * @return false once the transport is closed from either side
     */
    boolean isConnected();

    /**
     * Queues an encoded frame for the client.
     *
     * @param frame JSON text frame
     * @return whether the frame was queued; false when closed or the outbound buffer is full
     */
    boolean send(String frame);

    /**
     * Closes the transport after already queued frames are flushed. Idempotent.
     *
     * @param reason why the gateway is closing
     */
    void disconnect(DisconnectReason reason);

    default boolean emit(String event, Object payload) {
        return send(FrameCodec.encode(event, payload));
    }
}
