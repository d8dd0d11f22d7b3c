package com.lingolink.gateway.support;

import com.lingolink.core.model.DisconnectReason;
import com.lingolink.core.msg.Frame;
import com.lingolink.core.msg.FrameCodec;
import com.lingolink.gateway.transport.ClientConnection;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory transport that records every frame it is asked to send.
 */
public class RecordingClientConnection implements ClientConnection {
    private final String id;
    private final List<Frame> frames = new CopyOnWriteArrayList<>();
    private volatile boolean connected = true;
    private volatile DisconnectReason disconnectReason;
    private volatile int disconnectCalls;

    public RecordingClientConnection(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String remoteAddress() {
        return "10.0.0.1";
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public boolean send(String frame) {
        if (!connected) {
            return false;
        }
        frames.add(FrameCodec.decode(frame));
        return true;
    }

    @Override
    public void disconnect(DisconnectReason reason) {
        disconnectCalls++;
        if (connected) {
            connected = false;
            disconnectReason = reason;
        }
    }

    /**
     * Simulates the client going away without a close handshake.
     */
    public void dropFromClientSide() {
        connected = false;
    }

    public List<Frame> frames() {
        return List.copyOf(frames);
    }

    public List<String> events() {
        return frames.stream().map(Frame::getEvent).collect(Collectors.toList());
    }

    public List<Frame> framesOf(String event) {
        return frames.stream().filter(f -> event.equals(f.getEvent())).collect(Collectors.toList());
    }

    public Frame lastFrame() {
        return frames.isEmpty() ? null : frames.get(frames.size() - 1);
    }

    public DisconnectReason disconnectReason() {
        return disconnectReason;
    }

    public int disconnectCalls() {
        return disconnectCalls;
    }

    public void clear() {
        frames.clear();
    }
}
