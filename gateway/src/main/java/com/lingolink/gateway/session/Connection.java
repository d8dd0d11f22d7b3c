package com.lingolink.gateway.session;

import com.lingolink.gateway.auth.AuthState;
import com.lingolink.gateway.auth.AuthenticationAttempt;
import com.lingolink.gateway.transport.ClientConnection;
import lombok.AccessLevel;
import lombok.Getter;
import reactor.core.Disposable;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Server-side state of one accepted client connection.
 * <p>
 * Every field that more than one thread touches is atomic; state changes go through
 * compare-and-set so concurrent signals (authenticate, deadline, close) resolve to one
 * winner.
 * </p>
 */
@Getter
public class Connection {
    private final String id;
    private final String remoteAddress;
    private final long createdAtMillis;
    /**
     * Accept order on this node; breaks ties between equal creation times.
     */
    private final long acceptSequence;
    private final ClientConnection transport;

    @Getter(AccessLevel.NONE)
    private final AtomicReference<AuthState> authState = new AtomicReference<>(AuthState.CONNECTED);
    @Getter(AccessLevel.NONE)
    private final AtomicReference<AuthenticationAttempt> attempt = new AtomicReference<>();
    @Getter(AccessLevel.NONE)
    private final AtomicReference<Disposable> authDeadline = new AtomicReference<>();
    @Getter(AccessLevel.NONE)
    private final AtomicLong lastHeartbeatMillis;
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean closed = new AtomicBoolean(false);
    @Getter(AccessLevel.NONE)
    private final Set<String> rooms = ConcurrentHashMap.newKeySet();

    public Connection(ClientConnection transport, long createdAtMillis, long acceptSequence) {
        this.id = transport.id();
        this.remoteAddress = transport.remoteAddress();
        this.transport = transport;
        this.createdAtMillis = createdAtMillis;
        this.acceptSequence = acceptSequence;
        this.lastHeartbeatMillis = new AtomicLong(createdAtMillis);
    }

    public AuthState authState() {
        return authState.get();
    }

    public boolean transition(AuthState from, AuthState to) {
        return authState.compareAndSet(from, to);
    }

    public AuthenticationAttempt attempt() {
        return attempt.get();
    }

    /**
     * @return false if another attempt is already installed
     */
    public boolean installAttempt(AuthenticationAttempt candidate) {
        return attempt.compareAndSet(null, candidate);
    }

    public void authDeadline(Disposable deadline) {
        Disposable previous = authDeadline.getAndSet(deadline);
        if (previous != null) {
            previous.dispose();
        }
    }

    public void cancelAuthDeadline() {
        Disposable deadline = authDeadline.getAndSet(null);
        if (deadline != null) {
            deadline.dispose();
        }
    }

    public long lastHeartbeatMillis() {
        return lastHeartbeatMillis.get();
    }

    /**
     * Advances the heartbeat timestamp; never moves it backwards.
     */
    public void recordHeartbeat(long nowMillis) {
        lastHeartbeatMillis.accumulateAndGet(nowMillis, Math::max);
    }

    /**
     * @return true for the single caller that closed this connection
     */
    boolean markClosed() {
        return closed.compareAndSet(false, true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * @return whether frames can still reach the client
     */
    public boolean isOpen() {
        return !closed.get() && transport.isConnected();
    }

    /**
     * Sends an event unless the connection is closing.
     *
     * @return whether the frame was queued
     */
    public boolean emit(String event, Object payload) {
        if (closed.get()) {
            return false;
        }
        return transport.emit(event, payload);
    }

    public boolean send(String frame) {
        if (closed.get()) {
            return false;
        }
        return transport.send(frame);
    }

    /**
     * Room bookkeeping; only the room router calls these.
     */
    public void trackRoom(String roomKey) {
        rooms.add(roomKey);
    }

    public void untrackRoom(String roomKey) {
        rooms.remove(roomKey);
    }

    public Set<String> rooms() {
        return Collections.unmodifiableSet(rooms);
    }
}
