package com.lingolink.gateway.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicReference;

/**
 * In-flight authentication of one connection.
 * <p>
 * The verification pipeline runs once; every caller observes the same outcome through
 * {@link #result()}. Settles exactly once and stays settled.
 * </p>
 */
public class AuthenticationAttempt {
    private static final Logger log = LoggerFactory.getLogger(AuthenticationAttempt.class);

    static final String ABANDONED = "abandoned";

    private final long startedAtMillis;
    private final AtomicReference<AuthOutcome> settled = new AtomicReference<>();
    private final Sinks.One<AuthOutcome> outcome = Sinks.one();
    private volatile Disposable execution;

    public AuthenticationAttempt(long startedAtMillis) {
        this.startedAtMillis = startedAtMillis;
    }

    void start(Mono<AuthOutcome> pipeline) {
        execution = pipeline.subscribe(
            this::settle,
            err -> {
                log.error("Authentication pipeline failed unexpectedly", err);
                settle(AuthOutcome.failure("internal_error"));
            }
        );
    }

    /**
     * @return true if this call settled the attempt
     */
    boolean settle(AuthOutcome value) {
        if (!settled.compareAndSet(null, value)) {
            return false;
        }
        outcome.tryEmitValue(value);
        return true;
    }

    /**
     * Stops a pending verification; waiting callers see a failed outcome.
     */
    public void abandon() {
        if (settle(AuthOutcome.failure(ABANDONED))) {
            Disposable running = execution;
            if (running != null) {
                running.dispose();
            }
        }
    }

    public Mono<AuthOutcome> result() {
        return outcome.asMono();
    }

    public long getStartedAtMillis() {
        return startedAtMillis;
    }
}
