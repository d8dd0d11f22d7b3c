package com.lingolink.gateway.metrics;

import com.lingolink.core.auth.CredentialFailure;
import com.lingolink.core.metrics.MetricsNames;
import com.lingolink.core.metrics.MetricsTags;
import com.lingolink.core.model.DisconnectReason;
import com.lingolink.gateway.config.GatewayConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Centralized metrics for a gateway node.
 */
public class MetricsService {

    private final MeterRegistry registry;
    private final String nodeId;

    private final Counter connectionsAccepted;
    private final Counter authSuccess;
    private final Map<CredentialFailure, Counter> authFailures = new EnumMap<>(CredentialFailure.class);
    private final Counter authFailureUnexpected;
    private final Map<DisconnectReason, Counter> closes = new EnumMap<>(DisconnectReason.class);
    private final Counter framesDelivered;
    private final Counter framesDropped;
    private final Counter deliveryCommandsApplied;
    private final Counter deliveryCommandsRejected;

    public MetricsService(MeterRegistry registry, GatewayConfig config) {
        this.registry = registry;
        this.nodeId = config.getNodeId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        connectionsAccepted = Counter.builder(MetricsNames.CONNECTIONS_ACCEPTED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("WebSocket connections accepted")
            .register(registry);

        authSuccess = Counter.builder(MetricsNames.AUTH_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.OUTCOME, "success")
            .tag(MetricsTags.REASON, "none")
            .description("Authentication outcomes")
            .register(registry);

        for (CredentialFailure failure : CredentialFailure.values()) {
            authFailures.put(failure, authFailureCounter(failure.code()));
        }
        authFailureUnexpected = authFailureCounter("internal_error");

        for (DisconnectReason reason : DisconnectReason.values()) {
            closes.put(reason, Counter.builder(MetricsNames.CLOSES_TOTAL)
                .tag(MetricsTags.NODE_ID, nodeId)
                .tag(MetricsTags.REASON, reason.code())
                .description("Connection closes by reason")
                .register(registry));
        }

        framesDelivered = Counter.builder(MetricsNames.FRAMES_DELIVERED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Frames queued to client connections")
            .register(registry);

        framesDropped = Counter.builder(MetricsNames.FRAMES_DROPPED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, "buffer_full")
            .description("Frames dropped due to a full or closed outbound buffer")
            .register(registry);

        deliveryCommandsApplied = deliveryCommandCounter("applied");
        deliveryCommandsRejected = deliveryCommandCounter("rejected");
    }

    private Counter authFailureCounter(String reason) {
        return Counter.builder(MetricsNames.AUTH_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.OUTCOME, "failure")
            .tag(MetricsTags.REASON, reason)
            .description("Authentication outcomes")
            .register(registry);
    }

    private Counter deliveryCommandCounter(String outcome) {
        return Counter.builder(MetricsNames.DELIVERY_COMMANDS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.OUTCOME, outcome)
            .description("Delivery commands consumed from Kafka")
            .register(registry);
    }

    /**
     * Registers the live connection gauge. Called once by the registry that owns the count.
     *
     * @param liveConnections supplier of the current connection count
     */
    public void registerConnectionGauge(Supplier<Number> liveConnections) {
        Gauge.builder(MetricsNames.CONNECTIONS, liveConnections)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Live transport connections")
            .register(registry);
    }

    public void recordConnectionAccepted() {
        connectionsAccepted.increment();
    }

    public void recordAuthSuccess() {
        authSuccess.increment();
    }

    /**
     * @param failure credential failure, or {@code null} for unexpected errors
     */
    public void recordAuthFailure(CredentialFailure failure) {
        if (failure == null) {
            authFailureUnexpected.increment();
            return;
        }
        authFailures.get(failure).increment();
    }

    public void recordClose(DisconnectReason reason) {
        closes.get(reason).increment();
    }

    public void recordFrameDelivered() {
        framesDelivered.increment();
    }

    public void recordFrameDropped() {
        framesDropped.increment();
    }

    public void recordDeliveryCommand(boolean applied) {
        if (applied) {
            deliveryCommandsApplied.increment();
        } else {
            deliveryCommandsRejected.increment();
        }
    }
}
