package com.lingolink.gateway.metrics;

import com.lingolink.core.metrics.MetricsTags;
import com.lingolink.gateway.config.GatewayConfig;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backs the node's {@code /metrics} endpoint.
 * <p>
 * Reactor Netty records its transport meters on Micrometer's global registry, so the
 * Prometheus registry is attached there and gateway meters are registered on the same
 * composite. Every exported series carries the node id, including the transport meters
 * that have no node tag of their own.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    @Getter
    private final CompositeMeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;
    private final String nodeId;

    public PrometheusMetricsExporter(GatewayConfig config) {
        this(config.getNodeId(), Metrics.globalRegistry);
    }

    PrometheusMetricsExporter(String nodeId, CompositeMeterRegistry registry) {
        this.nodeId = nodeId;
        this.registry = registry;
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        prometheusRegistry.config().commonTags(MetricsTags.NODE_ID, nodeId);
        registry.add(prometheusRegistry);

        log.info("Prometheus exporter attached for node {}", nodeId);
    }

    /**
     * @return all meters in the Prometheus text format
     */
    public String scrape() {
        return prometheusRegistry.scrape();
    }

    /**
     * Detaches from the shared registry; called once the HTTP server is down.
     */
    public void close() {
        registry.remove(prometheusRegistry);
        prometheusRegistry.close();
        log.info("Prometheus exporter for node {} closed", nodeId);
    }
}
