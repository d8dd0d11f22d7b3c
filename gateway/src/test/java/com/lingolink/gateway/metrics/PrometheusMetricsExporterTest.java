package com.lingolink.gateway.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertTrue;

class PrometheusMetricsExporterTest {

    private CompositeMeterRegistry shared;
    private PrometheusMetricsExporter exporter;

    @BeforeEach
    void setUp() {
        shared = new CompositeMeterRegistry();
        exporter = new PrometheusMetricsExporter("node-a", shared);
    }

    @Test
    @DisplayName("Meters registered without a node tag are exported with the node id")
    void testUntaggedMetersCarryNodeId() {
        // Given: a meter registered the way Reactor Netty does, without a node tag
        Counter.builder("transport.frames.read").register(shared).increment();

        // When
        String scrape = exporter.scrape();

        // Then
        assertTrue(scrape.contains("transport_frames_read"));
        assertTrue(scrape.contains("node_id=\"node-a\""));
    }

    @Test
    @DisplayName("Closing detaches the exporter from the shared registry")
    void testCloseDetaches() {
        exporter.close();

        assertTrue(shared.getRegistries().isEmpty());
    }
}
