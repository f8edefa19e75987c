package com.memorygraph.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class GraphMetricsTest {

    @Test
    void registersAllMeters() {
        var metrics = new GraphMetrics();
        assertNotNull(metrics.registry());
        assertNotNull(metrics.nodesCreated());
        assertNotNull(metrics.reads("ok"));
        assertNotNull(metrics.searchLatency());
        assertNotNull(metrics.nodesExpired());
        assertNotNull(metrics.rollups());
        assertNotNull(metrics.maintenanceTimeouts());
    }

    @Test
    void readCountersAreTaggedByOutcome() {
        var registry = new SimpleMeterRegistry();
        var metrics = new GraphMetrics(registry);
        metrics.reads("ok").increment();
        metrics.reads("ok").increment();
        metrics.reads("forbidden").increment();

        assertEquals(2.0, registry.get("memgraph.reads").tag("outcome", "ok").counter().count());
        assertEquals(1.0, registry.get("memgraph.reads").tag("outcome", "forbidden").counter().count());
    }

    @Test
    void searchLatencyRecords() {
        var metrics = new GraphMetrics();
        metrics.searchLatency().record(Duration.ofMillis(12));
        assertEquals(1, metrics.searchLatency().count());
    }
}
