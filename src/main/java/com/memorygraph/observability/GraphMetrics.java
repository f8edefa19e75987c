package com.memorygraph.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class GraphMetrics {

    private final MeterRegistry registry;

    public GraphMetrics() {
        this(new SimpleMeterRegistry());
    }

    public GraphMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter nodesCreated() {
        return Counter.builder("memgraph.nodes.created").register(registry);
    }

    /** One counter per read outcome: ok, not_found, forbidden. */
    public Counter reads(String outcome) {
        return Counter.builder("memgraph.reads").tag("outcome", outcome).register(registry);
    }

    public Timer searchLatency() {
        return Timer.builder("memgraph.search.latency").register(registry);
    }

    public Counter nodesExpired() {
        return Counter.builder("memgraph.nodes.expired").register(registry);
    }

    public Counter rollups() {
        return Counter.builder("memgraph.rollups").register(registry);
    }

    public Counter maintenanceTimeouts() {
        return Counter.builder("memgraph.maintenance.timeouts").register(registry);
    }
}
