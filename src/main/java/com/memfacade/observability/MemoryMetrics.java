package com.memfacade.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class MemoryMetrics {

    public static final String OPERATIONS = "memfacade.memory.operations";
    public static final String ANALYTICS_SCAN = "memfacade.analytics.scan";

    private final MeterRegistry registry;

    public MemoryMetrics() {
        this(new SimpleMeterRegistry());
    }

    public MemoryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter operations(String operation, String status) {
        return Counter.builder(OPERATIONS)
                .tag("operation", operation)
                .tag("status", status)
                .register(registry);
    }

    public void recordOperation(String operation, boolean success) {
        operations(operation, success ? "success" : "failed").increment();
    }

    public Timer analyticsScan() {
        return Timer.builder(ANALYTICS_SCAN).register(registry);
    }
}
