package com.lorekeeper.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MemoryMetricsTest {

    @Test
    void countersRegisterOnceAndAccumulate() {
        var registry = new SimpleMeterRegistry();
        var metrics = new MemoryMetrics(registry);

        metrics.embeddingFailures().increment();
        metrics.embeddingFailures().increment();
        metrics.memoriesStarved().increment();

        assertEquals(2.0, registry.get("lorekeeper.embedding.failures").counter().count());
        assertEquals(1.0, registry.get("lorekeeper.context.memories.starved").counter().count());
        assertSame(registry, metrics.registry());
    }

    @Test
    void retrievalLatencyIsATimer() {
        var metrics = new MemoryMetrics();
        metrics.retrievalLatency().record(Duration.ofMillis(12));
        assertEquals(1, metrics.retrievalLatency().count());
        assertEquals(12.0, metrics.retrievalLatency().totalTime(java.util.concurrent.TimeUnit.MILLISECONDS), 0.001);
    }
}
