package com.lorekeeper.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class MemoryMetrics {

    private final MeterRegistry registry;

    public MemoryMetrics() {
        this(new SimpleMeterRegistry());
    }

    public MemoryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter embeddingFailures() {
        return Counter.builder("lorekeeper.embedding.failures").register(registry);
    }

    public Counter embeddingExhausted() {
        return Counter.builder("lorekeeper.embedding.exhausted").register(registry);
    }

    public Counter journalCreated() {
        return Counter.builder("lorekeeper.journal.created").register(registry);
    }

    public Counter journalSkipped() {
        return Counter.builder("lorekeeper.journal.skipped").register(registry);
    }

    public Counter heuristicFallbacks() {
        return Counter.builder("lorekeeper.journal.heuristic").register(registry);
    }

    public Timer retrievalLatency() {
        return Timer.builder("lorekeeper.retrieval.latency").register(registry);
    }

    public Counter rerankFallbacks() {
        return Counter.builder("lorekeeper.rerank.fallbacks").register(registry);
    }

    public Counter bruteForceQueries() {
        return Counter.builder("lorekeeper.store.bruteforce").register(registry);
    }

    public Counter memoriesStarved() {
        return Counter.builder("lorekeeper.context.memories.starved").register(registry);
    }
}
