package com.bank.mulegraph.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicLong snapshotGeneration;
    private final AtomicInteger snapshotAccounts;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.snapshotGeneration = registry.gauge("graph.snapshot.generation", new AtomicLong(0));
        this.snapshotAccounts = registry.gauge("graph.snapshot.accounts", new AtomicInteger(0));
    }

    public void recordBatchRun(String status, Duration duration) {
        Counter.builder("graph.batch.count")
                .tag("status", status)
                .register(registry)
                .increment();

        Timer.builder("graph.batch.duration")
                .tag("status", status)
                .register(registry)
                .record(duration);
    }

    public void recordSnapshotSwap(long generation, int accountCount) {
        snapshotGeneration.set(generation);
        snapshotAccounts.set(accountCount);
    }

    public void recordEvaluation(String riskLevel) {
        Counter.builder("graph.evaluation.count")
                .tag("risk_level", riskLevel)
                .register(registry)
                .increment();
    }

    public void recordRealtimeDiversityFallback() {
        Counter.builder("graph.evaluation.diversity_fallback.count")
                .register(registry)
                .increment();
    }
}
