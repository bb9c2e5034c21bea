package com.ralphtown.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for session runs and clones.
 */
@Service
public class RalphtownMetrics {

    private final MeterRegistry registry;

    public RalphtownMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunStarted() {
        Counter.builder("ralphtown.runs.started")
                .register(registry)
                .increment();
    }

    /**
     * @param reason "repo_busy", "session_running", "not_found" or "spawn_failed"
     */
    public void recordRunRejected(String reason) {
        Counter.builder("ralphtown.runs.rejected")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordRunFinished(String status, long ms) {
        Counter.builder("ralphtown.runs.finished")
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("ralphtown.runs.duration")
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordCloneResult(String outcome) {
        Counter.builder("ralphtown.clones.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordProgressDropped() {
        Counter.builder("ralphtown.clone.progress.dropped")
                .description("Clone progress snapshots dropped because the relay channel was full")
                .register(registry)
                .increment();
    }
}
