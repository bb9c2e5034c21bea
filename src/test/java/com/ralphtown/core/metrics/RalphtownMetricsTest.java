package com.ralphtown.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RalphtownMetricsTest {

    private SimpleMeterRegistry registry;
    private RalphtownMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RalphtownMetrics(registry);
    }

    @Test
    void runStartedIncrements() {
        metrics.recordRunStarted();
        metrics.recordRunStarted();
        assertEquals(2.0, registry.counter("ralphtown.runs.started").count());
    }

    @Test
    void rejectionsAreTaggedByReason() {
        metrics.recordRunRejected("repo_busy");
        metrics.recordRunRejected("repo_busy");
        metrics.recordRunRejected("not_found");

        assertEquals(2.0, registry.counter("ralphtown.runs.rejected", "reason", "repo_busy").count());
        assertEquals(1.0, registry.counter("ralphtown.runs.rejected", "reason", "not_found").count());
    }

    @Test
    void runFinishedRecordsCounterAndTimer() {
        metrics.recordRunFinished("completed", 1500);

        assertEquals(1.0, registry.counter("ralphtown.runs.finished", "status", "completed").count());
        var timer = registry.find("ralphtown.runs.duration").tag("status", "completed").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertEquals(1500.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
    }

    @Test
    void cloneOutcomesAndDrops() {
        metrics.recordCloneResult("success");
        metrics.recordProgressDropped();
        metrics.recordProgressDropped();

        assertEquals(1.0, registry.counter("ralphtown.clones.total", "outcome", "success").count());
        assertEquals(2.0, registry.counter("ralphtown.clone.progress.dropped").count());
    }
}
