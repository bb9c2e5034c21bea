package com.ralphtown.core.process;

import java.io.InputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * A spawned agent process together with the group used to signal it.
 */
public class AgentProcess {

    private final Process process;
    private final ProcessGroup group;
    private static final long GROUP_POLL_MS = 50;

    private final Instant startedAt = Instant.now();

    AgentProcess(Process process, ProcessGroup group) {
        this.process = process;
        this.group = group;
    }

    public long pid() {
        return process.pid();
    }

    public InputStream stdout() {
        return process.getInputStream();
    }

    public InputStream stderr() {
        return process.getErrorStream();
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public Instant startedAt() {
        return startedAt;
    }

    ProcessGroup group() {
        return group;
    }

    /**
     * Blocks until the process exits. Must run on a background thread.
     */
    ExitOutcome waitFor() throws InterruptedException {
        return ExitOutcome.of(process.waitFor());
    }

    /**
     * Waits at most {@code timeout} for the process and every descendant seen by its
     * group to exit.
     *
     * @return true if the whole group has exited
     */
    boolean awaitExit(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            return false;
        }
        while (group.isAlive()) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(GROUP_POLL_MS);
        }
        return true;
    }
}
