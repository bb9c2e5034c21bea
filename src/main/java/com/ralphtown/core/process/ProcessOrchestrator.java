package com.ralphtown.core.process;

import com.ralphtown.core.config.RalphtownProperties;
import com.ralphtown.core.events.EventBus;
import com.ralphtown.core.events.SessionEvent;
import com.ralphtown.core.logging.MdcContext;
import com.ralphtown.core.metrics.RalphtownMetrics;
import com.ralphtown.core.model.LogStream;
import com.ralphtown.core.model.SessionStatus;
import com.ralphtown.core.persistence.SessionStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The only component that starts, observes or stops a session's agent process.
 * <p>
 * Enforces one running process per session and per repository, drains the two
 * output streams into the store and the {@link EventBus}, and records exactly one
 * terminal status per run: {@code completed} or {@code error} from the exit path,
 * or {@code cancelled} from {@link #cancel}.
 * <p>
 * Store and broadcast failures while draining output or recording the final status
 * are logged and never stop supervision or registry cleanup. A terminal status is
 * written before the registry slot is released, so a follow-up run's {@code running}
 * status is never overwritten by the previous run.
 */
@Service
public class ProcessOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ProcessOrchestrator.class);

    private final ProcessSupervisor supervisor;
    private final SessionStore store;
    private final EventBus eventBus;
    private final RalphtownMetrics metrics;
    private final String executable;
    private final Duration cancelGrace;
    private final ActiveProcessRegistry registry = new ActiveProcessRegistry();
    private final ExecutorService executor;

    @Autowired
    public ProcessOrchestrator(ProcessSupervisor supervisor, SessionStore store, EventBus eventBus,
                               RalphtownMetrics metrics, RalphtownProperties properties) {
        this(supervisor, store, eventBus, metrics, properties.getAgentExecutable(),
                properties.getCancelGrace(), newSessionPool());
    }

    ProcessOrchestrator(ProcessSupervisor supervisor, SessionStore store, EventBus eventBus,
                        RalphtownMetrics metrics, String executable, Duration cancelGrace,
                        ExecutorService executor) {
        this.supervisor = supervisor;
        this.store = store;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.executable = executable;
        this.cancelGrace = cancelGrace;
        this.executor = executor;
    }

    private static ExecutorService newSessionPool() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "ralph-session-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the agent for a session and returns as soon as it is running.
     *
     * @throws SessionAlreadyRunningException if the session already has a process
     * @throws RepoBusyException              if another session is running on the repository
     * @throws AgentNotFoundException         if the agent executable is not on PATH
     * @throws SpawnFailedException           if the process could not be started
     */
    public void run(String sessionId, String repoId, Path repoPath, String prompt) {
        ActiveProcess entry;
        try {
            entry = registry.reserve(sessionId, repoId);
        } catch (RepoBusyException e) {
            log.info("Rejected run for session {}: {}", sessionId, e.getMessage());
            metrics.recordRunRejected("repo_busy");
            throw e;
        } catch (SessionAlreadyRunningException e) {
            log.info("Rejected run for session {}: {}", sessionId, e.getMessage());
            metrics.recordRunRejected("session_running");
            throw e;
        }

        AgentProcess process;
        try {
            process = supervisor.spawn(repoPath, agentCommand(prompt));
        } catch (AgentNotFoundException e) {
            registry.release(entry);
            metrics.recordRunRejected("not_found");
            throw e;
        } catch (RuntimeException e) {
            registry.release(entry);
            metrics.recordRunRejected("spawn_failed");
            throw e;
        }
        entry.attach(process);

        recordStatus(sessionId, SessionStatus.RUNNING);
        metrics.recordRunStarted();
        log.info("Ralph process started for session {} (pid {})", sessionId, process.pid());

        CompletableFuture<Void> stdout = CompletableFuture.runAsync(
                () -> drain(entry, process.stdout(), LogStream.STDOUT), executor);
        CompletableFuture<Void> stderr = CompletableFuture.runAsync(
                () -> drain(entry, process.stderr(), LogStream.STDERR), executor);
        CompletableFuture.allOf(stdout, stderr)
                .whenCompleteAsync((ignored, ex) -> onStreamsClosed(entry), executor);
    }

    /**
     * Stops a running session: graceful signal, up to the grace window for the
     * process and its descendants to exit, then a forced kill of whatever is left.
     *
     * @throws NotRunningException if the session has no live process
     */
    public void cancel(String sessionId) {
        ActiveProcess entry = registry.get(sessionId)
                .orElseThrow(() -> new NotRunningException(sessionId));
        AgentProcess process = entry.process();
        if (process == null || !entry.claimTerminalStatus()) {
            // still spawning, or the exit path already owns the terminal status
            throw new NotRunningException(sessionId);
        }

        MdcContext.setSession(sessionId, entry.repoId());
        try {
            supervisor.terminate(process);
            if (!awaitExit(process)) {
                log.warn("Session {} did not stop within {}ms, escalating", sessionId, cancelGrace.toMillis());
                supervisor.kill(process);
            }
            recordStatus(sessionId, SessionStatus.CANCELLED);
            metrics.recordRunFinished(SessionStatus.CANCELLED.value(), elapsedMs(process));
            log.info("Ralph process for session {} cancelled", sessionId);
        } finally {
            registry.release(entry);
            MdcContext.clear();
        }
    }

    public boolean isRepoBusy(String repoId) {
        return registry.isRepoBusy(repoId);
    }

    public boolean isSessionRunning(String sessionId) {
        return registry.isSessionRunning(sessionId);
    }

    public List<String> activeSessions() {
        return registry.snapshot().stream().map(ActiveProcess::sessionId).toList();
    }

    @PreDestroy
    void shutdown() {
        for (ActiveProcess entry : registry.snapshot()) {
            AgentProcess process = entry.process();
            if (process != null && process.isAlive()) {
                log.info("Stopping session {} on shutdown", entry.sessionId());
                supervisor.terminate(process);
            }
        }
        executor.shutdownNow();
    }

    List<String> agentCommand(String prompt) {
        return List.of(executable, "run", "--autonomous", "--prompt", prompt);
    }

    private void drain(ActiveProcess entry, InputStream in, LogStream stream) {
        String sessionId = entry.sessionId();
        MdcContext.setSession(sessionId, entry.repoId());
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                try {
                    store.insertOutputLog(sessionId, stream, line);
                } catch (RuntimeException e) {
                    log.warn("Failed to persist {} output: {}", stream.value(), e.getMessage());
                }
                try {
                    eventBus.publish(SessionEvent.output(sessionId, stream.value(), line));
                } catch (RuntimeException e) {
                    log.warn("Failed to broadcast {} output: {}", stream.value(), e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Error reading {}: {}", stream.value(), e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    private void onStreamsClosed(ActiveProcess entry) {
        String sessionId = entry.sessionId();
        AgentProcess process = entry.process();
        MdcContext.setSession(sessionId, entry.repoId());
        try {
            ExitOutcome outcome;
            try {
                outcome = supervisor.waitFor(process);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcome = ExitOutcome.abnormal();
            }

            if (!entry.claimTerminalStatus()) {
                log.debug("Session {} exited after cancel (code {})", sessionId, outcome.exitCode());
                return;
            }

            SessionStatus finalStatus = outcome.success() ? SessionStatus.COMPLETED : SessionStatus.ERROR;
            try {
                recordStatus(sessionId, finalStatus);
                metrics.recordRunFinished(finalStatus.value(), elapsedMs(process));
                log.info("Ralph process for session {} finished with status {} (exit code {})",
                        sessionId, finalStatus.value(), outcome.exitCode());
            } finally {
                registry.release(entry);
            }
        } finally {
            MdcContext.clear();
        }
    }

    private boolean awaitExit(AgentProcess process) {
        try {
            return process.awaitExit(cancelGrace);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void recordStatus(String sessionId, SessionStatus status) {
        try {
            store.updateSessionStatus(sessionId, status);
        } catch (RuntimeException e) {
            log.error("Failed to update session {} status to {}: {}", sessionId, status.value(), e.getMessage());
        }
        try {
            eventBus.publish(SessionEvent.status(sessionId, status.value()));
        } catch (RuntimeException e) {
            log.warn("Failed to broadcast status {} for session {}: {}", status.value(), sessionId, e.getMessage());
        }
    }

    private static long elapsedMs(AgentProcess process) {
        return Duration.between(process.startedAt(), Instant.now()).toMillis();
    }
}
