package com.ralphtown.core.clone;

import com.ralphtown.core.config.RalphtownProperties;
import com.ralphtown.core.logging.MdcContext;
import com.ralphtown.core.metrics.RalphtownMetrics;
import com.ralphtown.core.model.Repo;
import com.ralphtown.core.persistence.SessionStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Runs a blocking clone in the background and relays it as a stream of
 * {@link CloneEvent}s that always ends with exactly one terminal event.
 * <p>
 * Progress snapshots cross from the cloning thread to the relaying thread through a
 * bounded queue using non-blocking {@code offer}: when the queue is full the snapshot
 * is dropped, so a slow consumer can never stall the clone.
 */
@Service
public class CloneProgressRelay {

    private static final Logger log = LoggerFactory.getLogger(CloneProgressRelay.class);

    private static final long POLL_INTERVAL_MS = 50;

    private final RepositoryCloner cloner;
    private final SessionStore store;
    private final RalphtownMetrics metrics;
    private final Path cloneRoot;
    private final int capacity;
    private final ExecutorService executor;

    @Autowired
    public CloneProgressRelay(RepositoryCloner cloner, SessionStore store, RalphtownMetrics metrics,
                              RalphtownProperties properties) {
        this(cloner, store, metrics, properties.getCloneRoot(), properties.getProgressCapacity(), newClonePool());
    }

    CloneProgressRelay(RepositoryCloner cloner, SessionStore store, RalphtownMetrics metrics,
                       Path cloneRoot, int capacity, ExecutorService executor) {
        this.cloner = cloner;
        this.store = store;
        this.metrics = metrics;
        this.cloneRoot = cloneRoot;
        this.capacity = capacity;
        this.executor = executor;
    }

    private static ExecutorService newClonePool() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "clone-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts cloning {@code url} into the clone root and streams events to {@code sink}.
     * Validation failures are reported as a single error event before any background
     * work starts.
     *
     * @return a future that completes after the terminal event was delivered
     */
    public CompletableFuture<Void> relay(String url, Consumer<CloneEvent> sink) {
        String name;
        try {
            name = GitUrls.extractRepoName(url);
        } catch (IllegalArgumentException e) {
            return rejected(sink, e.getMessage());
        }

        Path destination = cloneRoot.resolve(name);
        if (Files.exists(destination)) {
            return rejected(sink, "Directory already exists: " + destination);
        }
        try {
            Files.createDirectories(cloneRoot);
        } catch (IOException e) {
            return rejected(sink, "Failed to create directory: " + e.getMessage());
        }

        BlockingQueue<CloneProgress> channel = new ArrayBlockingQueue<>(capacity);
        CompletableFuture<Void> cloneTask = CompletableFuture.runAsync(() -> {
            MdcContext.setClone(url);
            try {
                cloner.clone(url, destination, snapshot -> {
                    if (!channel.offer(snapshot)) {
                        metrics.recordProgressDropped();
                    }
                });
            } catch (CloneException e) {
                throw new CompletionException(e);
            } finally {
                MdcContext.clear();
            }
        }, executor);

        return CompletableFuture.runAsync(
                () -> relayUntilDone(url, name, destination, channel, cloneTask, sink), executor);
    }

    /**
     * Clones synchronously.
     *
     * @return the registered repository
     * @throws CloneRequestException carrying the error event's message and help steps
     */
    public Repo cloneNow(String url) {
        AtomicReference<CloneEvent> terminal = new AtomicReference<>();
        relay(url, event -> {
            if (event.isTerminal()) {
                terminal.set(event);
            }
        }).join();

        CloneEvent event = terminal.get();
        if (event instanceof CloneEvent.Complete complete) {
            return complete.repo();
        }
        if (event instanceof CloneEvent.Failed failed) {
            throw new CloneRequestException(failed.message(), failed.helpSteps());
        }
        throw new CloneRequestException("Clone ended without a result", List.of());
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    private void relayUntilDone(String url, String name, Path destination, BlockingQueue<CloneProgress> channel,
                                CompletableFuture<Void> cloneTask, Consumer<CloneEvent> sink) {
        MdcContext.setClone(url);
        boolean terminalSent = false;
        try {
            drain(channel, cloneTask, sink);
            CloneEvent terminal = awaitOutcome(name, destination, cloneTask);
            emit(sink, terminal);
            terminalSent = true;
            metrics.recordCloneResult(terminal.type());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Clone relay for {} interrupted", url);
        } finally {
            if (!terminalSent) {
                emit(sink, CloneEvent.Failed.of("Clone task failed: relay stopped before the clone finished"));
                metrics.recordCloneResult(CloneEvent.ERROR);
            }
            MdcContext.clear();
        }
    }

    /**
     * Forwards snapshots until the clone has returned and the channel is empty.
     */
    private void drain(BlockingQueue<CloneProgress> channel, CompletableFuture<Void> cloneTask,
                       Consumer<CloneEvent> sink) throws InterruptedException {
        while (true) {
            CloneProgress snapshot = channel.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            if (snapshot != null) {
                emit(sink, new CloneEvent.Progress(snapshot));
            } else if (cloneTask.isDone()) {
                // no more producers: flush what is left and stop
                while ((snapshot = channel.poll()) != null) {
                    emit(sink, new CloneEvent.Progress(snapshot));
                }
                return;
            }
        }
    }

    private CloneEvent awaitOutcome(String name, Path destination, CompletableFuture<Void> cloneTask) {
        try {
            cloneTask.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof CloneException clone) {
                return new CloneEvent.Failed(clone.userMessage(), clone.helpSteps());
            }
            log.error("Clone task failed unexpectedly", cause);
            return CloneEvent.Failed.of("Clone task failed: " + cause.getMessage());
        } catch (CancellationException e) {
            return CloneEvent.Failed.of("Clone task failed: cancelled");
        }

        try {
            Repo repo = store.insertRepo(destination.toString(), name);
            log.info("Registered cloned repo {} at {}", repo.id(), destination);
            return new CloneEvent.Complete(repo, "Cloned to " + destination);
        } catch (RuntimeException e) {
            log.error("Clone succeeded but repo could not be saved: {}", e.getMessage());
            return CloneEvent.Failed.of("Failed to save repo to database: " + e.getMessage());
        }
    }

    private CompletableFuture<Void> rejected(Consumer<CloneEvent> sink, String message) {
        log.info("Clone rejected: {}", message);
        emit(sink, CloneEvent.Failed.of(message));
        metrics.recordCloneResult(CloneEvent.ERROR);
        return CompletableFuture.completedFuture(null);
    }

    private static void emit(Consumer<CloneEvent> sink, CloneEvent event) {
        try {
            sink.accept(event);
        } catch (RuntimeException e) {
            log.debug("Clone event consumer rejected {} event: {}", event.type(), e.getMessage());
        }
    }
}
