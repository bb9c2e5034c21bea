package com.ralphtown.core.clone;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.EmptyProgressMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * {@link RepositoryCloner} backed by JGit's clone command.
 * <p>
 * JGit reports progress as named tasks; "Receiving objects" and "Resolving deltas"
 * are translated into {@link CloneProgress} counters. JGit does not expose transferred
 * byte counts through its progress monitor, so {@code receivedBytes} stays zero.
 */
@Component
public class JGitRepositoryCloner implements RepositoryCloner {

    private static final Logger log = LoggerFactory.getLogger(JGitRepositoryCloner.class);

    @Override
    public void clone(String url, Path destination, Consumer<CloneProgress> progress) throws CloneException {
        log.info("Cloning {} into {}", url, destination);
        try (Git ignored = Git.cloneRepository()
                .setURI(url)
                .setDirectory(destination.toFile())
                .setProgressMonitor(new RelayingMonitor(progress))
                .call()) {
            log.info("Clone of {} finished", url);
        } catch (GitAPIException | RuntimeException e) {
            log.warn("Clone of {} failed: {}", url, e.getMessage());
            throw CloneErrorClassifier.classify(url, e);
        }
    }

    /**
     * Converts JGit task callbacks into counter snapshots.
     */
    static class RelayingMonitor extends EmptyProgressMonitor {

        private final Consumer<CloneProgress> sink;
        private String task = "";
        private long taskTotal;
        private long taskDone;

        private long receivedObjects;
        private long totalObjects;
        private long totalDeltas;
        private long indexedDeltas;

        RelayingMonitor(Consumer<CloneProgress> sink) {
            this.sink = sink;
        }

        @Override
        public void beginTask(String title, int totalWork) {
            task = title == null ? "" : title.toLowerCase(Locale.ROOT);
            taskTotal = Math.max(totalWork, 0);
            taskDone = 0;
            if (isReceiving()) {
                totalObjects = taskTotal;
            } else if (isResolving()) {
                totalDeltas = taskTotal;
            }
        }

        @Override
        public void update(int completed) {
            taskDone += completed;
            if (isReceiving()) {
                receivedObjects = taskDone;
            } else if (isResolving()) {
                indexedDeltas = taskDone;
            } else {
                return;
            }
            sink.accept(snapshot());
        }

        @Override
        public void endTask() {
            if (isReceiving() || isResolving()) {
                sink.accept(snapshot());
            }
            task = "";
        }

        private boolean isReceiving() {
            return task.startsWith("receiving objects");
        }

        private boolean isResolving() {
            return task.startsWith("resolving deltas");
        }

        private CloneProgress snapshot() {
            return new CloneProgress(receivedObjects, totalObjects, 0, receivedObjects, totalDeltas, indexedDeltas);
        }
    }
}
