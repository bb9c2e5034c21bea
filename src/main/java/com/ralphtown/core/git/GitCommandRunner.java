package com.ralphtown.core.git;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs git write operations through the {@code git} CLI so that the user's
 * credential helpers and hooks apply.
 * <p>
 * Input is validated on the calling thread; the command itself runs on a
 * background pool and its future completes with the captured output. A non-zero
 * exit is reported through {@link CommandOutput#success()}, not as an exception.
 */
@Component
public class GitCommandRunner {

    private static final Logger log = LoggerFactory.getLogger(GitCommandRunner.class);

    private final ExecutorService executor;

    public GitCommandRunner() {
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "git-command-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public CompletableFuture<CommandOutput> pull(Path repoPath) {
        return run(repoPath, "pull");
    }

    public CompletableFuture<CommandOutput> push(Path repoPath) {
        return run(repoPath, "push");
    }

    public CompletableFuture<CommandOutput> commit(Path repoPath, String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Commit message cannot be empty");
        }
        return run(repoPath, "commit", "-m", message);
    }

    public CompletableFuture<CommandOutput> resetHard(Path repoPath) {
        return run(repoPath, "reset", "--hard");
    }

    /**
     * @throws GitOperationException with {@code INVALID_BRANCH} for names that could be
     *                               read as options or revision ranges
     */
    public CompletableFuture<CommandOutput> checkout(Path repoPath, String branch) {
        validateBranch(branch);
        return run(repoPath, "checkout", branch);
    }

    public CompletableFuture<CommandOutput> addAll(Path repoPath) {
        return run(repoPath, "add", "-A");
    }

    static void validateBranch(String branch) {
        if (branch == null || branch.isBlank() || branch.contains("..")
                || branch.startsWith("-") || branch.indexOf('\0') >= 0) {
            throw new GitOperationException(GitOperationException.Kind.INVALID_BRANCH,
                    "Invalid branch name: " + branch);
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    private CompletableFuture<CommandOutput> run(Path repoPath, String... args) {
        if (!Files.exists(repoPath.resolve(".git"))) {
            throw GitOperationException.notARepo(repoPath.toString());
        }
        return CompletableFuture.supplyAsync(() -> runGit(repoPath, args), executor);
    }

    private CommandOutput runGit(Path repoPath, String... args) {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(List.of(args));
        log.info("Running git {} in {}", args[0], repoPath);
        try {
            Process process = new ProcessBuilder(command)
                    .directory(repoPath.toFile())
                    .start();
            process.getOutputStream().close();

            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(
                    () -> readFully(process.getErrorStream()), executor);
            String stdout = readFully(process.getInputStream());
            int exitCode = process.waitFor();

            if (exitCode != 0) {
                log.warn("git {} exited with code {}", args[0], exitCode);
            }
            return new CommandOutput(exitCode == 0, stdout, stderr.join());
        } catch (IOException e) {
            throw new GitOperationException(GitOperationException.Kind.COMMAND_FAILED,
                    "Failed to run git: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitOperationException(GitOperationException.Kind.COMMAND_FAILED,
                    "Interrupted while running git " + args[0], e);
        }
    }

    private static String readFully(InputStream in) {
        try (in; ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            in.transferTo(out);
            return out.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
