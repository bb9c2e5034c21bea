package com.ralphtown.core.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Starts, waits for and signals one external command per session.
 * <p>
 * Spawned processes run in the given working directory with stdin closed and both
 * output streams piped. Escalation from graceful to forced termination is left to
 * the caller.
 */
@Component
public class ProcessSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);

    private final String searchPath;

    public ProcessSupervisor() {
        this(System.getenv("PATH"));
    }

    ProcessSupervisor(String searchPath) {
        this.searchPath = searchPath == null ? "" : searchPath;
    }

    /**
     * Spawns {@code command} in {@code workingDir}.
     *
     * @param workingDir directory the process runs in; must exist
     * @param command    executable name followed by its arguments
     * @throws AgentNotFoundException if the executable cannot be resolved
     * @throws SpawnFailedException   for any other start failure
     */
    public AgentProcess spawn(Path workingDir, List<String> command) {
        if (command.isEmpty()) {
            throw new SpawnFailedException("empty command");
        }
        if (workingDir == null || !Files.isDirectory(workingDir)) {
            throw new SpawnFailedException("working directory does not exist: " + workingDir);
        }
        String executable = command.get(0);
        Path resolved = resolveExecutable(executable)
                .orElseThrow(() -> new AgentNotFoundException(executable));

        List<String> argv = new ArrayList<>(command);
        argv.set(0, resolved.toString());

        Process process;
        try {
            process = new ProcessBuilder(argv)
                    .directory(workingDir.toFile())
                    .start();
        } catch (IOException e) {
            log.error("Failed to start {} in {}: {}", executable, workingDir, e.getMessage());
            throw new SpawnFailedException(e.getMessage(), e);
        }

        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of pid {}: {}", process.pid(), e.getMessage());
        }

        log.info("Spawned {} (pid {}) in {}", executable, process.pid(), workingDir);
        return new AgentProcess(process, ProcessGroup.of(process));
    }

    /**
     * Blocks until the process exits. Never call this on a request thread.
     */
    public ExitOutcome waitFor(AgentProcess process) throws InterruptedException {
        return process.waitFor();
    }

    /** Sends the graceful-termination signal to the process group. */
    public void terminate(AgentProcess process) {
        log.info("Requesting graceful stop of pid {}", process.pid());
        process.group().requestGracefulStop();
    }

    /** Sends the forced-termination signal to the process group. */
    public void kill(AgentProcess process) {
        log.warn("Force-killing pid {}", process.pid());
        process.group().forceStop();
    }

    /**
     * Resolves an executable name against the search path. Names containing a
     * path separator are checked as-is.
     */
    public Optional<Path> resolveExecutable(String name) {
        if (name.contains("/") || name.contains(File.separator)) {
            Path direct = Path.of(name);
            return Files.isExecutable(direct) ? Optional.of(direct) : Optional.empty();
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            for (String candidate : candidateNames(name)) {
                Path path = Path.of(dir, candidate);
                if (Files.isRegularFile(path) && Files.isExecutable(path)) {
                    return Optional.of(path);
                }
            }
        }
        return Optional.empty();
    }

    private static List<String> candidateNames(String name) {
        if (!System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows")) {
            return List.of(name);
        }
        List<String> names = new ArrayList<>();
        names.add(name);
        String pathExt = System.getenv().getOrDefault("PATHEXT", ".EXE;.BAT;.CMD");
        for (String ext : pathExt.split(";")) {
            names.add(name + ext.toLowerCase(Locale.ROOT));
        }
        return names;
    }
}
