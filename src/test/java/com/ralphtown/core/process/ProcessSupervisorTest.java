package com.ralphtown.core.process;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class ProcessSupervisorTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("resolveExecutable")
    class ResolveTests {

        @Test
        @DisplayName("finds an executable on the search path")
        void findsOnPath() throws IOException {
            Path bin = Files.createDirectories(tempDir.resolve("bin"));
            Path script = AgentScripts.write(bin, "ralph", "exit 0");

            var supervisor = new ProcessSupervisor("/nonexistent:" + bin);

            assertEquals(script, supervisor.resolveExecutable("ralph").orElseThrow());
        }

        @Test
        @DisplayName("non-executable files are skipped")
        void skipsNonExecutable() throws IOException {
            Path bin = Files.createDirectories(tempDir.resolve("bin"));
            Files.writeString(bin.resolve("ralph"), "not a program");

            assertTrue(new ProcessSupervisor(bin.toString()).resolveExecutable("ralph").isEmpty());
        }

        @Test
        @DisplayName("names with a separator are checked directly")
        void directPath() throws IOException {
            Path script = AgentScripts.write(tempDir, "agent.sh", "exit 0");

            var supervisor = new ProcessSupervisor("");

            assertEquals(script, supervisor.resolveExecutable(script.toString()).orElseThrow());
            assertTrue(supervisor.resolveExecutable(tempDir.resolve("missing.sh").toString()).isEmpty());
        }
    }

    @Nested
    @DisplayName("spawn")
    class SpawnTests {

        @Test
        @DisplayName("runs in the working directory with arguments and a closed stdin")
        void spawnsWithArgs() throws Exception {
            Path script = AgentScripts.write(tempDir, "agent.sh", """
                    pwd
                    echo "$@"
                    cat
                    echo done
                    """);
            Path work = Files.createDirectories(tempDir.resolve("work"));

            var supervisor = new ProcessSupervisor("");
            AgentProcess process = supervisor.spawn(work, List.of(script.toString(), "run", "--prompt", "hi"));

            String stdout = new String(process.stdout().readAllBytes(), StandardCharsets.UTF_8);
            ExitOutcome outcome = supervisor.waitFor(process);

            assertEquals(List.of(work.toRealPath().toString(), "run --prompt hi", "done"), stdout.lines().toList());
            assertTrue(outcome.success());
        }

        @Test
        @DisplayName("non-zero exit is reported as failure")
        void nonZeroExit() throws Exception {
            Path script = AgentScripts.write(tempDir, "agent.sh", "exit 7");

            var supervisor = new ProcessSupervisor("");
            ExitOutcome outcome = supervisor.waitFor(supervisor.spawn(tempDir, List.of(script.toString())));

            assertEquals(7, outcome.exitCode());
            assertFalse(outcome.success());
        }

        @Test
        @DisplayName("unresolvable executable raises AgentNotFoundException with help steps")
        void notFound() {
            var supervisor = new ProcessSupervisor(tempDir.toString());

            var ex = assertThrows(AgentNotFoundException.class,
                    () -> supervisor.spawn(tempDir, List.of("ralph", "run")));
            assertEquals("ralph CLI not found in PATH", ex.getMessage());
            assertEquals(4, ex.helpSteps().size());
        }

        @Test
        @DisplayName("missing working directory or empty command fails to spawn")
        void invalidInputs() throws IOException {
            Path script = AgentScripts.write(tempDir, "agent.sh", "exit 0");
            var supervisor = new ProcessSupervisor("");

            assertThrows(SpawnFailedException.class,
                    () -> supervisor.spawn(tempDir.resolve("nope"), List.of(script.toString())));
            assertThrows(SpawnFailedException.class, () -> supervisor.spawn(tempDir, List.of()));
        }
    }

    @Nested
    @DisplayName("termination")
    class TerminationTests {

        @Test
        @DisplayName("terminate stops a sleeping script and its children")
        void terminateStopsTree() throws Exception {
            Path script = AgentScripts.write(tempDir, "agent.sh", "sleep 30 & wait");
            var supervisor = new ProcessSupervisor("");
            AgentProcess process = supervisor.spawn(tempDir, List.of(script.toString()));

            AgentScripts.awaitTrue(() -> ProcessHandle.of(process.pid()).map(h -> h.children().count() > 0).orElse(false),
                    Duration.ofSeconds(5), "sleep child to start");
            List<ProcessHandle> children = ProcessHandle.of(process.pid()).orElseThrow().descendants().toList();

            supervisor.terminate(process);

            assertTrue(process.awaitExit(Duration.ofSeconds(5)));
            for (ProcessHandle child : children) {
                AgentScripts.awaitTrue(() -> !child.isAlive(), Duration.ofSeconds(5), "child " + child.pid() + " to exit");
            }
        }

        @Test
        @DisplayName("kill stops a script that ignores the graceful signal")
        void killIgnoresTrap() throws Exception {
            Path script = AgentScripts.write(tempDir, "agent.sh", """
                    trap '' TERM
                    echo ready
                    while true; do sleep 1; done
                    """);
            var supervisor = new ProcessSupervisor("");
            AgentProcess process = supervisor.spawn(tempDir, List.of(script.toString()));
            process.stdout().read();

            supervisor.terminate(process);
            assertFalse(process.awaitExit(Duration.ofMillis(300)));

            supervisor.kill(process);
            assertTrue(process.awaitExit(Duration.ofSeconds(5)));
        }
    }
}
