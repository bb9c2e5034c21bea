package com.ralphtown.dispatch.cli;

import com.ralphtown.core.clone.CloneProgressRelay;
import com.ralphtown.core.health.HealthCheckService;
import com.ralphtown.core.health.HealthStatus;
import com.ralphtown.core.repos.RepoService;
import com.ralphtown.core.session.SessionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CliRunnerTest {

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;

    private HealthCheckService healthCheckService;
    private CliRunner runner;

    @BeforeEach
    void setUp() {
        PrintStream sink = new PrintStream(new ByteArrayOutputStream(), true);
        System.setOut(sink);
        System.setErr(sink);

        healthCheckService = mock(HealthCheckService.class);
        SessionService sessionService = mock(SessionService.class);
        RepoService repoService = mock(RepoService.class);
        CloneProgressRelay cloneRelay = mock(CloneProgressRelay.class);

        CommandLine.IFactory factory = new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                if (cls == SessionsCommand.class) {
                    return (K) new SessionsCommand(sessionService);
                }
                if (cls == ReposCommand.class) {
                    return (K) new ReposCommand(repoService);
                }
                if (cls == CloneCommand.class) {
                    return (K) new CloneCommand(cloneRelay);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
        runner = new CliRunner(new RalphtownCommand(), factory);
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void serveIsLeftToTheWebServer() throws Exception {
        runner.run("serve");

        assertEquals(0, runner.getExitCode());
        verifyNoInteractions(healthCheckService);
    }

    @Test
    void exitCodeComesFromTheCommand() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("agent", HealthStatus.Status.DOWN, "ralph CLI not found in PATH", Map.of())));

        runner.run("health");

        assertEquals(1, runner.getExitCode());
    }

    @Test
    void usageErrorsGiveNonZeroExit() throws Exception {
        runner.run("sessions", "--limit", "many");

        assertNotEquals(0, runner.getExitCode());
    }
}
