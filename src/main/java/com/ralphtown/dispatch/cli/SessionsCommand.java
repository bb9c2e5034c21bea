package com.ralphtown.dispatch.cli;

import com.ralphtown.core.model.Session;
import com.ralphtown.core.session.SessionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: ralphtown sessions
 * <p>
 * Lists sessions, most recently updated first.
 */
@Command(name = "sessions", mixinStandardHelpOptions = true, description = "List sessions")
@Component
public class SessionsCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "20")
    int limit;

    private final SessionService sessionService;

    public SessionsCommand(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<Session> sessions = sessionService.list();
        if (sessions.isEmpty()) {
            ConsoleOutput.info("No sessions found.");
            return;
        }

        List<Session> display = sessions.size() > limit ? sessions.subList(0, limit) : sessions;

        ConsoleOutput.info("Sessions (" + display.size() + " of " + sessions.size() + "):");
        System.out.println();
        System.out.printf("  %-36s %-10s %-24s %s%n", "SESSION ID", "STATUS", "UPDATED", "NAME");
        System.out.println("  " + "-".repeat(86));
        for (Session session : display) {
            System.out.printf("  %-36s %-10s %-24s %s%n", session.id(), session.status().value(),
                    session.updatedAt(), ConsoleOutput.truncate(session.name(), 30));
        }
    }
}
