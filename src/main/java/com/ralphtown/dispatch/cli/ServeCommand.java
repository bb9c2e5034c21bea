package com.ralphtown.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: ralphtown serve
 * <p>
 * Starts the HTTP server. The web server itself is enabled by
 * {@link com.ralphtown.RalphtownApplication#main} detecting "serve" in args; the
 * banner is printed once the server has bound its port.
 * <p>
 * Configure port via: {@code SERVER_PORT=4000 ralphtown serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Ralphtown HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:3000}")
    private int port;

    @Override
    public void run() {
        // Only reached via picocli, e.g. when combined with --help handling.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Ralphtown server running on port " + port);
        System.out.println();
        System.out.println("  API:        http://127.0.0.1:" + port + "/api");
        System.out.println("  Health:     http://127.0.0.1:" + port + "/api/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
