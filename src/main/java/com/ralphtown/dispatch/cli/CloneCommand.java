package com.ralphtown.dispatch.cli;

import com.ralphtown.core.clone.CloneEvent;
import com.ralphtown.core.clone.CloneProgressRelay;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CLI command: ralphtown clone &lt;url&gt;
 * <p>
 * Clones into the clone root, printing progress as it arrives and registering the
 * repository on success.
 */
@Command(name = "clone", mixinStandardHelpOptions = true, description = "Clone and register a repository")
@Component
public class CloneCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Repository URL")
    String url;

    private final CloneProgressRelay relay;

    public CloneCommand(CloneProgressRelay relay) {
        this.relay = relay;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Cloning " + url);

        AtomicBoolean succeeded = new AtomicBoolean(false);
        relay.relay(url, event -> {
            if (event instanceof CloneEvent.Progress p) {
                ConsoleOutput.cloneProgress(p.progress());
            } else if (event instanceof CloneEvent.Complete c) {
                succeeded.set(true);
                ConsoleOutput.success(c.message());
            } else if (event instanceof CloneEvent.Failed f) {
                ConsoleOutput.error(f.message());
                f.helpSteps().forEach(ConsoleOutput::hint);
            }
        }).join();

        return succeeded.get() ? 0 : 1;
    }
}
