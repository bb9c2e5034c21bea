package com.ralphtown.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Ralphtown.
 */
@Command(
        name = "ralphtown",
        mixinStandardHelpOptions = true,
        version = "Ralphtown 0.1.0",
        description = "Local backend for running ralph agent sessions against git repositories",
        subcommands = {
                ServeCommand.class,
                HealthCommand.class,
                SessionsCommand.class,
                ReposCommand.class,
                CloneCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class RalphtownCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
