package com.harden.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 * Routes to subcommands: serve, run, status.
 */
@Command(
        name = "harden",
        mixinStandardHelpOptions = true,
        version = "harden 0.1.0",
        description = "Discover, analyze, harden and verify source units with an external reasoning tool",
        subcommands = {
                ServeCommand.class,
                RunCommand.class,
                StatusCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class HardenCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
