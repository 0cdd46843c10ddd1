package com.syncline.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Syncline.
 * Routes to subcommands: replay, serve, health.
 */
@Command(
        name = "syncline",
        mixinStandardHelpOptions = true,
        version = "Syncline 0.1.0",
        description = "Real-time event synchronization for chat stream projections",
        subcommands = {
                ReplayCommand.class,
                ServeCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SynclineCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // reuse the parsed command line so subcommands keep their factory-built instances
        spec.commandLine().usage(System.out);
    }
}
