package com.codescout.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Codescout.
 * Routes to subcommands: review, sessions, health, serve.
 */
@Command(
        name = "codescout",
        mixinStandardHelpOptions = true,
        version = "Codescout 0.1.0",
        description = "Code review agent that explores the codebase on demand",
        subcommands = {
                ReviewCommand.class,
                SessionsCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CodescoutCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
