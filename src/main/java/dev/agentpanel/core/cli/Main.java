package dev.agentpanel.core.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code ap} command.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new ApCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
