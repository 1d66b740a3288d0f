package com.bulwark.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Bulwark.
 * Routes to subcommands: scan, checks.
 */
@Command(
        name = "bulwark",
        mixinStandardHelpOptions = true,
        version = "Bulwark 0.1.0",
        description = "Rule-based security posture audit for project source trees",
        subcommands = {
                ScanCommand.class,
                ChecksCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class BulwarkCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
