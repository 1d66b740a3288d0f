package com.bulwark.dispatch.cli;

import com.bulwark.core.check.Check;
import com.bulwark.core.check.CheckRunner;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: bulwark checks
 * <p>
 * Lists the registered checks in the order they run.
 */
@Command(name = "checks", mixinStandardHelpOptions = true, description = "List registered checks")
@Component
public class ChecksCommand implements Runnable {

    private final CheckRunner checkRunner;

    public ChecksCommand(CheckRunner checkRunner) {
        this.checkRunner = checkRunner;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        int i = 1;
        for (Check check : checkRunner.checks()) {
            System.out.printf("  %d. %-22s %s%n", i++, check.name(), check.displayName());
        }
    }
}
