package com.bulwark.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and hands the command's exit code back to Spring.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final BulwarkCommand bulwarkCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(BulwarkCommand bulwarkCommand, IFactory factory) {
        this.bulwarkCommand = bulwarkCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        exitCode = new CommandLine(bulwarkCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
