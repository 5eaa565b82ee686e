package com.sandcastle.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final SandcastleCommand sandcastleCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SandcastleCommand sandcastleCommand, IFactory factory) {
        this.sandcastleCommand = sandcastleCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine(sandcastleCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static CommandLine commandLine(SandcastleCommand root, IFactory factory) {
        return new CommandLine(root, factory)
                .setExecutionExceptionHandler(new CliExceptionHandler());
    }
}
