package com.sandcastle.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Sandcastle.
 */
@Command(
        name = "sandcastle",
        mixinStandardHelpOptions = true,
        version = "Sandcastle 0.1.0",
        description = "Create and manage containerized development sandboxes",
        subcommands = {
                CreateCommand.class,
                ListCommand.class,
                ShowCommand.class,
                StatusCommand.class,
                StartCommand.class,
                StopCommand.class,
                RestartCommand.class,
                PauseCommand.class,
                UnpauseCommand.class,
                DeleteCommand.class,
                ExecCommand.class,
                LogsCommand.class,
                StatsCommand.class,
                CommitCommand.class,
                GitStatusCommand.class,
                GitLogCommand.class,
                CatalogCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SandcastleCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
