package com.sandcastle.dispatch.cli;

import com.sandcastle.core.engine.SandboxOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: sandcastle git-log &lt;id&gt;
 */
@Command(name = "git-log", mixinStandardHelpOptions = true, description = "Show recent commits of a sandbox repository")
@Component
public class GitLogCommand implements Runnable {

    @Parameters(index = "0", description = "Sandbox ID")
    private String sandboxId;

    @Option(names = {"--limit", "-n"}, description = "Maximum number of commits (default: ${DEFAULT-VALUE})",
            defaultValue = "20")
    private Integer limit;

    private final SandboxOrchestrator orchestrator;

    public GitLogCommand(SandboxOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        var log = orchestrator.getGitLog(sandboxId, limit);
        if (log.commits().isEmpty()) {
            ConsoleOutput.info("No commits yet.");
            return;
        }
        for (var commit : log.commits()) {
            System.out.printf("  %-8s %-20s %-25s %s%n",
                    commit.sha().substring(0, Math.min(8, commit.sha().length())),
                    ConsoleOutput.truncate(commit.authorName(), 20),
                    commit.timestamp(),
                    ConsoleOutput.truncate(commit.message(), 60));
        }
    }
}
