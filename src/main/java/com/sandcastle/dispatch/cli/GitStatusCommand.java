package com.sandcastle.dispatch.cli;

import com.sandcastle.core.engine.SandboxOrchestrator;
import com.sandcastle.git.GitChange;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Locale;

/**
 * CLI command: sandcastle git-status &lt;id&gt;
 */
@Command(name = "git-status", mixinStandardHelpOptions = true, description = "Show working tree status of a sandbox repository")
@Component
public class GitStatusCommand implements Runnable {

    @Parameters(index = "0", description = "Sandbox ID")
    private String sandboxId;

    private final SandboxOrchestrator orchestrator;

    public GitStatusCommand(SandboxOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        var status = orchestrator.getGitStatus(sandboxId);
        ConsoleOutput.field("Branch", status.branch());
        if (status.isClean()) {
            ConsoleOutput.success("Working tree clean");
            return;
        }
        System.out.printf("  %-10s %-10s %s%n", "STAGED", "UNSTAGED", "PATH");
        for (var file : status.files()) {
            System.out.printf("  %-10s %-10s %s%n", label(file.staged()), label(file.unstaged()), file.path());
        }
    }

    private static String label(GitChange change) {
        return change == GitChange.UNMODIFIED ? "-" : change.name().toLowerCase(Locale.ROOT);
    }
}
