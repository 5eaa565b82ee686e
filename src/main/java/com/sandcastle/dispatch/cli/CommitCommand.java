package com.sandcastle.dispatch.cli;

import com.sandcastle.core.engine.SandboxOrchestrator;
import com.sandcastle.git.CommitAuthor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: sandcastle commit &lt;id&gt; -m &lt;message&gt;
 * <p>
 * Stages every change in the sandbox repository and commits it. The author
 * falls back to the configured default unless both author options are given.
 */
@Command(name = "commit", mixinStandardHelpOptions = true, description = "Commit all changes in a sandbox repository")
@Component
public class CommitCommand implements Runnable {

    @Parameters(index = "0", description = "Sandbox ID")
    private String sandboxId;

    @Option(names = {"--message", "-m"}, required = true, description = "Commit message")
    private String message;

    @Option(names = "--author-name", description = "Commit author name")
    private String authorName;

    @Option(names = "--author-email", description = "Commit author email")
    private String authorEmail;

    private final SandboxOrchestrator orchestrator;

    public CommitCommand(SandboxOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        CommitAuthor author = authorName != null && authorEmail != null
                ? new CommitAuthor(authorName, authorEmail) : null;
        var result = orchestrator.commitChanges(sandboxId, message, author);
        ConsoleOutput.success("Committed " + result.sha());
    }
}
