package com.sandcastle.dispatch.cli;

import com.sandcastle.core.engine.SandboxOrchestrator;
import com.sandcastle.core.model.DeleteOptions;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: sandcastle delete &lt;id&gt;
 * <p>
 * Removes the container and the record. The repository is kept unless
 * {@code --delete-repo} is given.
 */
@Command(name = "delete", mixinStandardHelpOptions = true, description = "Delete a sandbox")
@Component
public class DeleteCommand implements Runnable {

    @Parameters(index = "0", description = "Sandbox ID")
    private String sandboxId;

    @Option(names = "--delete-repo", description = "Also delete the sandbox's git repository")
    private boolean deleteRepo;

    @Option(names = "--remove-volumes", description = "Remove the container's anonymous volumes")
    private boolean removeVolumes;

    private final SandboxOrchestrator orchestrator;

    public DeleteCommand(SandboxOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        orchestrator.deleteSandbox(sandboxId, new DeleteOptions(deleteRepo, removeVolumes));
        ConsoleOutput.success("Sandbox " + sandboxId + " deleted");
    }
}
