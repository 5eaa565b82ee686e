package com.sandcastle.dispatch.cli;

import com.sandcastle.core.engine.SandboxOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "unpause", mixinStandardHelpOptions = true, description = "Resume a paused sandbox")
@Component
public class UnpauseCommand implements Runnable {

    @Parameters(index = "0", description = "Sandbox ID")
    private String sandboxId;

    private final SandboxOrchestrator orchestrator;

    public UnpauseCommand(SandboxOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        var sandbox = orchestrator.unpauseSandbox(sandboxId);
        ConsoleOutput.success("Sandbox " + sandbox.id() + " resumed, now " + ConsoleOutput.status(sandbox.status()));
    }
}
