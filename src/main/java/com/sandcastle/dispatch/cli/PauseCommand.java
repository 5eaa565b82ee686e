package com.sandcastle.dispatch.cli;

import com.sandcastle.core.engine.SandboxOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "pause", mixinStandardHelpOptions = true, description = "Pause a running sandbox")
@Component
public class PauseCommand implements Runnable {

    @Parameters(index = "0", description = "Sandbox ID")
    private String sandboxId;

    private final SandboxOrchestrator orchestrator;

    public PauseCommand(SandboxOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        var sandbox = orchestrator.pauseSandbox(sandboxId);
        ConsoleOutput.success("Sandbox " + sandbox.id() + " paused, now " + ConsoleOutput.status(sandbox.status()));
    }
}
