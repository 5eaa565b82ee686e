package com.sandcastle.dispatch.cli;

import com.sandcastle.core.engine.SandboxOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "start", mixinStandardHelpOptions = true, description = "Start a stopped sandbox")
@Component
public class StartCommand implements Runnable {

    @Parameters(index = "0", description = "Sandbox ID")
    private String sandboxId;

    private final SandboxOrchestrator orchestrator;

    public StartCommand(SandboxOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        var sandbox = orchestrator.startSandbox(sandboxId);
        ConsoleOutput.success("Sandbox " + sandbox.id() + " started, now " + ConsoleOutput.status(sandbox.status()));
    }
}
