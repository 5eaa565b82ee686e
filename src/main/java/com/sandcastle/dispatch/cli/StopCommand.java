package com.sandcastle.dispatch.cli;

import com.sandcastle.core.engine.SandboxOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "stop", mixinStandardHelpOptions = true, description = "Stop a running sandbox")
@Component
public class StopCommand implements Runnable {

    @Parameters(index = "0", description = "Sandbox ID")
    private String sandboxId;

    @Option(names = {"--timeout", "-t"}, description = "Seconds to wait before killing the container")
    private Integer timeoutSeconds;

    private final SandboxOrchestrator orchestrator;

    public StopCommand(SandboxOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        var sandbox = orchestrator.stopSandbox(sandboxId, timeoutSeconds);
        ConsoleOutput.success("Sandbox " + sandbox.id() + " stopped, now " + ConsoleOutput.status(sandbox.status()));
    }
}
