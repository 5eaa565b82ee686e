package com.sandcastle.dispatch.cli;

import com.sandcastle.core.engine.SandboxOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: sandcastle show &lt;id&gt;
 */
@Command(name = "show", mixinStandardHelpOptions = true, description = "Show a sandbox and its repository")
@Component
public class ShowCommand implements Runnable {

    @Parameters(index = "0", description = "Sandbox ID")
    private String sandboxId;

    private final SandboxOrchestrator orchestrator;

    public ShowCommand(SandboxOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        var info = orchestrator.getSandboxInfo(sandboxId);
        ConsoleOutput.sandbox(info.sandbox());
        ConsoleOutput.repository(info.repository());
    }
}
