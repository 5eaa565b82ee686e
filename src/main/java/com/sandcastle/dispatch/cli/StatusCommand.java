package com.sandcastle.dispatch.cli;

import com.sandcastle.core.engine.SandboxOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Locale;

/**
 * CLI command: sandcastle status &lt;id&gt;
 * <p>
 * Compares the recorded status with the state the container runtime reports.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show recorded and live sandbox status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Sandbox ID")
    private String sandboxId;

    private final SandboxOrchestrator orchestrator;

    public StatusCommand(SandboxOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        var report = orchestrator.getSandboxStatus(sandboxId);
        ConsoleOutput.field("Sandbox", report.sandboxId());
        ConsoleOutput.field("Recorded", ConsoleOutput.status(report.recorded()));
        ConsoleOutput.field("Container", report.live().name().toLowerCase(Locale.ROOT));
    }
}
