package com.sandcastle.dispatch.cli;

import com.sandcastle.core.engine.SandboxOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: sandcastle stats &lt;id&gt;
 */
@Command(name = "stats", mixinStandardHelpOptions = true, description = "Show resource usage of a sandbox")
@Component
public class StatsCommand implements Runnable {

    @Parameters(index = "0", description = "Sandbox ID")
    private String sandboxId;

    private final SandboxOrchestrator orchestrator;

    public StatsCommand(SandboxOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        var stats = orchestrator.getSandboxStats(sandboxId);
        ConsoleOutput.field("CPU", String.format("%.1f%%", stats.cpuPercent()));
        ConsoleOutput.field("Memory", String.format("%s / %s (%.1f%%)",
                ConsoleOutput.formatBytes(stats.memoryUsage()),
                ConsoleOutput.formatBytes(stats.memoryLimit()),
                stats.memoryPercent()));
        ConsoleOutput.field("Network", "rx " + ConsoleOutput.formatBytes(stats.networkRx())
                + ", tx " + ConsoleOutput.formatBytes(stats.networkTx()));
        ConsoleOutput.field("Block I/O", "read " + ConsoleOutput.formatBytes(stats.blockRead())
                + ", write " + ConsoleOutput.formatBytes(stats.blockWrite()));
    }
}
