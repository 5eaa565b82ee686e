package com.sandcastle.dispatch.cli;

import com.sandcastle.core.engine.SandboxOrchestrator;
import com.sandcastle.sandbox.LogOptions;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Instant;

/**
 * CLI command: sandcastle logs &lt;id&gt;
 */
@Command(name = "logs", mixinStandardHelpOptions = true, description = "Show container logs of a sandbox")
@Component
public class LogsCommand implements Runnable {

    @Parameters(index = "0", description = "Sandbox ID")
    private String sandboxId;

    @Option(names = {"--tail", "-n"}, description = "Number of trailing lines (default: ${DEFAULT-VALUE})",
            defaultValue = "100")
    private Integer tail;

    @Option(names = "--since", description = "Only lines after this ISO-8601 instant, e.g. 2024-01-01T00:00:00Z")
    private Instant since;

    @Option(names = {"--timestamps", "-t"}, description = "Prefix each line with its timestamp")
    private boolean timestamps;

    private final SandboxOrchestrator orchestrator;

    public LogsCommand(SandboxOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        var lines = orchestrator.getSandboxLogs(sandboxId, new LogOptions(tail, since, timestamps));
        lines.forEach(System.out::println);
    }
}
