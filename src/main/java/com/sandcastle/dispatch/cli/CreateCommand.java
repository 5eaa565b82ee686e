package com.sandcastle.dispatch.cli;

import com.sandcastle.core.engine.SandboxOrchestrator;
import com.sandcastle.core.model.CreateSandboxOptions;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: sandcastle create &lt;name&gt;
 * <p>
 * Provisions a sandbox record, its container and its git repository.
 */
@Command(name = "create", mixinStandardHelpOptions = true, description = "Create a sandbox")
@Component
public class CreateCommand implements Runnable {

    @Parameters(index = "0", description = "Display name of the sandbox")
    private String name;

    @Option(names = {"--user", "-u"}, description = "Owner of the sandbox (default: ${DEFAULT-VALUE})",
            defaultValue = "${sys:user.name}")
    private String userId;

    @Option(names = {"--description", "-d"}, description = "Free-text description")
    private String description;

    @Option(names = "--repo-url", description = "Clone this repository instead of starting an empty one")
    private String githubUrl;

    @Option(names = {"--flavor", "-f"}, description = "Container flavor id")
    private String flavorId;

    @Option(names = {"--tier", "-t"}, description = "Resource tier id")
    private String tierId;

    @Option(names = {"--addon", "-a"}, split = ",", description = "Addon id, repeatable (default: catalog defaults)")
    private List<String> addonIds;

    @Option(names = "--no-addons", description = "Create the sandbox without any addon")
    private boolean noAddons;

    @Option(names = "--no-start", description = "Leave the container stopped after creation")
    private boolean noStart;

    private final SandboxOrchestrator orchestrator;

    public CreateCommand(SandboxOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        var builder = CreateSandboxOptions.builder(name, userId)
                .description(description)
                .githubUrl(githubUrl)
                .flavor(flavorId)
                .resourceTier(tierId)
                .addons(noAddons ? List.of() : addonIds);
        if (noStart) {
            builder.autoStart(false);
        }
        ConsoleOutput.info("Creating sandbox '" + name + "'...");
        var created = orchestrator.createSandbox(builder.build());
        ConsoleOutput.success("Sandbox " + created.sandbox().id() + " created");
        ConsoleOutput.sandbox(created.sandbox());
        ConsoleOutput.repository(created.repository());
    }
}
