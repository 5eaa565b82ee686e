package com.sandcastle.dispatch.cli;

import com.sandcastle.core.engine.SandboxOrchestrator;
import com.sandcastle.core.error.ValidationException;
import com.sandcastle.core.model.SandboxFilter;
import com.sandcastle.core.model.SandboxStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * CLI command: sandcastle list
 * <p>
 * Lists sandboxes newest first, optionally narrowed to one owner and a set of statuses.
 */
@Command(name = "list", mixinStandardHelpOptions = true, description = "List sandboxes")
@Component
public class ListCommand implements Runnable {

    @Option(names = {"--user", "-u"}, description = "Only sandboxes owned by this user")
    private String userId;

    @Option(names = {"--status", "-s"}, split = ",",
            description = "Only sandboxes in these statuses (created, running, stopped, paused, error)")
    private List<String> statuses;

    private final SandboxOrchestrator orchestrator;

    public ListCommand(SandboxOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        var wanted = EnumSet.noneOf(SandboxStatus.class);
        if (statuses != null) {
            for (String s : statuses) {
                try {
                    wanted.add(SandboxStatus.fromValue(s));
                } catch (IllegalArgumentException e) {
                    throw new ValidationException("Unknown status: " + s);
                }
            }
        }
        var sandboxes = orchestrator.listSandboxes(new SandboxFilter(userId, wanted));
        if (sandboxes.isEmpty()) {
            ConsoleOutput.info("No sandboxes found.");
            return;
        }

        System.out.printf("  %-14s %-24s %-9s %-10s %-8s %s%n",
                "ID", "SLUG", "STATUS", "FLAVOR", "TIER", "NAME");
        System.out.println("  " + "-".repeat(80));
        for (var s : sandboxes) {
            System.out.printf("  %-14s %-24s %-9s %-10s %-8s %s%n",
                    s.id(), ConsoleOutput.truncate(s.slug(), 24), s.status().value(),
                    s.flavorId(), s.resourceTierId(), ConsoleOutput.truncate(s.name(), 30));
        }

        var counts = orchestrator.countSandboxesByStatus(userId);
        System.out.println();
        ConsoleOutput.info(counts.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .map(e -> e.getValue() + " " + e.getKey().value())
                .collect(Collectors.joining(", ")));
    }
}
