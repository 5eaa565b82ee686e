package com.sandcastle.dispatch.cli;

import com.sandcastle.core.engine.SandboxOrchestrator;
import com.sandcastle.sandbox.ExecOptions;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: sandcastle exec &lt;id&gt; -- &lt;command...&gt;
 * <p>
 * Runs a command inside the sandbox container and exits with the command's exit code.
 */
@Command(name = "exec", mixinStandardHelpOptions = true, description = "Run a command inside a sandbox")
@Component
public class ExecCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Sandbox ID")
    private String sandboxId;

    @Parameters(index = "1..*", arity = "1..*", description = "Command and arguments")
    private List<String> command;

    @Option(names = {"--workdir", "-w"}, description = "Working directory inside the container")
    private String workingDir;

    @Option(names = {"--env", "-e"}, description = "Environment variable KEY=VALUE, repeatable")
    private Map<String, String> env;

    @Option(names = "--as", description = "User to run the command as")
    private String user;

    private final SandboxOrchestrator orchestrator;

    public ExecCommand(SandboxOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        var result = orchestrator.exec(sandboxId, command, new ExecOptions(workingDir, env, user));
        if (result.stdout() != null) {
            System.out.print(result.stdout());
        }
        if (result.stderr() != null) {
            System.err.print(result.stderr());
        }
        return result.exitCode();
    }
}
