package com.sandcastle.sandbox;

import java.util.List;
import java.util.Map;

/**
 * Everything the runtime needs to create a sandbox container.
 *
 * @param sandboxId     owning sandbox; containers are addressed by this id afterwards
 * @param containerName runtime-level container name
 * @param labels        metadata labels, including one {@code sandcastle.url.<service>} label per published URL
 * @param binds         host directory to container path mounts
 * @param cpuCores      CPU limit, fractional cores allowed
 * @param network       network to attach to, {@code null} for the runtime default
 * @param start         start the container after creating it
 */
public record ContainerSpec(
    String sandboxId,
    String containerName,
    String image,
    String workdir,
    Map<String, String> labels,
    Map<String, String> env,
    List<Mount> binds,
    double cpuCores,
    long memoryBytes,
    List<String> command,
    String network,
    boolean start
) {

    public ContainerSpec {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        env = env == null ? Map.of() : Map.copyOf(env);
        binds = binds == null ? List.of() : List.copyOf(binds);
        command = command == null ? List.of() : List.copyOf(command);
    }

    /**
     * A host path mounted into the container.
     */
    public record Mount(String hostPath, String containerPath, boolean readOnly) {}
}
