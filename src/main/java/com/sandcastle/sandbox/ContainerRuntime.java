package com.sandcastle.sandbox;

import java.util.List;

/**
 * Abstraction over the container runtime that hosts sandboxes.
 * Implementations: DockerContainerRuntime.
 *
 * <p>Every {@code sandboxId} argument is a sandbox id, never a runtime
 * container id; the implementation maps one to the other. Failures are raised
 * as {@link com.sandcastle.core.error.ContainerRuntimeException}, flagged
 * {@code containerMissing} when the runtime has no container for the sandbox.
 */
public interface ContainerRuntime {

    /**
     * Creates the container and, when {@link ContainerSpec#start()} is set, starts it.
     */
    ContainerRef create(ContainerSpec spec);

    /**
     * Starts a stopped container. A paused container is resumed instead.
     */
    void start(String sandboxId);

    /**
     * @param timeoutSeconds seconds to wait before killing, {@code null} for the runtime default
     */
    void stop(String sandboxId, Integer timeoutSeconds);

    /**
     * @param timeoutSeconds seconds to wait before killing, {@code null} for the runtime default
     */
    void restart(String sandboxId, Integer timeoutSeconds);

    void pause(String sandboxId);

    void unpause(String sandboxId);

    /**
     * Force-removes the container and forgets its id.
     */
    void delete(String sandboxId, boolean removeVolumes);

    /**
     * Runs a command inside the container and waits for it to finish.
     */
    ExecResult exec(String sandboxId, List<String> command, ExecOptions options);

    List<String> getLogs(String sandboxId, LogOptions options);

    ContainerStats getStats(String sandboxId);

    ContainerState getState(String sandboxId);

    /**
     * @return true when the runtime daemon answers
     */
    boolean healthCheck();

    RuntimeInfo getInfo();
}
