package com.sandcastle.core.error;

/**
 * Failure reported by the container runtime.
 *
 * <p>{@link #isContainerMissing()} is set when the runtime has no container for
 * the sandbox; retrying such an operation cannot succeed.
 */
public class ContainerRuntimeException extends SandboxException {

    private final String sandboxId;
    private final String operation;
    private final boolean containerMissing;

    public ContainerRuntimeException(String sandboxId, String operation, String message) {
        this(sandboxId, operation, message, false, null);
    }

    public ContainerRuntimeException(String sandboxId, String operation, String message, Throwable cause) {
        this(sandboxId, operation, message, false, cause);
    }

    public ContainerRuntimeException(String sandboxId, String operation, String message,
                                     boolean containerMissing, Throwable cause) {
        super("%s failed for sandbox %s: %s".formatted(operation, sandboxId, message), cause);
        this.sandboxId = sandboxId;
        this.operation = operation;
        this.containerMissing = containerMissing;
    }

    public static ContainerRuntimeException containerMissing(String sandboxId, String operation, Throwable cause) {
        return new ContainerRuntimeException(sandboxId, operation, "container not found", true, cause);
    }

    public String getSandboxId() {
        return sandboxId;
    }

    public String getOperation() {
        return operation;
    }

    public boolean isContainerMissing() {
        return containerMissing;
    }
}
