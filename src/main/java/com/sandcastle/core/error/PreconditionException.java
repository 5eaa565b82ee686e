package com.sandcastle.core.error;

/**
 * Thrown when an operation is not permitted in the sandbox's current state.
 */
public class PreconditionException extends SandboxException {
    public PreconditionException(String message) {
        super(message);
    }
}
