package com.sandcastle.core.error;

/**
 * Thrown when the sandbox store itself fails (connection loss, bad SQL).
 * Missing rows and duplicate keys are reported through return values instead.
 */
public class RepositoryException extends SandboxException {
    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
