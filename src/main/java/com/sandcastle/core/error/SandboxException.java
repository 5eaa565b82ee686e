package com.sandcastle.core.error;

/**
 * Base class for every failure raised by the sandbox engine and its adapters.
 */
public abstract class SandboxException extends RuntimeException {

    protected SandboxException(String message) {
        super(message);
    }

    protected SandboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
