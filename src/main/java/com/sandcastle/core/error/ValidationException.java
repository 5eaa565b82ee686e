package com.sandcastle.core.error;

/**
 * Thrown when a request is malformed or references unknown catalog entries.
 */
public class ValidationException extends SandboxException {
    public ValidationException(String message) {
        super(message);
    }
}
