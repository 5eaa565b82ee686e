package com.sandcastle.core.error;

/**
 * Thrown when a write collides with existing data, e.g. a slug taken by a concurrent create.
 */
public class ConflictException extends SandboxException {
    public ConflictException(String message) {
        super(message);
    }
}
