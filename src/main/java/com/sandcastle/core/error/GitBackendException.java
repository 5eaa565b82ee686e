package com.sandcastle.core.error;

/**
 * Failure reported by the git backend.
 */
public class GitBackendException extends SandboxException {

    private final String repoName;
    private final String operation;

    public GitBackendException(String repoName, String operation, String message) {
        this(repoName, operation, message, null);
    }

    public GitBackendException(String repoName, String operation, String message, Throwable cause) {
        super("git %s failed for %s: %s".formatted(operation, repoName, message), cause);
        this.repoName = repoName;
        this.operation = operation;
    }

    public String getRepoName() {
        return repoName;
    }

    public String getOperation() {
        return operation;
    }
}
