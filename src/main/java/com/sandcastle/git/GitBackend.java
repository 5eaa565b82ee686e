package com.sandcastle.git;

import java.util.Optional;

/**
 * Abstraction over the service that stores sandbox repositories.
 * Implementations: FileSystemGitBackend.
 *
 * <p>Failures are raised as {@link com.sandcastle.core.error.GitBackendException}.
 */
public interface GitBackend {

    /**
     * Creates an empty repository with an initial commit on the default branch.
     */
    GitRepository createRepo(String name, CreateRepoOptions options);

    /**
     * Creates a repository by cloning {@code url}.
     */
    GitRepository cloneRepo(String url, String name, CloneOptions options);

    void deleteRepo(String name);

    Optional<GitRepository> getRepo(String name);

    /**
     * Stages every change in the working tree and commits it.
     */
    CommitResult commit(String repoName, CommitRequest request);

    GitStatus getStatus(String repoName);

    /**
     * @param limit maximum number of commits, {@code null} for all
     */
    GitLog getLog(String repoName, Integer limit);
}
