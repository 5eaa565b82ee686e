package com.sandcastle.git;

import java.nio.file.Path;

/**
 * A repository held by the git backend.
 *
 * @param path          location of the working tree
 * @param currentBranch checked-out branch, {@code null} on a detached HEAD
 * @param dirty         true when the working tree has uncommitted changes
 */
public record GitRepository(String name, Path path, String currentBranch, boolean dirty) {}
