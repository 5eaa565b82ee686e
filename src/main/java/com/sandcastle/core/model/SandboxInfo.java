package com.sandcastle.core.model;

import com.sandcastle.git.GitRepository;

/**
 * A sandbox together with a description of its repository.
 *
 * @param repository repository descriptor, {@code null} when the backend has no such repository
 */
public record SandboxInfo(Sandbox sandbox, GitRepository repository) {}
