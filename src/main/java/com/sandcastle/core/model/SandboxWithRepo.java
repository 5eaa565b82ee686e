package com.sandcastle.core.model;

import com.sandcastle.git.GitRepository;

/**
 * Result of creating a sandbox: the stored record and the repository created for it.
 */
public record SandboxWithRepo(Sandbox sandbox, GitRepository repository) {}
