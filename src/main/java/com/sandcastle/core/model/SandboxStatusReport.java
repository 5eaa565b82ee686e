package com.sandcastle.core.model;

import com.sandcastle.sandbox.ContainerState;

/**
 * Recorded status next to the live state reported by the container runtime.
 */
public record SandboxStatusReport(String sandboxId, SandboxStatus recorded, ContainerState live) {}
