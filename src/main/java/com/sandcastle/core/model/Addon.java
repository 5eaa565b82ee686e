package com.sandcastle.core.model;

/**
 * Optional capability layered onto a sandbox.
 *
 * @param port container port the addon listens on, {@code null} when it exposes none
 */
public record Addon(
    String id,
    String name,
    String description,
    AddonCategory category,
    Integer port,
    boolean requiresGpu,
    int sortOrder
) {}
