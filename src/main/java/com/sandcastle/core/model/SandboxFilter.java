package com.sandcastle.core.model;

import java.util.Set;

/**
 * Criteria for listing sandboxes. Both criteria are optional and combine with AND.
 *
 * @param userId   owner to match, or {@code null} for any owner
 * @param statuses accepted statuses, empty for any status
 */
public record SandboxFilter(String userId, Set<SandboxStatus> statuses) {

    public SandboxFilter {
        statuses = statuses == null ? Set.of() : Set.copyOf(statuses);
    }

    public static SandboxFilter all() {
        return new SandboxFilter(null, Set.of());
    }

    public static SandboxFilter forUser(String userId) {
        return new SandboxFilter(userId, Set.of());
    }

    public boolean matches(Sandbox sandbox) {
        if (userId != null && !userId.equals(sandbox.userId())) {
            return false;
        }
        return statuses.isEmpty() || statuses.contains(sandbox.status());
    }
}
