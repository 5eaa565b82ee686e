package com.sandcastle.sandbox;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Remembers which runtime container id belongs to which sandbox id.
 * Entries are removed when the container is deleted or found missing.
 */
public class ContainerIdCache {

    private final ConcurrentMap<String, String> containerIds = new ConcurrentHashMap<>();

    public Optional<String> get(String sandboxId) {
        return Optional.ofNullable(containerIds.get(sandboxId));
    }

    public void put(String sandboxId, String containerId) {
        containerIds.put(sandboxId, containerId);
    }

    public void invalidate(String sandboxId) {
        containerIds.remove(sandboxId);
    }

    public int size() {
        return containerIds.size();
    }
}
