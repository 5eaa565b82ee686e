package com.sandcastle.core.model;

/**
 * CPU, memory and storage allotment for a sandbox container.
 */
public record ResourceTier(
    String id,
    String name,
    String description,
    double cpuCores,
    int memoryGb,
    int storageGb,
    boolean isDefault,
    int sortOrder
) {

    public long memoryBytes() {
        return (long) memoryGb * 1024 * 1024 * 1024;
    }
}
