package com.sandcastle.core.model;

/**
 * @param deleteRepo    also delete the sandbox's git repository
 * @param removeVolumes remove the container's anonymous volumes
 */
public record DeleteOptions(boolean deleteRepo, boolean removeVolumes) {

    public static DeleteOptions defaults() {
        return new DeleteOptions(false, false);
    }
}
