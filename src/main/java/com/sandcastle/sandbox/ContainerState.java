package com.sandcastle.sandbox;

/**
 * Live state of a sandbox container as reported by the runtime.
 */
public enum ContainerState {
    CREATED,
    RUNNING,
    PAUSED,
    RESTARTING,
    REMOVING,
    EXITED,
    DEAD,
    UNKNOWN
}
