package com.sandcastle.core.model;

import java.util.Locale;

/**
 * Recorded lifecycle status of a sandbox.
 *
 * <p>{@link #PAUSED} is part of the persisted vocabulary but the engine never
 * writes it: pausing a sandbox records it as {@link #STOPPED}.
 */
public enum SandboxStatus {
    CREATED,
    RUNNING,
    STOPPED,
    PAUSED,
    ERROR;

    /** Lower-case form used in storage and on the command line. */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SandboxStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Sandbox status must not be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
