package com.sandcastle.sandbox;

import java.util.Map;

/**
 * @param workingDir directory to run in, {@code null} for the container's default
 * @param env        extra environment variables
 * @param user       user to run as, {@code null} for the container's default
 */
public record ExecOptions(String workingDir, Map<String, String> env, String user) {

    public ExecOptions {
        env = env == null ? Map.of() : Map.copyOf(env);
    }

    public static ExecOptions defaults() {
        return new ExecOptions(null, Map.of(), null);
    }
}
