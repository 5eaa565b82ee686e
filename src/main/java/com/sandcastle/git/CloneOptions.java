package com.sandcastle.git;

/**
 * @param depth shallow-clone depth, {@code null} for full history
 */
public record CloneOptions(Integer depth) {

    public static CloneOptions defaults() {
        return new CloneOptions(null);
    }
}
