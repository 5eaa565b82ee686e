package com.sandcastle.git;

/**
 * Kind of change in one column of {@code git status --porcelain}.
 */
public enum GitChange {
    UNMODIFIED,
    MODIFIED,
    ADDED,
    DELETED,
    RENAMED,
    COPIED,
    UNMERGED,
    UNTRACKED,
    IGNORED;

    public static GitChange fromCode(char code) {
        return switch (code) {
            case 'M', 'T' -> MODIFIED;
            case 'A' -> ADDED;
            case 'D' -> DELETED;
            case 'R' -> RENAMED;
            case 'C' -> COPIED;
            case 'U' -> UNMERGED;
            case '?' -> UNTRACKED;
            case '!' -> IGNORED;
            default -> UNMODIFIED;
        };
    }
}
