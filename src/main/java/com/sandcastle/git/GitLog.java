package com.sandcastle.git;

import java.util.List;

/**
 * Commits newest first.
 */
public record GitLog(List<GitCommit> commits) {

    public GitLog {
        commits = commits == null ? List.of() : List.copyOf(commits);
    }
}
