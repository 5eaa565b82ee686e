package com.sandcastle.git;

import java.util.List;

public record GitStatus(String branch, List<GitFileStatus> files) {

    public GitStatus {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public boolean isClean() {
        return files.isEmpty();
    }
}
