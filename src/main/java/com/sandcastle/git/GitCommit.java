package com.sandcastle.git;

import java.time.Instant;

public record GitCommit(String sha, String message, String authorName, String authorEmail, Instant timestamp) {}
