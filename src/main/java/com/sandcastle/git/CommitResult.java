package com.sandcastle.git;

public record CommitResult(String sha) {}
