package com.sandcastle.git;

public record CommitAuthor(String name, String email) {}
