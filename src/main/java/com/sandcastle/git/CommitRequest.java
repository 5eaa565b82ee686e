package com.sandcastle.git;

/**
 * @param author commit author, {@code null} for the backend's default
 */
public record CommitRequest(String message, CommitAuthor author) {}
