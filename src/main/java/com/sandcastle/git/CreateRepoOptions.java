package com.sandcastle.git;

/**
 * @param description written to the initial README, {@code null} for none
 */
public record CreateRepoOptions(String description) {

    public static CreateRepoOptions defaults() {
        return new CreateRepoOptions(null);
    }
}
