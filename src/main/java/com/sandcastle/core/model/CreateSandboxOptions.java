package com.sandcastle.core.model;

import java.util.List;

/**
 * Request to create a sandbox. {@code flavorId}, {@code resourceTierId} and
 * {@code addonIds} fall back to catalog defaults when {@code null};
 * {@code autoStart} defaults to {@code true}.
 */
public record CreateSandboxOptions(
    String name,
    String userId,
    String description,
    String githubUrl,
    String flavorId,
    String resourceTierId,
    List<String> addonIds,
    Boolean autoStart
) {

    public boolean autoStartOrDefault(boolean fallback) {
        return autoStart != null ? autoStart : fallback;
    }

    public static Builder builder(String name, String userId) {
        return new Builder(name, userId);
    }

    public static final class Builder {
        private final String name;
        private final String userId;
        private String description;
        private String githubUrl;
        private String flavorId;
        private String resourceTierId;
        private List<String> addonIds;
        private Boolean autoStart;

        private Builder(String name, String userId) {
            this.name = name;
            this.userId = userId;
        }

        public Builder description(String description) { this.description = description; return this; }
        public Builder githubUrl(String githubUrl) { this.githubUrl = githubUrl; return this; }
        public Builder flavor(String flavorId) { this.flavorId = flavorId; return this; }
        public Builder resourceTier(String resourceTierId) { this.resourceTierId = resourceTierId; return this; }
        public Builder addons(List<String> addonIds) { this.addonIds = addonIds; return this; }
        public Builder autoStart(boolean autoStart) { this.autoStart = autoStart; return this; }

        public CreateSandboxOptions build() {
            return new CreateSandboxOptions(name, userId, description, githubUrl,
                    flavorId, resourceTierId, addonIds, autoStart);
        }
    }
}
