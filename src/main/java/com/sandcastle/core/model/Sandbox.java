package com.sandcastle.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A user's development environment: one container plus one git repository.
 *
 * <p>Optional fields are {@code null} when absent. {@code containerId} is set
 * once provisioning has completed; {@code repoName} never changes after the
 * record is inserted.
 */
public record Sandbox(
    String id,
    String userId,
    String name,
    String slug,
    String description,
    String repoName,
    String githubUrl,
    SandboxStatus status,
    String resourceTierId,
    String flavorId,
    List<String> addonIds,
    String containerId,
    String containerName,
    String opencodeUrl,
    String vncUrl,
    String codeServerUrl,
    String errorMessage,
    Instant createdAt,
    Instant updatedAt,
    Instant lastAccessedAt
) {

    public Sandbox {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        addonIds = addonIds == null ? List.of() : List.copyOf(addonIds);
    }

    public boolean hasContainer() {
        return containerId != null;
    }

    public boolean hasRepository() {
        return repoName != null && !repoName.isBlank();
    }

    /**
     * Applies the non-null fields of {@code update} on top of this sandbox.
     */
    public Sandbox apply(SandboxUpdate update, Instant now) {
        return toBuilder()
                .name(update.name() != null ? update.name() : name)
                .description(update.description() != null ? update.description() : description)
                .status(update.status() != null ? update.status() : status)
                .resourceTierId(update.resourceTierId() != null ? update.resourceTierId() : resourceTierId)
                .flavorId(update.flavorId() != null ? update.flavorId() : flavorId)
                .addonIds(update.addonIds() != null ? update.addonIds() : addonIds)
                .containerId(update.containerId() != null ? update.containerId() : containerId)
                .containerName(update.containerName() != null ? update.containerName() : containerName)
                .opencodeUrl(update.opencodeUrl() != null ? update.opencodeUrl() : opencodeUrl)
                .vncUrl(update.vncUrl() != null ? update.vncUrl() : vncUrl)
                .codeServerUrl(update.codeServerUrl() != null ? update.codeServerUrl() : codeServerUrl)
                .errorMessage(update.clearErrorMessage() ? null
                        : update.errorMessage() != null ? update.errorMessage() : errorMessage)
                .updatedAt(now)
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id).userId(userId).name(name).slug(slug).description(description)
                .repoName(repoName).githubUrl(githubUrl).status(status)
                .resourceTierId(resourceTierId).flavorId(flavorId).addonIds(addonIds)
                .containerId(containerId).containerName(containerName)
                .opencodeUrl(opencodeUrl).vncUrl(vncUrl).codeServerUrl(codeServerUrl)
                .errorMessage(errorMessage)
                .createdAt(createdAt).updatedAt(updatedAt).lastAccessedAt(lastAccessedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String userId;
        private String name;
        private String slug;
        private String description;
        private String repoName;
        private String githubUrl;
        private SandboxStatus status = SandboxStatus.CREATED;
        private String resourceTierId;
        private String flavorId;
        private List<String> addonIds = List.of();
        private String containerId;
        private String containerName;
        private String opencodeUrl;
        private String vncUrl;
        private String codeServerUrl;
        private String errorMessage;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant lastAccessedAt;

        private Builder() {}

        public Builder id(String id) { this.id = id; return this; }
        public Builder userId(String userId) { this.userId = userId; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder slug(String slug) { this.slug = slug; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder repoName(String repoName) { this.repoName = repoName; return this; }
        public Builder githubUrl(String githubUrl) { this.githubUrl = githubUrl; return this; }
        public Builder status(SandboxStatus status) { this.status = status; return this; }
        public Builder resourceTierId(String resourceTierId) { this.resourceTierId = resourceTierId; return this; }
        public Builder flavorId(String flavorId) { this.flavorId = flavorId; return this; }
        public Builder addonIds(List<String> addonIds) { this.addonIds = addonIds; return this; }
        public Builder containerId(String containerId) { this.containerId = containerId; return this; }
        public Builder containerName(String containerName) { this.containerName = containerName; return this; }
        public Builder opencodeUrl(String opencodeUrl) { this.opencodeUrl = opencodeUrl; return this; }
        public Builder vncUrl(String vncUrl) { this.vncUrl = vncUrl; return this; }
        public Builder codeServerUrl(String codeServerUrl) { this.codeServerUrl = codeServerUrl; return this; }
        public Builder errorMessage(String errorMessage) { this.errorMessage = errorMessage; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }
        public Builder lastAccessedAt(Instant lastAccessedAt) { this.lastAccessedAt = lastAccessedAt; return this; }

        public Sandbox build() {
            return new Sandbox(id, userId, name, slug, description, repoName, githubUrl, status,
                    resourceTierId, flavorId, addonIds, containerId, containerName,
                    opencodeUrl, vncUrl, codeServerUrl, errorMessage,
                    createdAt, updatedAt, lastAccessedAt);
        }
    }
}
