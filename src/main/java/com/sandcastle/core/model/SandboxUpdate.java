package com.sandcastle.core.model;

import java.util.List;

/**
 * Partial update of a sandbox record. {@code null} fields are left unchanged.
 * Identity fields ({@code id}, {@code userId}, {@code slug}, {@code repoName},
 * {@code createdAt}) are deliberately absent.
 *
 * <p>{@code clearErrorMessage} removes a previously recorded error message.
 */
public record SandboxUpdate(
    String name,
    String description,
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
    boolean clearErrorMessage
) {

    public static SandboxUpdate status(SandboxStatus status) {
        return builder().status(status).clearErrorMessage().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String description;
        private SandboxStatus status;
        private String resourceTierId;
        private String flavorId;
        private List<String> addonIds;
        private String containerId;
        private String containerName;
        private String opencodeUrl;
        private String vncUrl;
        private String codeServerUrl;
        private String errorMessage;
        private boolean clearErrorMessage;

        private Builder() {}

        public Builder name(String name) { this.name = name; return this; }
        public Builder description(String description) { this.description = description; return this; }
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
        public Builder clearErrorMessage() { this.clearErrorMessage = true; return this; }

        public SandboxUpdate build() {
            return new SandboxUpdate(name, description, status, resourceTierId, flavorId,
                    addonIds == null ? null : List.copyOf(addonIds),
                    containerId, containerName, opencodeUrl, vncUrl, codeServerUrl,
                    errorMessage, clearErrorMessage);
        }
    }
}
