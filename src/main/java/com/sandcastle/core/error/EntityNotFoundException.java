package com.sandcastle.core.error;

/**
 * Thrown when a referenced sandbox record does not exist.
 */
public class EntityNotFoundException extends SandboxException {

    private final String entityId;

    public EntityNotFoundException(String entity, String entityId) {
        super("%s not found: %s".formatted(entity, entityId));
        this.entityId = entityId;
    }

    public static EntityNotFoundException sandbox(String sandboxId) {
        return new EntityNotFoundException("Sandbox", sandboxId);
    }

    public String getEntityId() {
        return entityId;
    }
}
