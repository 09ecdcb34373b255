package com.underwriting.engine.override;

/**
 * A referenced case or override does not exist. Not retried; surfaced to the
 * caller as is.
 */
public abstract class NotFoundException extends RuntimeException {

    private final String entityId;

    protected NotFoundException(String message, String entityId) {
        super(message);
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
