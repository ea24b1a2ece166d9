package com.nevis.agentrun.exception;

import lombok.Getter;

/**
 * Raised for unknown records and for records owned by someone else; callers cannot tell the two apart.
 */
@Getter
public class EntityNotFoundException extends RuntimeException {
    private final String entity;
    private final Object entityId;

    public EntityNotFoundException(String entity, Object entityId) {
        super(entity + " not found: " + entityId);
        this.entity = entity;
        this.entityId = entityId;
    }
}
