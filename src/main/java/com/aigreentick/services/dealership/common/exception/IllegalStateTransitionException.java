package com.aigreentick.services.dealership.common.exception;

public class IllegalStateTransitionException extends RuntimeException {

    private final String entity;
    private final Long entityId;

    public IllegalStateTransitionException(String entity, Long entityId, Enum<?> from, Enum<?> to) {
        super(entity + " " + entityId + " cannot move from " + from + " to " + to);
        this.entity = entity;
        this.entityId = entityId;
    }

    public IllegalStateTransitionException(String entity, Long entityId, String message) {
        super(entity + " " + entityId + ": " + message);
        this.entity = entity;
        this.entityId = entityId;
    }

    public String getEntity() {
        return entity;
    }

    public Long getEntityId() {
        return entityId;
    }
}
