package io.github.vishalmysore.chasm.exception;

import lombok.Getter;

/**
 * Raised when an entity is rejected before it ever reaches the graph.
 */
@Getter
public class EntityValidationException extends ChasmException {

    private final String entityId;

    public EntityValidationException(String entityId, String message) {
        super(message);
        this.entityId = entityId;
    }
}
