package io.github.vishalmysore.chasm.exception;

import io.github.vishalmysore.chasm.domain.NodeType;
import lombok.Getter;

import java.util.Set;

/**
 * Raised when an edge would point at a node that is missing or of the wrong type.
 */
@Getter
public class ReferentialIntegrityException extends ChasmException {

    private final String nodeId;
    private final Set<NodeType> expectedTypes;

    public ReferentialIntegrityException(String nodeId, Set<NodeType> expectedTypes, String message) {
        super(message);
        this.nodeId = nodeId;
        this.expectedTypes = expectedTypes;
    }
}
