package io.github.vishalmysore.chasm.domain;

import java.util.Map;

/**
 * A node in the knowledge graph. Implemented only by {@link Product},
 * {@link Component}, {@link Source} and {@link Insight}; callers switch on
 * {@link #getNodeType()} to handle each variant.
 */
public interface GraphEntity {

    String getId();

    NodeType getNodeType();

    /**
     * Snapshot of this node's attributes as JSON-safe primitives, including the
     * {@code id} and the {@code node_type} discriminator.
     */
    Map<String, Object> toAttributes();
}
