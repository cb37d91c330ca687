package io.github.vishalmysore.chasm.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * The fixed edge vocabulary. Each relation constrains the node types at both ends.
 */
public enum Relation {
    HAS_COMPONENT(EnumSet.of(NodeType.PRODUCT), EnumSet.of(NodeType.COMPONENT)),
    YIELDS(EnumSet.of(NodeType.SOURCE), EnumSet.of(NodeType.INSIGHT)),
    ABOUT(EnumSet.of(NodeType.INSIGHT), EnumSet.of(NodeType.PRODUCT, NodeType.COMPONENT)),
    SEMANTIC_MATCH(EnumSet.of(NodeType.INSIGHT), EnumSet.of(NodeType.INSIGHT));

    private final Set<NodeType> sourceTypes;
    private final Set<NodeType> targetTypes;

    Relation(Set<NodeType> sourceTypes, Set<NodeType> targetTypes) {
        this.sourceTypes = sourceTypes;
        this.targetTypes = targetTypes;
    }

    public Set<NodeType> getSourceTypes() {
        return EnumSet.copyOf(sourceTypes);
    }

    public Set<NodeType> getTargetTypes() {
        return EnumSet.copyOf(targetTypes);
    }

    public static Relation fromLabel(String label) {
        try {
            return valueOf(label);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown relation: " + label);
        }
    }
}
