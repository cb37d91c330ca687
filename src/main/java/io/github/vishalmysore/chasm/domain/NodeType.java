package io.github.vishalmysore.chasm.domain;

/**
 * The closed set of node variants in the knowledge graph. The label is the
 * {@code node_type} discriminator written to snapshots.
 */
public enum NodeType {
    PRODUCT("Product"), // Root of a feedback hierarchy
    COMPONENT("Component"), // Physical sub-system of a product
    SOURCE("Source"), // Origin record for feedback
    INSIGHT("Insight"); // Extracted, optionally embedded, piece of feedback

    private final String label;

    NodeType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static NodeType fromLabel(String label) {
        for (NodeType type : values()) {
            if (type.label.equals(label) || type.name().equals(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown node_type: " + label);
    }
}
