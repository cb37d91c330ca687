package io.github.vishalmysore.chasm.domain;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A directed, labelled edge. Only {@link Relation#SEMANTIC_MATCH} edges carry a weight.
 */
@Value
@Builder(toBuilder = true)
public class GraphEdge {
    String sourceId;
    String targetId;
    Relation relation;
    Double weight;

    public static GraphEdge of(String sourceId, String targetId, Relation relation) {
        return new GraphEdge(sourceId, targetId, relation, null);
    }

    /**
     * Converts this edge to its node-link representation.
     */
    public Map<String, Object> toAttributes() {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("source", sourceId);
        attrs.put("target", targetId);
        attrs.put("relation", relation.name());
        if (weight != null) {
            attrs.put("weight", weight);
        }
        return attrs;
    }
}
