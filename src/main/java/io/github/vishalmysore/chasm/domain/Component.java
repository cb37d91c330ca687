package io.github.vishalmysore.chasm.domain;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A physical sub-system of a {@link Product}, attached through a
 * {@link Relation#HAS_COMPONENT} edge.
 */
@Value
public class Component implements GraphEntity {
    String id;
    String name;
    ComponentCategory category;

    @Builder
    public Component(String id, String name, ComponentCategory category) {
        this.id = EntityChecks.requireText(id, "id", id);
        this.name = EntityChecks.requireText(id, "name", name);
        this.category = category != null ? category : ComponentCategory.UNKNOWN;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.COMPONENT;
    }

    @Override
    public Map<String, Object> toAttributes() {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("id", id);
        attrs.put("name", name);
        attrs.put("category", category.getLabel());
        attrs.put("node_type", getNodeType().getLabel());
        return attrs;
    }
}
