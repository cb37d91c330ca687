package io.github.vishalmysore.chasm.domain;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The top-level device being analysed.
 */
@Value
public class Product implements GraphEntity {
    String id;
    String name;
    String description;
    String url;

    @Builder
    public Product(String id, String name, String description, String url) {
        this.id = EntityChecks.requireText(id, "id", id);
        this.name = EntityChecks.requireText(id, "name", name);
        this.description = description;
        this.url = url;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.PRODUCT;
    }

    @Override
    public Map<String, Object> toAttributes() {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("id", id);
        attrs.put("name", name);
        attrs.put("description", description);
        attrs.put("url", url);
        attrs.put("node_type", getNodeType().getLabel());
        return attrs;
    }
}
