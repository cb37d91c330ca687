package io.github.vishalmysore.chasm.domain;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Origin record for a piece of ingested feedback.
 */
@Value
public class Source implements GraphEntity {
    String id;
    SourceType type;
    String rawText;
    String url;

    @Builder
    public Source(String id, SourceType type, String rawText, String url) {
        this.id = EntityChecks.requireText(id, "id", id);
        this.type = EntityChecks.requirePresent(id, "type", type);
        this.rawText = EntityChecks.requirePresent(id, "raw_text", rawText);
        this.url = url;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.SOURCE;
    }

    @Override
    public Map<String, Object> toAttributes() {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("id", id);
        attrs.put("type", type.getLabel());
        attrs.put("raw_text", rawText);
        attrs.put("url", url);
        attrs.put("node_type", getNodeType().getLabel());
        return attrs;
    }
}
