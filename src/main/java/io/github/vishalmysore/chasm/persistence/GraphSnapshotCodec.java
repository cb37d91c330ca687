package io.github.vishalmysore.chasm.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.vishalmysore.chasm.domain.Component;
import io.github.vishalmysore.chasm.domain.ComponentCategory;
import io.github.vishalmysore.chasm.domain.GraphEdge;
import io.github.vishalmysore.chasm.domain.GraphEntity;
import io.github.vishalmysore.chasm.domain.Insight;
import io.github.vishalmysore.chasm.domain.NodeType;
import io.github.vishalmysore.chasm.domain.Product;
import io.github.vishalmysore.chasm.domain.Relation;
import io.github.vishalmysore.chasm.domain.Source;
import io.github.vishalmysore.chasm.domain.SourceType;
import io.github.vishalmysore.chasm.exception.ChasmException;
import io.github.vishalmysore.chasm.exception.SnapshotException;
import io.github.vishalmysore.chasm.graph.ChasmGraph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads and writes the graph as a node-link JSON document:
 *
 * <pre>
 * {"directed": true, "multigraph": false, "graph": {},
 *  "nodes": [{"id": ..., ...attributes, "node_type": "Insight"}],
 *  "edges": [{"source": ..., "target": ..., "relation": "ABOUT", "weight": 0.92}]}
 * </pre>
 *
 * Edges are written under {@code edges}; {@code links} is accepted on read.
 * Saving replaces the file wholesale, so anything mutated after the last save
 * is lost if the process dies.
 */
public class GraphSnapshotCodec {
    private static final Logger log = Logger.getLogger(GraphSnapshotCodec.class.getName());

    private final ObjectMapper mapper;

    public GraphSnapshotCodec() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public GraphSnapshotCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    // ---------------------------------------------------------------------
    // Export
    // ---------------------------------------------------------------------

    /**
     * Builds the node-link document for the whole graph.
     */
    public ObjectNode export(ChasmGraph graph) {
        ObjectNode doc = mapper.createObjectNode();
        doc.put("directed", true);
        doc.put("multigraph", false);
        doc.putObject("graph");

        ArrayNode nodes = doc.putArray("nodes");
        for (GraphEntity node : graph.getAllNodes()) {
            JsonNode attrs = mapper.valueToTree(node.toAttributes());
            nodes.add(attrs);
        }

        ArrayNode edges = doc.putArray("edges");
        for (GraphEdge edge : graph.getAllEdges()) {
            JsonNode attrs = mapper.valueToTree(edge.toAttributes());
            edges.add(attrs);
        }
        return doc;
    }

    /**
     * Full dump of the graph for inspection, independent of any checkpoint.
     */
    public String toJson(ChasmGraph graph) {
        try {
            return mapper.writeValueAsString(export(graph));
        } catch (JsonProcessingException e) {
            throw new SnapshotException(null, "Failed to serialize graph: " + e.getMessage(), e);
        }
    }

    /**
     * Overwrites {@code path} with the current graph, creating parent directories.
     */
    public void save(ChasmGraph graph, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(path.toFile(), export(graph));
            log.info("Graph exported to " + path + " (" + graph.getNodeCount() + " nodes, "
                    + graph.getEdgeCount() + " edges)");
        } catch (IOException e) {
            log.severe("Failed to save graph to " + path + ": " + e.getMessage());
            throw new SnapshotException(path, "Failed to save graph to " + path, e);
        }
    }

    // ---------------------------------------------------------------------
    // Import
    // ---------------------------------------------------------------------

    /**
     * Loads a snapshot, falling back to an empty graph when the file is missing
     * (first run) or cannot be read. A corrupt snapshot never blocks startup; its
     * contents are dropped and the failure is only logged.
     */
    public ChasmGraph load(Path path) {
        if (!Files.exists(path)) {
            log.info("No snapshot at " + path + ", starting with an empty graph");
            return new ChasmGraph();
        }
        try {
            ChasmGraph graph = read(path);
            log.info("Loaded graph from " + path + " (" + graph.getNodeCount() + " nodes, "
                    + graph.getEdgeCount() + " edges)");
            return graph;
        } catch (SnapshotException e) {
            log.warning("Failed to load graph from disk: " + e.getMessage()
                    + (e.getCause() != null ? " (" + e.getCause().getMessage() + ")" : ""));
            return new ChasmGraph();
        }
    }

    /**
     * Strict read: any I/O or format problem is a {@link SnapshotException}.
     */
    public ChasmGraph read(Path path) {
        JsonNode doc;
        try {
            doc = mapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new SnapshotException(path, "Unreadable snapshot " + path, e);
        }
        try {
            return fromDocument(doc);
        } catch (ChasmException | IllegalArgumentException e) {
            throw new SnapshotException(path, "Malformed snapshot " + path + ": " + e.getMessage(), e);
        }
    }

    public ChasmGraph fromDocument(JsonNode doc) {
        if (doc == null || !doc.isObject() || !doc.path("nodes").isArray()) {
            throw new SnapshotException(null, "Snapshot document has no nodes array");
        }
        List<GraphEntity> nodes = new ArrayList<>();
        for (JsonNode node : doc.get("nodes")) {
            String type = text(node, "node_type");
            if (type == null) {
                log.warning("Skipping untyped node " + node.path("id").asText());
                continue;
            }
            nodes.add(readNode(NodeType.fromLabel(type), node));
        }

        JsonNode edgeArray = doc.has("edges") ? doc.get("edges") : doc.path("links");
        List<GraphEdge> edges = new ArrayList<>();
        for (JsonNode edge : edgeArray) {
            edges.add(GraphEdge.builder()
                    .sourceId(edge.path("source").asText())
                    .targetId(edge.path("target").asText())
                    .relation(Relation.fromLabel(text(edge, "relation")))
                    .weight(edge.hasNonNull("weight") ? edge.get("weight").asDouble() : null)
                    .build());
        }

        ChasmGraph graph = new ChasmGraph();
        graph.restore(nodes, edges);
        return graph;
    }

    private GraphEntity readNode(NodeType type, JsonNode node) {
        String id = node.path("id").asText();
        switch (type) {
            case PRODUCT:
                return Product.builder()
                        .id(id)
                        .name(text(node, "name"))
                        .description(text(node, "description"))
                        .url(text(node, "url"))
                        .build();
            case COMPONENT:
                String category = text(node, "category");
                return Component.builder()
                        .id(id)
                        .name(text(node, "name"))
                        .category(category == null ? ComponentCategory.UNKNOWN : ComponentCategory.fromLabel(category))
                        .build();
            case SOURCE:
                return Source.builder()
                        .id(id)
                        .type(SourceType.fromLabel(text(node, "type")))
                        .rawText(text(node, "raw_text"))
                        .url(text(node, "url"))
                        .build();
            case INSIGHT:
                return readInsight(id, node);
            default:
                throw new IllegalArgumentException("Unhandled node type " + type);
        }
    }

    private Insight readInsight(String id, JsonNode node) {
        List<String> tags = new ArrayList<>();
        node.path("tags").forEach(tag -> tags.add(tag.asText()));

        double[] embedding = null;
        JsonNode vector = node.path("embedding");
        if (vector.isArray() && vector.size() > 0) {
            embedding = new double[vector.size()];
            for (int i = 0; i < vector.size(); i++) {
                embedding[i] = vector.get(i).asDouble();
            }
        }

        Instant dateAdded = null;
        String date = text(node, "date_added");
        if (date != null) {
            try {
                dateAdded = Instant.parse(date);
            } catch (DateTimeParseException e) {
                log.warning("Ignoring unparseable date_added on " + id + ": " + date);
            }
        }

        if (!node.hasNonNull("sentiment")) {
            throw new IllegalArgumentException("Insight " + id + " has no sentiment");
        }
        return Insight.builder()
                .id(id)
                .summary(text(node, "summary"))
                .sentiment(node.get("sentiment").asDouble())
                .tags(tags)
                .dateAdded(dateAdded)
                .embedding(embedding)
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
