package io.github.vishalmysore.chasm.graph;

import io.github.vishalmysore.chasm.domain.Component;
import io.github.vishalmysore.chasm.domain.GraphEdge;
import io.github.vishalmysore.chasm.domain.GraphEntity;
import io.github.vishalmysore.chasm.domain.Insight;
import io.github.vishalmysore.chasm.domain.NodeType;
import io.github.vishalmysore.chasm.domain.Product;
import io.github.vishalmysore.chasm.domain.Relation;
import io.github.vishalmysore.chasm.domain.Source;
import io.github.vishalmysore.chasm.exception.EntityValidationException;
import io.github.vishalmysore.chasm.exception.ReferentialIntegrityException;

import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * In-memory directed, labelled graph of hardware products, their components,
 * feedback sources and extracted insights.
 *
 * Node ids share a single namespace. Adding a node whose id already exists
 * replaces its attributes without touching edges. There is at most one edge per
 * ordered (source, target) pair; writing a second one replaces the first.
 *
 * Every mutation checks that the edge endpoints exist and have the node types
 * the {@link Relation} allows, and fails with {@link ReferentialIntegrityException}
 * before anything is written.
 *
 * Access is guarded by a read/write lock: single operations are atomic, and
 * {@link #inWriteBatch(Consumer)} holds the write lock across a caller's whole
 * batch of mutations. Callers that share one graph between threads must route
 * multi-step mutations through it.
 */
public class ChasmGraph {
    private static final Logger log = Logger.getLogger(ChasmGraph.class.getName());

    private final Map<String, GraphEntity> nodes = new LinkedHashMap<>();
    private final Map<String, Map<String, GraphEdge>> outgoing = new LinkedHashMap<>();
    private final Map<String, Map<String, GraphEdge>> incoming = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private int edgeCount;

    public ChasmGraph() {
        log.info("ChasmGraph initialized (empty)");
    }

    // ---------------------------------------------------------------------
    // Mutations
    // ---------------------------------------------------------------------

    public void addProduct(Product product) {
        write(() -> {
            putNode(product);
            log.info("Added Product node: " + product.getId() + " (" + product.getName() + ")");
        });
    }

    /**
     * Adds or replaces a component and links it to its product:
     * Product -[HAS_COMPONENT]-> Component.
     */
    public void addComponent(Component component, String productId) {
        write(() -> {
            requireNode(productId, Relation.HAS_COMPONENT.getSourceTypes());
            requireFreeOrSameType(component);
            putNode(component);
            putEdge(GraphEdge.of(productId, component.getId(), Relation.HAS_COMPONENT));
            log.info("Added Component node: " + component.getId() + " (" + component.getName()
                    + ") -> linked to Product " + productId);
        });
    }

    public void addSource(Source source) {
        write(() -> {
            putNode(source);
            log.info("Added Source node: " + source.getId() + " (" + source.getType().getLabel() + ")");
        });
    }

    /**
     * Adds or replaces an insight and wires it between its source and its subject:
     * Source -[YIELDS]-> Insight -[ABOUT]-> Product|Component.
     *
     * An insight is about exactly one subject, so re-adding it with a different
     * target moves its ABOUT edge. An embedding already attached to the stored
     * insight survives a re-add that carries none.
     */
    public void addInsight(Insight insight, String sourceId, String targetId) {
        write(() -> {
            requireNode(sourceId, Relation.YIELDS.getSourceTypes());
            requireNode(targetId, Relation.ABOUT.getTargetTypes());
            requireFreeOrSameType(insight);

            GraphEntity existing = nodes.get(insight.getId());
            Insight stored = insight;
            if (existing != null && !insight.hasEmbedding() && ((Insight) existing).hasEmbedding()) {
                stored = insight.withEmbedding(((Insight) existing).getEmbedding());
            }
            putNode(stored);

            for (GraphEdge about : outgoingEdges(insight.getId(), Relation.ABOUT)) {
                if (!about.getTargetId().equals(targetId)) {
                    removeEdge(about);
                }
            }
            putEdge(GraphEdge.of(sourceId, insight.getId(), Relation.YIELDS));
            putEdge(GraphEdge.of(insight.getId(), targetId, Relation.ABOUT));
            log.info("Added Insight node: " + insight.getId() + " | Source(" + sourceId
                    + ") -> Insight -> Target(" + targetId + ")");
        });
    }

    /**
     * Attaches an embedding to a stored, still unembedded insight.
     */
    public void attachEmbedding(String insightId, double[] embedding) {
        write(() -> {
            Insight insight = (Insight) requireNode(insightId, EnumSet.of(NodeType.INSIGHT));
            nodes.put(insightId, insight.withEmbedding(embedding));
        });
    }

    /**
     * Writes or refreshes the similarity link between two embedded insights.
     * The pair is stored once: if the reverse edge already exists it is the one
     * updated.
     *
     * @return the edge as stored
     */
    public GraphEdge upsertSemanticMatch(String fromId, String toId, double weight) {
        return writeAndGet(() -> {
            Set<NodeType> insightOnly = Relation.SEMANTIC_MATCH.getSourceTypes();
            Insight from = (Insight) requireNode(fromId, insightOnly);
            Insight to = (Insight) requireNode(toId, insightOnly);
            if (fromId.equals(toId)) {
                throw new EntityValidationException(fromId, "an insight cannot match itself");
            }
            if (!from.hasEmbedding() || !to.hasEmbedding()) {
                throw new EntityValidationException(from.hasEmbedding() ? toId : fromId,
                        "SEMANTIC_MATCH requires both insights to be embedded");
            }
            GraphEdge reverse = edgeBetween(toId, fromId);
            GraphEdge edge = reverse != null && reverse.getRelation() == Relation.SEMANTIC_MATCH
                    ? reverse.toBuilder().weight(weight).build()
                    : GraphEdge.builder().sourceId(fromId).targetId(toId)
                            .relation(Relation.SEMANTIC_MATCH).weight(weight).build();
            putEdge(edge);
            return edge;
        });
    }

    /**
     * Runs {@code batch} while holding the write lock, so no other caller can
     * observe or interleave with a half-applied batch.
     */
    public void inWriteBatch(Consumer<ChasmGraph> batch) {
        write(() -> batch.accept(this));
    }

    public <T> T computeInWriteBatch(Function<ChasmGraph, T> batch) {
        return writeAndGet(() -> batch.apply(this));
    }

    /**
     * Rebuilds nodes and edges read back from a snapshot. Nodes are stored as-is;
     * each edge is checked against the node types its relation allows and is
     * skipped, with a warning, when an endpoint is missing or mistyped.
     *
     * @return the number of edges that were skipped
     */
    public int restore(Collection<? extends GraphEntity> restoredNodes, Collection<GraphEdge> restoredEdges) {
        return writeAndGet(() -> {
            restoredNodes.forEach(this::putNode);
            int skipped = 0;
            for (GraphEdge edge : restoredEdges) {
                try {
                    requireNode(edge.getSourceId(), edge.getRelation().getSourceTypes());
                    requireNode(edge.getTargetId(), edge.getRelation().getTargetTypes());
                    putEdge(edge);
                } catch (ReferentialIntegrityException e) {
                    log.warning("Skipping " + edge.getRelation() + " edge " + edge.getSourceId()
                            + " -> " + edge.getTargetId() + ": " + e.getMessage());
                    skipped++;
                }
            }
            return skipped;
        });
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    /**
     * Returns every component reachable from the product through a single
     * HAS_COMPONENT edge. Unknown product ids yield an empty list.
     */
    public List<Component> getProductHierarchy(String productId) {
        return read(() -> outgoingEdges(productId, Relation.HAS_COMPONENT).stream()
                .map(edge -> nodes.get(edge.getTargetId()))
                .filter(Component.class::isInstance)
                .map(Component.class::cast)
                .collect(Collectors.toList()));
    }

    public Optional<GraphEntity> getNode(String id) {
        return read(() -> Optional.ofNullable(nodes.get(id)));
    }

    public boolean containsNode(String id) {
        return read(() -> nodes.containsKey(id));
    }

    public List<GraphEntity> getNodes(NodeType type) {
        return read(() -> nodes.values().stream()
                .filter(node -> node.getNodeType() == type)
                .collect(Collectors.toList()));
    }

    public List<Product> getProducts() {
        return getNodes(NodeType.PRODUCT).stream().map(Product.class::cast).collect(Collectors.toList());
    }

    /**
     * Insights in insertion order.
     */
    public List<Insight> getInsights() {
        return getNodes(NodeType.INSIGHT).stream().map(Insight.class::cast).collect(Collectors.toList());
    }

    public Optional<GraphEdge> getEdge(String sourceId, String targetId) {
        return read(() -> Optional.ofNullable(edgeBetween(sourceId, targetId)));
    }

    public List<GraphEdge> getEdges(Relation relation) {
        return read(() -> allEdges().stream()
                .filter(edge -> edge.getRelation() == relation)
                .collect(Collectors.toList()));
    }

    public List<GraphEdge> getOutgoingEdges(String nodeId, Relation relation) {
        return read(() -> outgoingEdges(nodeId, relation));
    }

    public List<GraphEdge> getIncomingEdges(String nodeId, Relation relation) {
        return read(() -> incoming.getOrDefault(nodeId, Collections.emptyMap()).values().stream()
                .filter(edge -> edge.getRelation() == relation)
                .collect(Collectors.toList()));
    }

    public List<GraphEntity> getAllNodes() {
        return read(() -> new ArrayList<>(nodes.values()));
    }

    public List<GraphEdge> getAllEdges() {
        return read(this::allEdges);
    }

    public int getNodeCount() {
        return read(nodes::size);
    }

    public int getEdgeCount() {
        return read(() -> edgeCount);
    }

    // ---------------------------------------------------------------------
    // Internals, always called with the appropriate lock held
    // ---------------------------------------------------------------------

    private void putNode(GraphEntity node) {
        requireFreeOrSameType(node);
        nodes.put(node.getId(), node);
    }

    private void requireFreeOrSameType(GraphEntity node) {
        GraphEntity existing = nodes.get(node.getId());
        if (existing != null && existing.getNodeType() != node.getNodeType()) {
            throw new EntityValidationException(node.getId(), "node id " + node.getId()
                    + " is already a " + existing.getNodeType().getLabel()
                    + ", cannot store a " + node.getNodeType().getLabel());
        }
    }

    private GraphEntity requireNode(String id, Set<NodeType> expected) {
        GraphEntity node = id == null ? null : nodes.get(id);
        if (node == null) {
            throw new ReferentialIntegrityException(id, expected, "Edge endpoint does not exist: " + id);
        }
        if (!expected.contains(node.getNodeType())) {
            throw new ReferentialIntegrityException(id, expected, "Edge endpoint " + id + " is a "
                    + node.getNodeType().getLabel() + ", expected one of " + expected);
        }
        return node;
    }

    private void putEdge(GraphEdge edge) {
        GraphEdge previous = outgoing.computeIfAbsent(edge.getSourceId(), k -> new LinkedHashMap<>())
                .put(edge.getTargetId(), edge);
        incoming.computeIfAbsent(edge.getTargetId(), k -> new LinkedHashMap<>())
                .put(edge.getSourceId(), edge);
        if (previous == null) {
            edgeCount++;
        }
    }

    private void removeEdge(GraphEdge edge) {
        Map<String, GraphEdge> out = outgoing.get(edge.getSourceId());
        if (out != null && out.remove(edge.getTargetId()) != null) {
            incoming.get(edge.getTargetId()).remove(edge.getSourceId());
            edgeCount--;
        }
    }

    private GraphEdge edgeBetween(String sourceId, String targetId) {
        return outgoing.getOrDefault(sourceId, Collections.emptyMap()).get(targetId);
    }

    private List<GraphEdge> outgoingEdges(String nodeId, Relation relation) {
        return outgoing.getOrDefault(nodeId, Collections.emptyMap()).values().stream()
                .filter(edge -> edge.getRelation() == relation)
                .collect(Collectors.toList());
    }

    private List<GraphEdge> allEdges() {
        List<GraphEdge> all = new ArrayList<>(edgeCount);
        outgoing.values().forEach(targets -> all.addAll(targets.values()));
        return all;
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void write(Runnable action) {
        lock.writeLock().lock();
        try {
            action.run();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T writeAndGet(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
