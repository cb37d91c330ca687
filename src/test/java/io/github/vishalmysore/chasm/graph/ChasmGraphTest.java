package io.github.vishalmysore.chasm.graph;

import io.github.vishalmysore.chasm.domain.Component;
import io.github.vishalmysore.chasm.domain.ComponentCategory;
import io.github.vishalmysore.chasm.domain.GraphEdge;
import io.github.vishalmysore.chasm.domain.Insight;
import io.github.vishalmysore.chasm.domain.NodeType;
import io.github.vishalmysore.chasm.domain.Product;
import io.github.vishalmysore.chasm.domain.Relation;
import io.github.vishalmysore.chasm.domain.Source;
import io.github.vishalmysore.chasm.domain.SourceType;
import io.github.vishalmysore.chasm.exception.EntityValidationException;
import io.github.vishalmysore.chasm.exception.ReferentialIntegrityException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChasmGraphTest {

    private ChasmGraph graph;

    @BeforeEach
    void setUp() {
        graph = new ChasmGraph();
        graph.addProduct(Product.builder()
                .id("prod-001")
                .name("DJI Mavic 3 Pro")
                .description("A triple-camera drone with Hasselblad optics.")
                .url("https://www.dji.com")
                .build());
        graph.addComponent(Component.builder()
                .id("comp-001")
                .name("Intelligent Flight Battery")
                .category(ComponentCategory.ELECTRICAL)
                .build(), "prod-001");
        graph.addSource(Source.builder()
                .id("src-001")
                .type(SourceType.REDDIT)
                .rawText("My Mavic 3 Pro overheats badly after 10 min of 4K recording.")
                .url("https://reddit.com/r/dji/comments/abc123")
                .build());
        graph.addInsight(insight("ins-001", "Device overheats during extended 4K video recording.", -0.8),
                "src-001", "comp-001");
    }

    private static Insight insight(String id, String summary, double sentiment) {
        return Insight.builder().id(id).summary(summary).sentiment(sentiment).build();
    }

    @Test
    void testNodesAndTypes() {
        assertEquals(NodeType.PRODUCT, graph.getNode("prod-001").orElseThrow().getNodeType());
        assertEquals(NodeType.COMPONENT, graph.getNode("comp-001").orElseThrow().getNodeType());
        assertEquals(NodeType.SOURCE, graph.getNode("src-001").orElseThrow().getNodeType());
        assertEquals(NodeType.INSIGHT, graph.getNode("ins-001").orElseThrow().getNodeType());
        assertFalse(graph.containsNode("missing"));
    }

    @Test
    void testEdges() {
        assertEquals(Relation.HAS_COMPONENT, graph.getEdge("prod-001", "comp-001").orElseThrow().getRelation());
        assertEquals(Relation.YIELDS, graph.getEdge("src-001", "ins-001").orElseThrow().getRelation());
        assertEquals(Relation.ABOUT, graph.getEdge("ins-001", "comp-001").orElseThrow().getRelation());
        assertTrue(graph.getEdge("comp-001", "prod-001").isEmpty());
    }

    @Test
    void testCounts() {
        assertEquals(4, graph.getNodeCount());
        assertEquals(3, graph.getEdgeCount());
    }

    @Test
    void testHierarchyOnlyContainsOwnComponents() {
        graph.addProduct(Product.builder().id("prod-002").name("Action Cam").build());
        graph.addComponent(Component.builder().id("comp-002").name("Lens").category(ComponentCategory.MECHANICAL)
                .build(), "prod-002");

        List<Component> hierarchy = graph.getProductHierarchy("prod-001");
        assertEquals(1, hierarchy.size());
        assertEquals("Intelligent Flight Battery", hierarchy.get(0).getName());
        assertEquals(ComponentCategory.ELECTRICAL, hierarchy.get(0).getCategory());
        assertEquals("Lens", graph.getProductHierarchy("prod-002").get(0).getName());
    }

    @Test
    void testHierarchyReflectsUpsertedComponent() {
        graph.addComponent(Component.builder().id("comp-001").name("Battery v2").category(ComponentCategory.ELECTRICAL)
                .build(), "prod-001");

        List<Component> hierarchy = graph.getProductHierarchy("prod-001");
        assertEquals(1, hierarchy.size());
        assertEquals("Battery v2", hierarchy.get(0).getName());
    }

    @Test
    void testHierarchyOfUnknownProductIsEmpty() {
        assertTrue(graph.getProductHierarchy("nope").isEmpty());
    }

    @Test
    void testProductUpsertIsIdempotent() {
        int nodes = graph.getNodeCount();
        int edges = graph.getEdgeCount();

        graph.addProduct(Product.builder().id("prod-001").name("Mavic 3 Pro (rev B)").build());

        assertEquals(nodes, graph.getNodeCount());
        assertEquals(edges, graph.getEdgeCount());
        Product stored = (Product) graph.getNode("prod-001").orElseThrow();
        assertEquals("Mavic 3 Pro (rev B)", stored.getName());
        assertNull(stored.getDescription());
        assertEquals(1, graph.getProductHierarchy("prod-001").size());
    }

    @Test
    void testComponentRequiresExistingProduct() {
        ReferentialIntegrityException e = assertThrows(ReferentialIntegrityException.class,
                () -> graph.addComponent(Component.builder().id("comp-x").name("Rotor").build(), "prod-missing"));
        assertEquals("prod-missing", e.getNodeId());
        assertFalse(graph.containsNode("comp-x"));
    }

    @Test
    void testComponentCannotHangOffNonProduct() {
        assertThrows(ReferentialIntegrityException.class,
                () -> graph.addComponent(Component.builder().id("comp-x").name("Rotor").build(), "src-001"));
        assertFalse(graph.containsNode("comp-x"));
    }

    @Test
    void testInsightRequiresSourceAndSubject() {
        assertThrows(ReferentialIntegrityException.class,
                () -> graph.addInsight(insight("ins-x", "Loud fans", -0.2), "src-missing", "comp-001"));
        assertThrows(ReferentialIntegrityException.class,
                () -> graph.addInsight(insight("ins-x", "Loud fans", -0.2), "src-001", "src-001"));
        assertFalse(graph.containsNode("ins-x"));
        assertEquals(3, graph.getEdgeCount());
    }

    @Test
    void testInsightCanBeAboutProduct() {
        graph.addInsight(insight("ins-002", "Great value for money", 0.9), "src-001", "prod-001");
        assertEquals(Relation.ABOUT, graph.getEdge("ins-002", "prod-001").orElseThrow().getRelation());
    }

    @Test
    void testInsightIsAboutExactlyOneSubject() {
        graph.addInsight(insight("ins-001", "Device overheats", -0.8), "src-001", "prod-001");

        List<GraphEdge> about = graph.getOutgoingEdges("ins-001", Relation.ABOUT);
        assertEquals(1, about.size());
        assertEquals("prod-001", about.get(0).getTargetId());
        assertEquals(3, graph.getEdgeCount());
    }

    @Test
    void testReAddedInsightKeepsEmbedding() {
        graph.attachEmbedding("ins-001", new double[] { 0.6, 0.8 });
        graph.addInsight(insight("ins-001", "Device overheats (edited)", -0.7), "src-001", "comp-001");

        Insight stored = (Insight) graph.getNode("ins-001").orElseThrow();
        assertEquals("Device overheats (edited)", stored.getSummary());
        assertArrayEquals(new double[] { 0.6, 0.8 }, stored.getEmbedding());
    }

    @Test
    void testCallerReferencesCannotEmbedStoredInsight() {
        Insight mine = insight("ins-002", "Battery runs hot", -0.5);
        graph.addInsight(mine, "src-001", "comp-001");

        Insight copy = mine.withEmbedding(new double[] { 1.0, 0.0 });
        assertTrue(copy.hasEmbedding());
        assertFalse(((Insight) graph.getNode("ins-002").orElseThrow()).hasEmbedding());

        Insight read = graph.getInsights().get(1);
        graph.attachEmbedding("ins-002", new double[] { 0.6, 0.8 });
        assertFalse(read.hasEmbedding());
        assertFalse(mine.hasEmbedding());
        assertArrayEquals(new double[] { 0.6, 0.8 },
                ((Insight) graph.getNode("ins-002").orElseThrow()).getEmbedding());
    }

    @Test
    void testIdCannotChangeNodeType() {
        assertThrows(EntityValidationException.class,
                () -> graph.addProduct(Product.builder().id("comp-001").name("Impostor").build()));
        assertEquals(NodeType.COMPONENT, graph.getNode("comp-001").orElseThrow().getNodeType());
    }

    @Test
    void testSemanticMatchStoredOncePerPair() {
        graph.addInsight(Insight.builder().id("ins-002").summary("Battery runs hot").sentiment(-0.5)
                .embedding(new double[] { 1.0, 0.0 }).build(), "src-001", "comp-001");
        graph.attachEmbedding("ins-001", new double[] { 0.9, 0.1 });

        graph.upsertSemanticMatch("ins-001", "ins-002", 0.9);
        GraphEdge refreshed = graph.upsertSemanticMatch("ins-002", "ins-001", 0.95);

        assertEquals("ins-001", refreshed.getSourceId());
        assertEquals(1, graph.getEdges(Relation.SEMANTIC_MATCH).size());
        assertEquals(0.95, graph.getEdge("ins-001", "ins-002").orElseThrow().getWeight());
        assertTrue(graph.getEdge("ins-002", "ins-001").isEmpty());
    }

    @Test
    void testSemanticMatchRequiresEmbeddedInsights() {
        graph.addInsight(insight("ins-002", "Battery runs hot", -0.5), "src-001", "comp-001");
        assertThrows(EntityValidationException.class, () -> graph.upsertSemanticMatch("ins-001", "ins-002", 0.9));
        assertThrows(ReferentialIntegrityException.class,
                () -> graph.upsertSemanticMatch("ins-001", "comp-001", 0.9));
    }

    @Test
    void testEdgeQueriesFilterByRelation() {
        assertEquals(1, graph.getIncomingEdges("ins-001", Relation.YIELDS).size());
        assertTrue(graph.getIncomingEdges("ins-001", Relation.ABOUT).isEmpty());
        assertEquals(1, graph.getEdges(Relation.HAS_COMPONENT).size());
        assertEquals(1, graph.getInsights().size());
        assertEquals(1, graph.getProducts().size());
    }

    @Test
    void testEndToEndDroneScenario() {
        ChasmGraph drone = new ChasmGraph();
        drone.addProduct(Product.builder().id("Drone X").name("Drone X").build());
        drone.addComponent(Component.builder().id("battery").name("Battery").category(ComponentCategory.ELECTRICAL)
                .build(), "Drone X");
        drone.addSource(Source.builder().id("reddit-1").type(SourceType.REDDIT).rawText("overheats after 10 min")
                .url("https://reddit.com/r/drones/1").build());
        drone.addInsight(insight("overheat", "Device overheats during extended use", -0.8), "reddit-1", "battery");

        List<Component> hierarchy = drone.getProductHierarchy("Drone X");
        assertEquals(1, hierarchy.size());
        assertEquals("Battery", hierarchy.get(0).getName());
    }

    @Test
    void testWriteBatchRunsUnderOneLock() throws InterruptedException {
        Thread[] writers = new Thread[4];
        for (int t = 0; t < writers.length; t++) {
            final int offset = t * 100;
            writers[t] = new Thread(() -> graph.inWriteBatch(g -> {
                for (int i = 0; i < 100; i++) {
                    g.addProduct(Product.builder().id("p-" + (offset + i)).name("P" + i).build());
                }
            }));
            writers[t].start();
        }
        for (Thread writer : writers) {
            writer.join();
        }
        assertEquals(404, graph.getNodeCount());
        assertEquals(401, (int) graph.computeInWriteBatch(g -> g.getProducts().size()));
    }
}
