package io.github.vishalmysore.chasm.examples;

import io.github.vishalmysore.chasm.config.ChasmSettings;
import io.github.vishalmysore.chasm.domain.Component;
import io.github.vishalmysore.chasm.domain.ComponentCategory;
import io.github.vishalmysore.chasm.domain.Insight;
import io.github.vishalmysore.chasm.domain.Product;
import io.github.vishalmysore.chasm.domain.Relation;
import io.github.vishalmysore.chasm.domain.Source;
import io.github.vishalmysore.chasm.domain.SourceType;
import io.github.vishalmysore.chasm.graph.ChasmGraph;
import io.github.vishalmysore.chasm.persistence.GraphSnapshotCodec;
import io.github.vishalmysore.chasm.query.InsightResolver;
import io.github.vishalmysore.chasm.query.ResolvedInsight;
import io.github.vishalmysore.chasm.vector.LinkingResult;
import io.github.vishalmysore.chasm.vector.SemanticLinker;
import io.github.vishalmysore.chasm.workspace.GraphWorkspace;

import java.util.List;

/**
 * End-to-end demonstration of the knowledge graph core:
 * 1. Load (or start) the graph and ingest a drone product with its feedback
 * 2. Embed insights and discover semantic matches
 * 3. Resolve recent insights for a briefing
 * 4. Dump the node-link document and save the snapshot
 */
public class ChasmDemoRunner {

        public static void main(String[] args) {
                ChasmSettings.configureLogging();
                ChasmSettings settings = ChasmSettings.load();

                System.out.println("╔════════════════════════════════════════════════════════════╗");
                System.out.println("║        Chasm: Hardware Feedback Knowledge Graph Demo       ║");
                System.out.println("╚════════════════════════════════════════════════════════════╝\n");

                SemanticLinker linker = new SemanticLinker(settings.createEmbeddingProvider(),
                                settings.getSimilarityThreshold());

                try (GraphWorkspace workspace = GraphWorkspace.open(settings, new GraphSnapshotCodec(), linker)) {
                        // === Phase 1: Ingestion ===
                        System.out.println("═══ PHASE 1: INGESTION ═══\n");
                        workspace.commit(ChasmDemoRunner::ingestSampleFeedback);

                        ChasmGraph graph = workspace.getGraph();
                        System.out.println("Graph: " + graph.getNodeCount() + " nodes, " + graph.getEdgeCount()
                                        + " edges");
                        for (Component component : graph.getProductHierarchy("prod-drone-x")) {
                                System.out.println("  Drone X -> " + component.getName() + " ("
                                                + component.getCategory().getLabel() + ")");
                        }

                        // === Phase 2: Semantic linking ===
                        System.out.println("\n═══ PHASE 2: SEMANTIC LINKING ═══\n");
                        LinkingResult result = workspace.runBulkLinking();
                        System.out.println("Linked " + result.getInsightsConsidered() + " insights with "
                                        + result.getComparisons() + " comparisons: " + result.getEdgesWritten()
                                        + " SEMANTIC_MATCH edge(s)");
                        graph.getEdges(Relation.SEMANTIC_MATCH).forEach(edge -> System.out.println(
                                        "  " + edge.getSourceId() + " <-> " + edge.getTargetId()
                                                        + " (" + edge.getWeight() + ")"));

                        // === Phase 3: Briefing query ===
                        System.out.println("\n═══ PHASE 3: RECENT INSIGHTS ═══\n");
                        List<ResolvedInsight> recent = new InsightResolver().findRecentInsights(graph, 7);
                        for (ResolvedInsight insight : recent) {
                                System.out.println(String.format("  [%+.1f] %-12s %s (%s)", insight.getSentiment(),
                                                insight.getComponentName(), insight.getSummary(),
                                                insight.getSourceUrl()));
                        }

                        // === Phase 4: Export ===
                        System.out.println("\n═══ PHASE 4: NODE-LINK EXPORT ═══\n");
                        String dump = workspace.dump();
                        System.out.println(dump.substring(0, Math.min(dump.length(), 800)) + "\n...\n");
                        System.out.println("Snapshot: " + workspace.getSnapshotPath().toAbsolutePath());
                }
        }

        /**
         * Sample product with two components and feedback from Reddit, a review
         * and an employee interview.
         */
        static void ingestSampleFeedback(ChasmGraph graph) {
                graph.addProduct(Product.builder()
                                .id("prod-drone-x")
                                .name("Drone X")
                                .description("Foldable camera drone with 4K recording.")
                                .url("https://example.com/drone-x")
                                .build());
                graph.addComponent(Component.builder()
                                .id("comp-battery")
                                .name("Battery")
                                .category(ComponentCategory.ELECTRICAL)
                                .build(), "prod-drone-x");
                graph.addComponent(Component.builder()
                                .id("comp-landing-gear")
                                .name("Landing Gear")
                                .category(ComponentCategory.MECHANICAL)
                                .build(), "prod-drone-x");

                graph.addSource(Source.builder()
                                .id("src-reddit-1")
                                .type(SourceType.REDDIT)
                                .rawText("My Drone X overheats after 10 min of 4K recording.")
                                .url("https://reddit.com/r/drones/comments/abc123")
                                .build());
                graph.addSource(Source.builder()
                                .id("src-review-1")
                                .type(SourceType.REVIEW)
                                .rawText("Battery gets very hot during long flights; landing legs feel flimsy.")
                                .url("https://reviews.example.com/drone-x")
                                .build());
                graph.addSource(Source.builder()
                                .id("src-interview-1")
                                .type(SourceType.EMPLOYEE_INTERVIEW)
                                .rawText("Thermal testing on the battery pack passed, we consider it fine.")
                                .build());

                graph.addInsight(Insight.builder()
                                .id("ins-overheat")
                                .summary("Device overheats during extended use")
                                .sentiment(-0.8)
                                .tags(List.of("overheating", "4K", "battery"))
                                .build(), "src-reddit-1", "comp-battery");
                graph.addInsight(Insight.builder()
                                .id("ins-battery-hot")
                                .summary("Battery overheats during extended flights")
                                .sentiment(-0.6)
                                .tags(List.of("battery", "thermal"))
                                .build(), "src-review-1", "comp-battery");
                graph.addInsight(Insight.builder()
                                .id("ins-landing-gear")
                                .summary("Landing gear feels flimsy")
                                .sentiment(-0.4)
                                .tags(List.of("build quality"))
                                .build(), "src-review-1", "comp-landing-gear");
                graph.addInsight(Insight.builder()
                                .id("ins-thermal-ok")
                                .summary("Internal thermal tests on the battery passed")
                                .sentiment(0.5)
                                .tags(List.of("thermal", "internal"))
                                .build(), "src-interview-1", "comp-battery");
        }
}
