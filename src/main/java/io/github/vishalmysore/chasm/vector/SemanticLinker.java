package io.github.vishalmysore.chasm.vector;

import io.github.vishalmysore.chasm.domain.Insight;
import io.github.vishalmysore.chasm.graph.ChasmGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Discovers latent relationships between insights by comparing their embeddings.
 *
 * For every unordered pair of embedded insights whose cosine score reaches the
 * threshold (inclusive), a single SEMANTIC_MATCH edge is written from the
 * earlier insight to the later one, in graph insertion order, weighted with the
 * score rounded to four decimals. Re-linking an already linked pair refreshes
 * the stored weight.
 *
 * Two pass styles are offered:
 * <ul>
 * <li>{@link #linkSemanticMatches(ChasmGraph, double)} rescans every embedded
 * insight, O(n^2) comparisons.</li>
 * <li>{@link #linkNewInsights(ChasmGraph, double)} only compares insights this
 * linker has not seen yet against everything else, O(new x total).</li>
 * </ul>
 * What a linker has seen is tracked per graph instance, so a reloaded graph
 * starts unseen. Both passes run entirely under the graph's write lock and take
 * no lock of their own, so they may also be called from inside
 * {@link ChasmGraph#inWriteBatch}.
 *
 * A {@link io.github.vishalmysore.chasm.exception.LinkerException} aborts the
 * pass; edges written earlier in that pass are kept.
 */
public class SemanticLinker {
    private static final Logger log = Logger.getLogger(SemanticLinker.class.getName());

    private final EmbeddingProvider embeddingProvider;
    private final double defaultThreshold;
    // per-graph sets are only touched under that graph's write lock
    private final Map<ChasmGraph, Set<String>> linkedInsightIds =
            Collections.synchronizedMap(new WeakHashMap<>());

    public SemanticLinker(EmbeddingProvider embeddingProvider, double defaultThreshold) {
        this.embeddingProvider = embeddingProvider;
        this.defaultThreshold = defaultThreshold;
        log.info("SemanticLinker initialized with " + embeddingProvider.getName()
                + ", threshold " + defaultThreshold);
    }

    public double[] embed(String text) {
        return embeddingProvider.embed(text);
    }

    public double getDefaultThreshold() {
        return defaultThreshold;
    }

    /**
     * Embeds the summary of every insight that has no embedding yet. This scans
     * the whole insight population, so its cost grows with the total number of
     * insights rather than the number of new ones.
     *
     * @return number of insights embedded
     */
    public int embedMissing(ChasmGraph graph) {
        return graph.computeInWriteBatch(g -> {
            int embedded = 0;
            for (Insight insight : g.getInsights()) {
                if (!insight.hasEmbedding()) {
                    g.attachEmbedding(insight.getId(), embeddingProvider.embed(insight.getSummary()));
                    embedded++;
                }
            }
            if (embedded > 0) {
                log.info("Generated embeddings for " + embedded + " insight(s)");
            }
            return embedded;
        });
    }

    public int linkSemanticMatches(ChasmGraph graph) {
        return linkSemanticMatches(graph, defaultThreshold);
    }

    /**
     * Full pass over every embedded insight.
     *
     * @return the number of SEMANTIC_MATCH edges written or refreshed
     */
    public int linkSemanticMatches(ChasmGraph graph, double threshold) {
        return runFullPass(graph, threshold).getEdgesWritten();
    }

    public int linkNewInsights(ChasmGraph graph) {
        return linkNewInsights(graph, defaultThreshold);
    }

    /**
     * Incremental pass: only pairs involving at least one insight not seen by a
     * previous pass of this linker are compared.
     *
     * @return the number of SEMANTIC_MATCH edges written or refreshed
     */
    public int linkNewInsights(ChasmGraph graph, double threshold) {
        return runIncrementalPass(graph, threshold).getEdgesWritten();
    }

    public LinkingResult runFullPass(ChasmGraph graph, double threshold) {
        return graph.computeInWriteBatch(g -> {
            List<Insight> embedded = embeddedInsights(g);
            if (embedded.size() < 2) {
                log.info("Fewer than 2 embedded Insight nodes, nothing to link");
                int fresh = markLinked(g, embedded);
                return new LinkingResult(0, embedded.size(), fresh, 0);
            }

            int edges = 0;
            long comparisons = 0;
            for (int i = 0; i < embedded.size(); i++) {
                for (int j = i + 1; j < embedded.size(); j++) {
                    comparisons++;
                    if (linkPair(g, embedded.get(i), embedded.get(j), threshold)) {
                        edges++;
                    }
                }
            }
            int fresh = markLinked(g, embedded);
            log.info("Semantic linking complete: " + edges + " match(es) from " + embedded.size()
                    + " Insight nodes");
            return new LinkingResult(edges, embedded.size(), fresh, comparisons);
        });
    }

    public LinkingResult runIncrementalPass(ChasmGraph graph, double threshold) {
        return graph.computeInWriteBatch(g -> {
            List<Insight> embedded = embeddedInsights(g);
            Set<String> seen = seenIn(g);
            boolean[] fresh = new boolean[embedded.size()];
            List<Integer> freshIndexes = new ArrayList<>();
            for (int i = 0; i < embedded.size(); i++) {
                if (!seen.contains(embedded.get(i).getId())) {
                    fresh[i] = true;
                    freshIndexes.add(i);
                }
            }
            if (freshIndexes.isEmpty() || embedded.size() < 2) {
                log.info("No new embedded Insight nodes to link");
                markLinked(g, embedded);
                return new LinkingResult(0, embedded.size(), freshIndexes.size(), 0);
            }

            int edges = 0;
            long comparisons = 0;
            for (int f : freshIndexes) {
                for (int k = 0; k < embedded.size(); k++) {
                    // fresh-fresh pairs are visited once, from the lower index
                    if (k == f || (fresh[k] && k < f)) {
                        continue;
                    }
                    comparisons++;
                    Insight first = embedded.get(Math.min(f, k));
                    Insight second = embedded.get(Math.max(f, k));
                    if (linkPair(g, first, second, threshold)) {
                        edges++;
                    }
                }
            }
            markLinked(g, embedded);
            log.info("Incremental semantic linking complete: " + edges + " match(es) for "
                    + freshIndexes.size() + " new of " + embedded.size() + " Insight nodes");
            return new LinkingResult(edges, embedded.size(), freshIndexes.size(), comparisons);
        });
    }

    private boolean linkPair(ChasmGraph graph, Insight first, Insight second, double threshold) {
        double score = CosineSimilarity.cosine(first.getEmbedding(), second.getEmbedding());
        if (score < threshold) {
            return false;
        }
        graph.upsertSemanticMatch(first.getId(), second.getId(), CosineSimilarity.round4(score));
        log.fine("SEMANTIC_MATCH: " + first.getId() + " <-> " + second.getId()
                + String.format(" (score=%.4f)", score));
        return true;
    }

    private static List<Insight> embeddedInsights(ChasmGraph graph) {
        return graph.getInsights().stream()
                .filter(Insight::hasEmbedding)
                .collect(Collectors.toList());
    }

    private Set<String> seenIn(ChasmGraph graph) {
        return linkedInsightIds.computeIfAbsent(graph, g -> new HashSet<>());
    }

    private int markLinked(ChasmGraph graph, List<Insight> insights) {
        Set<String> seen = seenIn(graph);
        int added = 0;
        for (Insight insight : insights) {
            if (seen.add(insight.getId())) {
                added++;
            }
        }
        return added;
    }
}
