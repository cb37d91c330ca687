package io.github.vishalmysore.chasm.query;

import io.github.vishalmysore.chasm.domain.Component;
import io.github.vishalmysore.chasm.domain.GraphEdge;
import io.github.vishalmysore.chasm.domain.GraphEntity;
import io.github.vishalmysore.chasm.domain.Insight;
import io.github.vishalmysore.chasm.domain.Product;
import io.github.vishalmysore.chasm.domain.Relation;
import io.github.vishalmysore.chasm.domain.Source;
import io.github.vishalmysore.chasm.graph.ChasmGraph;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Read side for reporting collaborators: collects recent insights and resolves
 * each one's subject (through its ABOUT edge) and origin (through its incoming
 * YIELDS edge).
 */
public class InsightResolver {
    private static final Logger log = Logger.getLogger(InsightResolver.class.getName());

    public static final String GENERAL_SUBJECT = "General";

    public List<ResolvedInsight> findRecentInsights(ChasmGraph graph, int daysBack) {
        return findRecentInsights(graph, daysBack, Instant.now());
    }

    /**
     * @param daysBack look-back window in days, counted back from {@code now}
     */
    public List<ResolvedInsight> findRecentInsights(ChasmGraph graph, int daysBack, Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(daysBack));
        List<ResolvedInsight> results = new ArrayList<>();
        for (Insight insight : graph.getInsights()) {
            if (insight.getDateAdded() != null && insight.getDateAdded().isBefore(cutoff)) {
                continue;
            }
            results.add(resolve(graph, insight));
        }
        log.info("Found " + results.size() + " insight(s) within the last " + daysBack + " day(s)");
        return results;
    }

    public ResolvedInsight resolve(ChasmGraph graph, Insight insight) {
        return ResolvedInsight.builder()
                .id(insight.getId())
                .summary(insight.getSummary())
                .sentiment(insight.getSentiment())
                .tags(insight.getTags())
                .dateAdded(insight.getDateAdded())
                .componentName(subjectName(graph, insight.getId()))
                .sourceUrl(sourceUrl(graph, insight.getId()))
                .build();
    }

    private String subjectName(ChasmGraph graph, String insightId) {
        return graph.getOutgoingEdges(insightId, Relation.ABOUT).stream()
                .findFirst()
                .flatMap(edge -> graph.getNode(edge.getTargetId()))
                .map(InsightResolver::nameOf)
                .orElse(GENERAL_SUBJECT);
    }

    private static String nameOf(GraphEntity subject) {
        switch (subject.getNodeType()) {
            case COMPONENT:
                return ((Component) subject).getName();
            case PRODUCT:
                return ((Product) subject).getName();
            default:
                return GENERAL_SUBJECT;
        }
    }

    private String sourceUrl(ChasmGraph graph, String insightId) {
        for (GraphEdge edge : graph.getIncomingEdges(insightId, Relation.YIELDS)) {
            Optional<GraphEntity> source = graph.getNode(edge.getSourceId());
            if (source.isPresent() && source.get() instanceof Source) {
                String url = ((Source) source.get()).getUrl();
                if (url != null) {
                    return url;
                }
            }
        }
        return "";
    }
}
