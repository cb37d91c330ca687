package io.github.vishalmysore.chasm.domain;

import io.github.vishalmysore.chasm.exception.EntityValidationException;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single insight extracted from a {@link Source}.
 *
 * Sentiment is range-checked here, so an out-of-range insight never reaches the
 * graph. Instances are immutable: the embedding starts absent and
 * {@link #withEmbedding(double[])} yields the embedded copy, exactly once.
 *
 * The builder stamps {@code dateAdded} with the current time. Insights restored
 * from snapshots that predate the field keep a {@code null} date.
 */
@Getter
@ToString(exclude = "embedding")
public class Insight implements GraphEntity {
    public static final double MIN_SENTIMENT = -1.0;
    public static final double MAX_SENTIMENT = 1.0;

    private final String id;
    private final String summary;
    private final double sentiment;
    private final List<String> tags;
    private final Instant dateAdded;

    @Getter(AccessLevel.NONE)
    private final double[] embedding;

    @Builder
    public Insight(String id, String summary, double sentiment, List<String> tags,
            Instant dateAdded, double[] embedding) {
        this.id = EntityChecks.requireText(id, "id", id);
        this.summary = EntityChecks.requireText(id, "summary", summary);
        if (Double.isNaN(sentiment) || sentiment < MIN_SENTIMENT || sentiment > MAX_SENTIMENT) {
            throw new EntityValidationException(id,
                    "sentiment must be within [-1.0, 1.0], got " + sentiment);
        }
        this.sentiment = sentiment;
        this.tags = tags == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(tags));
        this.dateAdded = dateAdded;
        this.embedding = embedding == null ? null : checkEmbedding(id, embedding);
    }

    public static class InsightBuilder {
        private Instant dateAdded = Instant.now();
    }

    public boolean hasEmbedding() {
        return embedding != null;
    }

    /**
     * @return a copy of the embedding, or {@code null} while the insight is unembedded
     */
    public double[] getEmbedding() {
        return embedding == null ? null : embedding.clone();
    }

    /**
     * Returns the embedded copy of this insight. There is no way back.
     */
    public Insight withEmbedding(double[] vector) {
        if (embedding != null) {
            throw new EntityValidationException(id, "insight is already embedded");
        }
        if (vector == null) {
            throw new EntityValidationException(id, "embedding must be a non-empty vector");
        }
        return new Insight(id, summary, sentiment, tags, dateAdded, vector);
    }

    private static double[] checkEmbedding(String id, double[] vector) {
        if (vector.length == 0) {
            throw new EntityValidationException(id, "embedding must be a non-empty vector");
        }
        for (double v : vector) {
            if (!Double.isFinite(v)) {
                throw new EntityValidationException(id, "embedding contains a non-finite value");
            }
        }
        return vector.clone();
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.INSIGHT;
    }

    @Override
    public Map<String, Object> toAttributes() {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("id", id);
        attrs.put("summary", summary);
        attrs.put("sentiment", sentiment);
        attrs.put("tags", new ArrayList<>(tags));
        attrs.put("embedding", embedding == null ? null : toList(embedding));
        if (dateAdded != null) {
            attrs.put("date_added", dateAdded.toString());
        }
        attrs.put("node_type", getNodeType().getLabel());
        return attrs;
    }

    private static List<Double> toList(double[] vector) {
        List<Double> values = new ArrayList<>(vector.length);
        Arrays.stream(vector).forEach(values::add);
        return values;
    }
}
