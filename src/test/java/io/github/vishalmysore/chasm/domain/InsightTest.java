package io.github.vishalmysore.chasm.domain;

import io.github.vishalmysore.chasm.exception.EntityValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InsightTest {

    private static Insight.InsightBuilder base() {
        return Insight.builder().id("ins-1").summary("Hinge squeaks after a month");
    }

    @Test
    void testSentimentBoundsAreInclusive() {
        assertEquals(-1.0, base().sentiment(-1.0).build().getSentiment());
        assertEquals(1.0, base().sentiment(1.0).build().getSentiment());
    }

    @Test
    void testSentimentOutOfRangeIsRejected() {
        EntityValidationException e = assertThrows(EntityValidationException.class,
                () -> base().sentiment(1.01).build());
        assertEquals("ins-1", e.getEntityId());
        assertThrows(EntityValidationException.class, () -> base().sentiment(-1.5).build());
        assertThrows(EntityValidationException.class, () -> base().sentiment(Double.NaN).build());
    }

    @Test
    void testBlankSummaryIsRejected() {
        assertThrows(EntityValidationException.class,
                () -> Insight.builder().id("ins-1").summary("  ").sentiment(0.0).build());
    }

    @Test
    void testEmbeddingIsAttachedOnce() {
        Insight insight = base().sentiment(0.2).build();
        assertFalse(insight.hasEmbedding());
        assertNull(insight.getEmbedding());

        Insight embedded = insight.withEmbedding(new double[] { 0.1, 0.2 });
        assertTrue(embedded.hasEmbedding());
        assertFalse(insight.hasEmbedding());
        assertThrows(EntityValidationException.class, () -> embedded.withEmbedding(new double[] { 0.3, 0.4 }));
        assertArrayEquals(new double[] { 0.1, 0.2 }, embedded.getEmbedding());
        assertEquals(insight.getDateAdded(), embedded.getDateAdded());
    }

    @Test
    void testEmbeddingIsCopiedOnReadAndWrite() {
        double[] vector = { 1.0, 2.0 };
        Insight insight = base().sentiment(0.0).embedding(vector).build();
        vector[0] = 99.0;
        insight.getEmbedding()[1] = 42.0;
        assertArrayEquals(new double[] { 1.0, 2.0 }, insight.getEmbedding());
    }

    @Test
    void testInvalidEmbeddingIsRejected() {
        Insight insight = base().sentiment(0.0).build();
        assertThrows(EntityValidationException.class, () -> insight.withEmbedding(new double[0]));
        assertThrows(EntityValidationException.class, () -> insight.withEmbedding(null));
        assertThrows(EntityValidationException.class,
                () -> insight.withEmbedding(new double[] { 1.0, Double.POSITIVE_INFINITY }));
        assertFalse(insight.hasEmbedding());
    }

    @Test
    void testAttributesUseWireNames() {
        Insight insight = base().sentiment(-0.5).tags(List.of("hinge", "noise")).build();
        Map<String, Object> attrs = insight.toAttributes();

        assertEquals("Insight", attrs.get("node_type"));
        assertEquals(List.of("hinge", "noise"), attrs.get("tags"));
        assertEquals(-0.5, attrs.get("sentiment"));
        assertTrue(attrs.containsKey("embedding"));
        assertNull(attrs.get("embedding"));
        assertNotNull(attrs.get("date_added"));
    }

    @Test
    void testBuilderStampsDateAddedUnlessSetExplicitly() {
        assertNotNull(base().sentiment(0.0).build().getDateAdded());

        Insight undated = base().sentiment(0.0).dateAdded(null).build();
        assertNull(undated.getDateAdded());
        assertFalse(undated.toAttributes().containsKey("date_added"));
    }
}
