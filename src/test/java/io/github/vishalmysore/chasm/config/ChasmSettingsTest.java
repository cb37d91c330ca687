package io.github.vishalmysore.chasm.config;

import io.github.vishalmysore.chasm.vector.HashingEmbeddingProvider;
import io.github.vishalmysore.chasm.vector.OpenAiEmbeddingProvider;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Collections;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ChasmSettingsTest {

    @Test
    void testDefaults() {
        ChasmSettings settings = ChasmSettings.fromProperties(new Properties(), Collections.emptyMap());
        assertEquals(0.75, settings.getSimilarityThreshold());
        assertEquals(Paths.get("export.json"), settings.getExportPath());
        assertEquals(384, settings.getEmbeddingDimension());
        assertTrue(settings.createEmbeddingProvider() instanceof HashingEmbeddingProvider);
    }

    @Test
    void testBundledPropertiesAreLoaded() {
        ChasmSettings settings = ChasmSettings.load(Collections.emptyMap());
        assertEquals(0.75, settings.getSimilarityThreshold());
        assertEquals("all-MiniLM-L6-v2", settings.getEmbeddingModel());
    }

    @Test
    void testEnvironmentOverridesProperties() {
        Properties props = new Properties();
        props.setProperty(ChasmSettings.SIMILARITY_THRESHOLD, "0.8");
        props.setProperty(ChasmSettings.EXPORT_PATH, "data/graph.json");

        ChasmSettings settings = ChasmSettings.fromProperties(props, Map.of(
                "CHASM_SIMILARITY_THRESHOLD", "0.9",
                "CHASM_EMBEDDING_API_KEY", "sk-test"));

        assertEquals(0.9, settings.getSimilarityThreshold());
        assertEquals(Paths.get("data/graph.json"), settings.getExportPath());
        assertTrue(settings.createEmbeddingProvider() instanceof OpenAiEmbeddingProvider);
        assertFalse(settings.toString().contains("sk-test"));
    }

    @Test
    void testThresholdOutOfRangeIsRejected() {
        Properties props = new Properties();
        props.setProperty(ChasmSettings.SIMILARITY_THRESHOLD, "1.5");
        assertThrows(IllegalArgumentException.class,
                () -> ChasmSettings.fromProperties(props, Collections.emptyMap()));
    }

    @Test
    void testEnvNames() {
        assertEquals("CHASM_SIMILARITY_THRESHOLD", ChasmSettings.toEnvName(ChasmSettings.SIMILARITY_THRESHOLD));
        assertEquals("CHASM_EMBEDDING_API_KEY", ChasmSettings.toEnvName(ChasmSettings.EMBEDDING_API_KEY));
        assertEquals("CHASM_EXPORT_PATH", ChasmSettings.toEnvName(ChasmSettings.EXPORT_PATH));
    }
}
