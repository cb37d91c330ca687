package io.github.vishalmysore.chasm.config;

import io.github.vishalmysore.chasm.vector.EmbeddingProvider;
import io.github.vishalmysore.chasm.vector.HashingEmbeddingProvider;
import io.github.vishalmysore.chasm.vector.OpenAiEmbeddingProvider;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Process-wide settings, read from {@code chasm.properties} on the classpath.
 * Every key can be overridden by a JVM system property of the same name or by an
 * environment variable ({@code chasm.embedding.apiKey} becomes
 * {@code CHASM_EMBEDDING_API_KEY}).
 */
@Getter
@Builder
@ToString(exclude = "embeddingApiKey")
public class ChasmSettings {
    private static final Logger log = Logger.getLogger(ChasmSettings.class.getName());

    public static final String RESOURCE = "chasm.properties";
    public static final String SIMILARITY_THRESHOLD = "chasm.similarityThreshold";
    public static final String EXPORT_PATH = "chasm.exportPath";
    public static final String EMBEDDING_BASE_URL = "chasm.embedding.baseUrl";
    public static final String EMBEDDING_MODEL = "chasm.embedding.model";
    public static final String EMBEDDING_API_KEY = "chasm.embedding.apiKey";
    public static final String EMBEDDING_DIMENSION = "chasm.embedding.dimension";

    @Builder.Default
    private final double similarityThreshold = 0.75;
    @Builder.Default
    private final Path exportPath = Paths.get("export.json");
    @Builder.Default
    private final String embeddingBaseUrl = "https://api.openai.com/v1";
    @Builder.Default
    private final String embeddingModel = "all-MiniLM-L6-v2";
    @Builder.Default
    private final String embeddingApiKey = "";
    @Builder.Default
    private final int embeddingDimension = 384;

    public static ChasmSettings load() {
        return load(System.getenv());
    }

    static ChasmSettings load(Map<String, String> env) {
        Properties props = new Properties();
        try (InputStream is = ChasmSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (is != null) {
                props.load(is);
            } else {
                log.warning(RESOURCE + " not found on classpath, using defaults");
            }
        } catch (IOException e) {
            log.warning("Could not load " + RESOURCE + ": " + e.getMessage());
        }
        return fromProperties(props, env);
    }

    /**
     * Resolves settings from {@code props}, letting system properties and then
     * environment variables win.
     */
    public static ChasmSettings fromProperties(Properties props, Map<String, String> env) {
        ChasmSettingsBuilder builder = ChasmSettings.builder();
        String threshold = resolve(SIMILARITY_THRESHOLD, props, env);
        if (threshold != null) {
            double value = Double.parseDouble(threshold.trim());
            if (value < -1.0 || value > 1.0) {
                throw new IllegalArgumentException(SIMILARITY_THRESHOLD + " must be within [-1, 1], got " + value);
            }
            builder.similarityThreshold(value);
        }
        String exportPath = resolve(EXPORT_PATH, props, env);
        if (exportPath != null) {
            builder.exportPath(Paths.get(exportPath.trim()));
        }
        String baseUrl = resolve(EMBEDDING_BASE_URL, props, env);
        if (baseUrl != null) {
            builder.embeddingBaseUrl(baseUrl.trim());
        }
        String model = resolve(EMBEDDING_MODEL, props, env);
        if (model != null) {
            builder.embeddingModel(model.trim());
        }
        String apiKey = resolve(EMBEDDING_API_KEY, props, env);
        if (apiKey != null) {
            builder.embeddingApiKey(apiKey.trim());
        }
        String dimension = resolve(EMBEDDING_DIMENSION, props, env);
        if (dimension != null) {
            builder.embeddingDimension(Integer.parseInt(dimension.trim()));
        }
        return builder.build();
    }

    static String toEnvName(String key) {
        return key.replaceAll("([a-z])([A-Z])", "$1_$2").replace('.', '_').toUpperCase(Locale.ROOT);
    }

    private static String resolve(String key, Properties props, Map<String, String> env) {
        String value = env.get(toEnvName(key));
        if (value == null) {
            value = System.getProperty(key);
        }
        if (value == null) {
            value = props.getProperty(key);
        }
        return value == null || value.trim().isEmpty() ? null : value;
    }

    /**
     * Remote provider when an API key is configured, local hashing otherwise.
     */
    public EmbeddingProvider createEmbeddingProvider() {
        if (embeddingApiKey != null && !embeddingApiKey.isEmpty()) {
            return new OpenAiEmbeddingProvider(embeddingApiKey, embeddingBaseUrl, embeddingModel, embeddingDimension);
        }
        log.info("No embedding API key configured, using local hashing embeddings");
        return new HashingEmbeddingProvider(embeddingDimension);
    }

    /**
     * Installs the bundled {@code logging.properties} unless the JVM was started
     * with its own logging configuration.
     */
    public static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream is = ChasmSettings.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            }
        } catch (IOException e) {
            log.warning("Could not apply logging.properties: " + e.getMessage());
        }
    }
}
