package io.github.vishalmysore.chasm.vector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.vishalmysore.chasm.exception.LinkerException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Embedding provider that calls an OpenAI-compatible /embeddings endpoint
 * (OpenAI, Azure OpenAI, NVIDIA NIM, a local vLLM or text-embeddings server).
 *
 * Results are cached per text, so repeated calls on identical text return the
 * same vector. Every vector must have the same length; the first response fixes
 * it when no dimension is configured. Any failure is a {@link LinkerException}:
 * there is no silent fallback to another model, since mixing vector spaces would
 * make scores meaningless.
 */
public class OpenAiEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = Logger.getLogger(OpenAiEmbeddingProvider.class.getName());
    private static final ObjectMapper mapper = new ObjectMapper();
    private static final int MAX_INPUT_CHARS = 2000;

    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final HttpClient httpClient;
    private volatile int dimension;

    private final ConcurrentHashMap<String, double[]> embeddingCache = new ConcurrentHashMap<>();

    public OpenAiEmbeddingProvider(String apiKey, String baseUrl, String model, int dimension) {
        this(apiKey, baseUrl, model, dimension, HttpClient.newHttpClient());
    }

    public OpenAiEmbeddingProvider(String apiKey, String baseUrl, String model, int dimension,
            HttpClient httpClient) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        this.model = model;
        this.dimension = dimension;
        this.httpClient = httpClient;
    }

    @Override
    public double[] embed(String text) {
        String key = text == null ? "" : text.length() > MAX_INPUT_CHARS ? text.substring(0, MAX_INPUT_CHARS) : text;
        double[] cached = embeddingCache.get(key);
        if (cached == null) {
            cached = checkDimension(callEmbeddingApi(key));
            embeddingCache.putIfAbsent(key, cached);
        }
        return cached.clone();
    }

    private synchronized double[] checkDimension(double[] embedding) {
        if (dimension <= 0) {
            dimension = embedding.length;
            log.info("Embedding dimension fixed at " + dimension + " by first response from " + model);
        } else if (embedding.length != dimension) {
            throw new LinkerException("Model " + model + " returned " + embedding.length
                    + " dimensions, expected " + dimension);
        }
        return embedding;
    }

    private double[] callEmbeddingApi(String text) {
        String endpoint = baseUrl + "embeddings";
        try {
            String requestBody = mapper.writeValueAsString(Map.of(
                    "model", model,
                    "input", text));

            HttpRequest.Builder request = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody));
            if (apiKey != null && !apiKey.isEmpty()) {
                request.header("Authorization", "Bearer " + apiKey);
            }

            HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new LinkerException("Embedding API returned " + response.statusCode() + ": " + response.body());
            }
            return parseEmbedding(response.body());
        } catch (IOException e) {
            throw new LinkerException("Embedding API call to " + endpoint + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LinkerException("Interrupted while calling embedding API", e);
        }
    }

    static double[] parseEmbedding(String body) throws IOException {
        JsonNode root = mapper.readTree(body);
        JsonNode embeddingArray = root.path("data").path(0).path("embedding");

        if (embeddingArray.isMissingNode() || !embeddingArray.isArray() || embeddingArray.size() == 0) {
            throw new LinkerException("Unexpected embedding response structure");
        }

        double[] embedding = new double[embeddingArray.size()];
        for (int i = 0; i < embeddingArray.size(); i++) {
            embedding[i] = embeddingArray.get(i).asDouble();
        }
        return embedding;
    }

    /**
     * Returns the number of cached embeddings (useful for diagnostics).
     */
    public int getCacheSize() {
        return embeddingCache.size();
    }

    @Override
    public int getDimension() {
        return dimension;
    }

    @Override
    public String getName() {
        return "OpenAI-compatible (" + model + " via " + baseUrl + ")";
    }
}
