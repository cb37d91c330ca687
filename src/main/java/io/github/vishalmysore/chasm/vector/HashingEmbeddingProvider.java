package io.github.vishalmysore.chasm.vector;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.zip.CRC32;

/**
 * Zero-dependency embedding provider: lower-cased tokens are hashed into a
 * fixed number of buckets and the resulting count vector is L2-normalised.
 * Captures lexical overlap only, not semantic relatedness.
 *
 * "battery overheats" vs "battery overheats quickly" scores high,
 * "battery overheats" vs "power cell gets hot" scores 0.0.
 *
 * Used when no embedding API is configured.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private final int dimension;

    public HashingEmbeddingProvider(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive, got " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public double[] embed(String text) {
        double[] vector = new double[dimension];
        if (text == null) {
            return vector;
        }
        Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(token -> !token.isEmpty())
                .forEach(token -> vector[bucket(token)] += 1.0);

        double norm = Math.sqrt(Arrays.stream(vector).map(v -> v * v).sum());
        if (norm > 0.0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] /= norm;
            }
        }
        return vector;
    }

    private int bucket(String token) {
        CRC32 crc = new CRC32();
        crc.update(token.getBytes(StandardCharsets.UTF_8));
        return (int) (crc.getValue() % dimension);
    }

    @Override
    public int getDimension() {
        return dimension;
    }

    @Override
    public String getName() {
        return "Hashing (lexical, " + dimension + " buckets)";
    }
}
