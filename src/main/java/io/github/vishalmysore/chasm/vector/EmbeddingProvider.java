package io.github.vishalmysore.chasm.vector;

/**
 * Strategy interface for turning text into a fixed-length dense vector.
 * Allows swapping between a remote embedding model and the local
 * {@link HashingEmbeddingProvider}.
 *
 * Implementations must return vectors of the same length for every input, and
 * equal vectors for equal text, so that cosine scores are comparable across calls.
 */
public interface EmbeddingProvider {

    /**
     * Embed a single piece of text.
     *
     * @throws io.github.vishalmysore.chasm.exception.LinkerException if no vector could be produced
     */
    double[] embed(String text);

    /**
     * Length of every vector this provider returns.
     */
    int getDimension();

    /**
     * Descriptive name of this provider (for logging/reporting).
     */
    String getName();
}
