package io.github.vishalmysore.chasm.vector;

import lombok.Value;

/**
 * Outcome of one semantic linking pass.
 */
@Value
public class LinkingResult {
    int edgesWritten;
    int insightsConsidered;
    int newInsights;
    long comparisons;
}
