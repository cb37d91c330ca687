package io.github.vishalmysore.chasm.query;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * An insight joined with the name of its subject and the url of its source,
 * ready for reporting.
 */
@Value
@Builder
public class ResolvedInsight {
    String id;
    String summary;
    double sentiment;
    List<String> tags;
    Instant dateAdded;
    String componentName;
    String sourceUrl;
}
