package com.errlens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Records which extractor handled the output and why.
 *
 * @param extractor extractor name
 * @param confidence detection confidence (0-100)
 * @param patterns labels of the patterns that matched
 * @param reason human-readable explanation
 */
public record DetectionMetadata(
    String extractor,
    int confidence,
    List<String> patterns,
    String reason
) {
    public DetectionMetadata {
        Objects.requireNonNull(extractor, "extractor must not be null");
        patterns = patterns != null ? List.copyOf(patterns) : List.of();
        reason = reason != null ? reason : "";
    }
}
