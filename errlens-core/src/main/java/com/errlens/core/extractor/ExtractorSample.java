package com.errlens.core.extractor;

import java.util.List;
import java.util.Objects;

/**
 * Ground-truth fixture used by the quality harness; never consulted at runtime.
 *
 * @param name short sample identifier
 * @param description what the sample exercises
 * @param input raw tool output
 * @param expectedErrors expected {@code totalErrors}
 * @param expectedPatterns substrings expected somewhere in the rendered result
 */
public record ExtractorSample(
    String name,
    String description,
    String input,
    int expectedErrors,
    List<String> expectedPatterns
) {
    public ExtractorSample {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(input, "input must not be null");
        expectedPatterns = expectedPatterns != null ? List.copyOf(expectedPatterns) : List.of();
    }
}
