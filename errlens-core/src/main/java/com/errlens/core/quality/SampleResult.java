package com.errlens.core.quality;

import java.util.List;

/**
 * Outcome of running one extractor sample.
 *
 * @param extractor extractor the sample belongs to
 * @param sample sample name
 * @param expectedErrors expected {@code totalErrors}
 * @param actualErrors {@code totalErrors} the extractor reported
 * @param missingPatterns expected substrings absent from the rendered result
 * @param score combined score between 0 and 1
 * @param routedTo extractor the router picked for the sample input
 * @param error failure message when extraction itself threw, otherwise null
 */
public record SampleResult(
    String extractor,
    String sample,
    int expectedErrors,
    int actualErrors,
    List<String> missingPatterns,
    double score,
    String routedTo,
    String error
) {
    /**
     * Minimum score for a sample to pass.
     */
    public static final double PASS_SCORE = 0.8;

    public SampleResult {
        missingPatterns = missingPatterns != null ? List.copyOf(missingPatterns) : List.of();
    }

    public boolean exactCount() {
        return expectedErrors == actualErrors;
    }

    public boolean routedCorrectly() {
        return extractor.equals(routedTo);
    }

    /**
     * A sample passes with an exact count, a score of at least {@link #PASS_SCORE}
     * and routing to its own extractor.
     *
     * @return true if the sample passes
     */
    public boolean passed() {
        return error == null && exactCount() && score >= PASS_SCORE && routedCorrectly();
    }
}
