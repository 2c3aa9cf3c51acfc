package com.errlens.core.extractor;

import java.util.List;

/**
 * Outcome of {@link ExtractorPlugin#detect(String)}.
 *
 * <p>Confidence 0 means "not this format" and always comes with no patterns.
 *
 * @param confidence 0-100, see {@link DetectionConfidence} for the rubric
 * @param patterns labels of matched patterns, in match order
 * @param reason human-readable explanation
 */
public record DetectionResult(
    int confidence,
    List<String> patterns,
    String reason
) {
    private static final DetectionResult NONE = new DetectionResult(0, List.of(), "");

    public DetectionResult {
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be between 0 and 100: " + confidence);
        }
        patterns = patterns != null ? List.copyOf(patterns) : List.of();
        reason = reason != null ? reason : "";
    }

    /**
     * Result for output that does not match.
     *
     * @return zero-confidence result
     */
    public static DetectionResult none() {
        return NONE;
    }

    public static DetectionResult of(int confidence, List<String> patterns, String reason) {
        return confidence <= 0 ? NONE : new DetectionResult(confidence, patterns, reason);
    }

    public static DetectionResult of(DetectionConfidence level, List<String> patterns, String reason) {
        return of(level.score(), patterns, reason);
    }

    public boolean matched() {
        return confidence > 0;
    }
}
