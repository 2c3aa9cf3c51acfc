package com.errlens.core.router;

import com.errlens.core.extractor.DetectionResult;

/**
 * How one extractor fared against a given output, for troubleshooting routing.
 *
 * @param extractor extractor name
 * @param priority evaluation priority
 * @param threshold acceptance threshold
 * @param hintsMatched whether the substring pre-filter let the output through
 * @param detection detection outcome, {@link DetectionResult#none()} when hints rejected the output
 * @param selected whether the router picked this extractor
 */
public record CandidateReport(
    String extractor,
    int priority,
    int threshold,
    boolean hintsMatched,
    DetectionResult detection,
    boolean selected
) {
    /**
     * Whether the detection confidence reaches the extractor's own threshold.
     *
     * @return true if this extractor would qualify
     */
    public boolean qualifies() {
        return hintsMatched && detection.confidence() >= threshold;
    }
}
