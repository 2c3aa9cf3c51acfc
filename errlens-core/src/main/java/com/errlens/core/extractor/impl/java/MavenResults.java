package com.errlens.core.extractor.impl.java;

import com.errlens.core.assembler.ResultAssembler;
import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.model.DetectionMetadata;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.ExtractionMetadata;
import com.errlens.core.model.FormattedError;

import java.util.List;

/**
 * Result helpers shared by the Maven extractors.
 *
 * <p>Maven output is scored rather than matched, so every Maven result carries
 * its own detection metadata; the router keeps it as is.
 */
final class MavenResults {

    /**
     * Scores below this value mean the output is not from the plugin at all.
     */
    static final int MINIMUM_SCORE = 40;

    private MavenResults() {
        // Utility class
    }

    static String reason(int score, String detected, String possible, String notDetected) {
        if (score >= 70) {
            return detected;
        }
        return score >= MINIMUM_SCORE ? possible : notDetected;
    }

    static DetectionMetadata detection(String extractor, int score, List<String> patterns, String reason) {
        return new DetectionMetadata(extractor, Math.min(score, 100), patterns, reason);
    }

    /**
     * Result for output that scored below {@link #MINIMUM_SCORE}.
     *
     * @param kind plugin kind used in the summary, e.g. {@code "compiler"}
     * @param detection detection outcome that was too weak
     * @return empty result with summary {@code "Not Maven <kind> output"}
     */
    static ErrorExtractorResult lowConfidence(String kind, DetectionMetadata detection) {
        return ResultAssembler.empty("Not Maven " + kind + " output", detection.confidence(), List.of())
            .withMetadata(ExtractionMetadata.of(detection.confidence(), 100, List.of()).withDetection(detection));
    }

    static ErrorExtractorResult build(
            DetectionMetadata detection,
            List<FormattedError> errors,
            String summary,
            String guidance,
            String errorSummary,
            int confidence,
            int completeness,
            List<String> issues) {
        ExtractionMetadata metadata = ExtractionMetadata.of(confidence, completeness, issues).withDetection(detection);
        return ResultAssembler.build(errors, summary, guidance, errorSummary, metadata);
    }

    static DetectionResult toDetectionResult(DetectionMetadata detection) {
        if (detection.confidence() < MINIMUM_SCORE) {
            return DetectionResult.none();
        }
        return DetectionResult.of(detection.confidence(), detection.patterns(), detection.reason());
    }

    /**
     * Renders {@code [<label> i/N] location\nmessage} blocks for the capped errors.
     */
    static String digest(List<FormattedError> errors, String label) {
        return ResultAssembler.numberedDigest(errors, label, e -> e.location() + "\n" + e.message());
    }
}
