package com.errlens.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Quality metadata describing how well an extraction went.
 *
 * <p>{@code confidence} and {@code completeness} describe the <em>extraction</em>,
 * not the detection: a perfectly detected format can still yield records without
 * locations, which lowers completeness.
 *
 * @param confidence extraction confidence (0-100)
 * @param completeness share of records with file, line and message (0-100)
 * @param issues non-fatal extraction caveats
 * @param detection detection details, stamped by the router when absent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractionMetadata(
    int confidence,
    int completeness,
    List<String> issues,
    DetectionMetadata detection
) {
    public ExtractionMetadata {
        confidence = clamp(confidence);
        completeness = clamp(completeness);
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public static ExtractionMetadata of(int confidence, int completeness, List<String> issues) {
        return new ExtractionMetadata(confidence, completeness, issues, null);
    }

    public ExtractionMetadata withDetection(DetectionMetadata newDetection) {
        return new ExtractionMetadata(confidence, completeness, issues, newDetection);
    }

    /**
     * Returns a copy with one more issue appended.
     *
     * @param issue issue text
     * @return new metadata
     */
    public ExtractionMetadata withIssue(String issue) {
        List<String> merged = new ArrayList<>(issues);
        merged.add(issue);
        return new ExtractionMetadata(confidence, completeness, merged, detection);
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(100, value));
    }
}
