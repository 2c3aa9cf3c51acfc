package com.errlens.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * Bounded, structured description of what failed in one blob of tool output.
 *
 * <p>{@code errors} never holds more than {@link #MAX_ERRORS} entries while
 * {@code totalErrors} keeps the true count found before truncation. Callers that
 * display fewer entries still rely on {@code totalErrors} being accurate.
 *
 * @param errors capped list of records, in discovery order
 * @param totalErrors true number of records before truncation
 * @param summary short summary such as {@code "3 test failure(s)"}
 * @param guidance remediation text, may be null
 * @param errorSummary pre-formatted digest of the capped records, may be null
 * @param metadata extraction quality metadata
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorExtractorResult(
    List<FormattedError> errors,
    int totalErrors,
    String summary,
    String guidance,
    String errorSummary,
    ExtractionMetadata metadata
) {
    /**
     * Maximum number of records carried in {@link #errors()}.
     */
    public static final int MAX_ERRORS = 10;

    public ErrorExtractorResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        Objects.requireNonNull(summary, "summary must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
        if (totalErrors < 0) {
            throw new IllegalArgumentException("totalErrors must not be negative: " + totalErrors);
        }
        if (errors.size() > MAX_ERRORS) {
            throw new IllegalArgumentException("errors exceeds MAX_ERRORS: " + errors.size());
        }
        if (errors.size() > totalErrors) {
            throw new IllegalArgumentException(
                "errors (" + errors.size() + ") exceeds totalErrors (" + totalErrors + ")");
        }
        if (totalErrors > 0 && errors.isEmpty()) {
            throw new IllegalArgumentException("totalErrors is " + totalErrors + " but errors is empty");
        }
    }

    /**
     * Returns a copy with replaced metadata.
     *
     * @param newMetadata metadata to attach
     * @return new result
     */
    public ErrorExtractorResult withMetadata(ExtractionMetadata newMetadata) {
        return new ErrorExtractorResult(errors, totalErrors, summary, guidance, errorSummary, newMetadata);
    }

    /**
     * Returns a copy whose {@code errors} list is cut to {@code limit} entries.
     * {@code totalErrors} is left untouched.
     *
     * @param limit maximum entries to keep (at least 1 when errors exist)
     * @return truncated copy
     */
    public ErrorExtractorResult limitErrors(int limit) {
        int keep = Math.max(1, limit);
        if (errors.size() <= keep) {
            return this;
        }
        return new ErrorExtractorResult(errors.subList(0, keep), totalErrors, summary, guidance, errorSummary, metadata);
    }

    public boolean hasErrors() {
        return totalErrors > 0;
    }
}
