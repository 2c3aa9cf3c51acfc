package com.errlens.core.assembler;

import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.ExtractionMetadata;
import com.errlens.core.model.FormattedError;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Turns the records found by a parser into a bounded {@link ErrorExtractorResult}.
 *
 * <p>Responsibilities shared by every extractor:
 * <ul>
 *   <li>cap the returned list at {@link ErrorExtractorResult#MAX_ERRORS} while keeping the true count</li>
 *   <li>compute completeness from location coverage</li>
 *   <li>render the clean and numbered digests</li>
 * </ul>
 *
 * <p>Ordering always follows discovery order of the input list.
 */
public final class ResultAssembler {

    private ResultAssembler() {
        // Utility class
    }

    /**
     * Creates a result without errors and with full confidence.
     *
     * @param summary summary text
     * @return empty result
     */
    public static ErrorExtractorResult empty(String summary) {
        return empty(summary, 100, List.of());
    }

    public static ErrorExtractorResult empty(String summary, int confidence, List<String> issues) {
        return new ErrorExtractorResult(List.of(), 0, summary, null, null,
            ExtractionMetadata.of(confidence, 100, issues));
    }

    /**
     * Builds a result from all discovered errors, capping the returned list.
     *
     * @param all every error found, in discovery order
     * @param summary summary text
     * @param guidance guidance text, blank values are dropped
     * @param errorSummary digest text, blank values are dropped
     * @param metadata quality metadata
     * @return bounded result
     */
    public static ErrorExtractorResult build(
            List<FormattedError> all,
            String summary,
            String guidance,
            String errorSummary,
            ExtractionMetadata metadata) {
        return new ErrorExtractorResult(cap(all), all.size(), summary, blankToNull(guidance),
            blankToNull(errorSummary), metadata);
    }

    /**
     * Assembles the standard test-runner result.
     *
     * @param failures parsed failures, in discovery order
     * @param baseConfidence extraction confidence when failures exist
     * @param issues extraction caveats
     * @return bounded result with summary {@code "N test(s) failed"}
     */
    public static ErrorExtractorResult fromTestFailures(List<TestFailure> failures, int baseConfidence, List<String> issues) {
        if (failures.isEmpty()) {
            return empty("0 test(s) failed", 100, issues);
        }

        List<FormattedError> errors = new ArrayList<>(failures.size());
        for (TestFailure failure : failures) {
            errors.add(toFormattedError(failure));
        }

        List<FormattedError> capped = cap(errors);
        return new ErrorExtractorResult(
            capped,
            failures.size(),
            failures.size() + " test(s) failed",
            blankToNull(GuidancePatterns.generate(failures)),
            blankToNull(formatCleanOutput(capped)),
            ExtractionMetadata.of(baseConfidence, completeness(errors), issues)
        );
    }

    /**
     * Converts a test failure, filling {@code unknown} file and {@code Test failed} message defaults.
     *
     * @param failure parsed failure
     * @return formatted error
     */
    public static FormattedError toFormattedError(TestFailure failure) {
        String file = failure.file() != null && !failure.file().isBlank() ? failure.file() : "unknown";
        String message = failure.message() != null && !failure.message().isBlank() ? failure.message() : "Test failed";
        return FormattedError.at(file, failure.line(), failure.column(), message)
            .withContext(blankToNull(failure.testName()))
            .withGuidance(blankToNull(failure.guidance()));
    }

    /**
     * Returns at most {@link ErrorExtractorResult#MAX_ERRORS} leading entries.
     *
     * @param items full list
     * @param <T> element type
     * @return immutable capped copy
     */
    public static <T> List<T> cap(List<T> items) {
        if (items.size() <= ErrorExtractorResult.MAX_ERRORS) {
            return List.copyOf(items);
        }
        return List.copyOf(items.subList(0, ErrorExtractorResult.MAX_ERRORS));
    }

    /**
     * Percentage of errors carrying a known file, a line and a message.
     *
     * @param errors errors to inspect
     * @return completeness 0-100, 100 for an empty list
     */
    public static int completeness(List<FormattedError> errors) {
        if (errors.isEmpty()) {
            return 100;
        }
        long complete = errors.stream()
            .filter(e -> e.file() != null && !"unknown".equals(e.file()) && e.line() != null && !e.message().isBlank())
            .count();
        return (int) Math.round(complete * 100.0 / errors.size());
    }

    /**
     * Renders {@code file:line: message (context)} lines.
     *
     * @param errors errors to render
     * @return digest, empty for no errors
     */
    public static String formatCleanOutput(List<FormattedError> errors) {
        List<String> lines = new ArrayList<>(errors.size());
        for (FormattedError error : errors) {
            String file = error.file() != null ? error.file() : "unknown";
            String location = error.line() != null ? file + ":" + error.line() : file;
            String context = error.context() != null && !error.context().isBlank() ? " (" + error.context() + ")" : "";
            lines.add(location + ": " + error.message() + context);
        }
        return String.join("\n", lines);
    }

    /**
     * Renders a numbered digest of the first {@link ErrorExtractorResult#MAX_ERRORS} items.
     *
     * <p>Each block starts with {@code [<label> i/N]} where N is the total item count.
     *
     * @param items all items
     * @param label block label, e.g. {@code "Test"}
     * @param body renders the text following the label for one item
     * @param <T> item type
     * @return digest with blocks separated by a blank line
     */
    public static <T> String numberedDigest(List<T> items, String label, Function<T, String> body) {
        List<String> blocks = new ArrayList<>();
        List<T> capped = cap(items);
        for (int i = 0; i < capped.size(); i++) {
            blocks.add("[" + label + " " + (i + 1) + "/" + items.size() + "] " + body.apply(capped.get(i)));
        }
        return String.join("\n\n", blocks);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
