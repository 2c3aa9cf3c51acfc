package com.errlens.core.extractor;

/**
 * Cheap test deciding whether an extractor is worth running on some output.
 *
 * <p>Pre-filters are plain substring checks evaluated before any regular
 * expression, so a registry of many extractors stays fast on large logs.
 * They compose via {@link #and(OutputPrefilter)}.</p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * OutputPrefilter filter =
 *     Prefilters.containsAll(List.of("[ERROR]", "Tests run:"))
 *         .and(Prefilters.containsNone(List.of("<testsuite")));
 *
 * if (filter.test(output)) {
 *     // run detect()
 * }
 * }</pre>
 *
 * @see Prefilters
 */
@FunctionalInterface
public interface OutputPrefilter {

    /**
     * Checks whether the output may belong to the extractor's format.
     *
     * @param output ANSI-free tool output
     * @return {@code true} if detection should run
     */
    boolean test(String output);

    default OutputPrefilter and(OutputPrefilter other) {
        return output -> this.test(output) && other.test(output);
    }
}
