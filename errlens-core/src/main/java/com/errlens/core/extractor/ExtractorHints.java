package com.errlens.core.extractor;

import java.util.List;

/**
 * Declarative substring hints checked before {@link ExtractorPlugin#detect(String)}.
 *
 * <p>All {@code required} strings must appear, at least one {@code anyOf} string
 * must appear (when the list is non-empty) and no {@code forbidden} string may appear.
 *
 * @param required substrings that must all be present
 * @param anyOf substrings of which at least one must be present
 * @param forbidden substrings that must not be present
 */
public record ExtractorHints(
    List<String> required,
    List<String> anyOf,
    List<String> forbidden
) {
    private static final ExtractorHints NONE = new ExtractorHints(List.of(), List.of(), List.of());

    public ExtractorHints {
        required = required != null ? List.copyOf(required) : List.of();
        anyOf = anyOf != null ? List.copyOf(anyOf) : List.of();
        forbidden = forbidden != null ? List.copyOf(forbidden) : List.of();
    }

    /**
     * Hints that accept all output.
     *
     * @return empty hints
     */
    public static ExtractorHints none() {
        return NONE;
    }

    public static ExtractorHints required(String... markers) {
        return new ExtractorHints(List.of(markers), List.of(), List.of());
    }

    public static ExtractorHints anyOf(String... markers) {
        return new ExtractorHints(List.of(), List.of(markers), List.of());
    }

    public ExtractorHints withAnyOf(String... markers) {
        return new ExtractorHints(required, List.of(markers), forbidden);
    }

    public ExtractorHints withForbidden(String... markers) {
        return new ExtractorHints(required, anyOf, List.of(markers));
    }

    /**
     * Composes the three lists into a single pre-filter.
     *
     * @return pre-filter equivalent to these hints
     */
    public OutputPrefilter toPrefilter() {
        return Prefilters.containsAll(required)
            .and(Prefilters.containsAny(anyOf))
            .and(Prefilters.containsNone(forbidden));
    }

    /**
     * Evaluates the hints against output; {@code null} output never matches non-empty hints.
     *
     * @param output ANSI-free tool output
     * @return {@code true} if detection should run
     */
    public boolean matches(String output) {
        if (output == null) {
            return required.isEmpty() && anyOf.isEmpty();
        }
        return toPrefilter().test(output);
    }

    public boolean isEmpty() {
        return required.isEmpty() && anyOf.isEmpty() && forbidden.isEmpty();
    }
}
