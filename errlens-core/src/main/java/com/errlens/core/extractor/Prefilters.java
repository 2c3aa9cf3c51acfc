package com.errlens.core.extractor;

import java.util.List;

/**
 * Factory for common substring pre-filters.
 *
 * @see OutputPrefilter
 */
public final class Prefilters {

    private Prefilters() {
        // Utility class - prevent instantiation
    }

    /**
     * Accepts output containing every given substring. An empty list accepts everything.
     *
     * @param markers required substrings
     * @return filter
     */
    public static OutputPrefilter containsAll(List<String> markers) {
        List<String> copy = List.copyOf(markers);
        return output -> copy.stream().allMatch(output::contains);
    }

    /**
     * Accepts output containing at least one of the given substrings. An empty list accepts everything.
     *
     * @param markers candidate substrings
     * @return filter
     */
    public static OutputPrefilter containsAny(List<String> markers) {
        List<String> copy = List.copyOf(markers);
        return output -> copy.isEmpty() || copy.stream().anyMatch(output::contains);
    }

    /**
     * Accepts output containing none of the given substrings.
     *
     * @param markers forbidden substrings
     * @return filter
     */
    public static OutputPrefilter containsNone(List<String> markers) {
        List<String> copy = List.copyOf(markers);
        return output -> copy.stream().noneMatch(output::contains);
    }
}
