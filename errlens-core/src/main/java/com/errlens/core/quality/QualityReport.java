package com.errlens.core.quality;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sample results aggregated per extractor and overall.
 *
 * @param results every sample result, grouped by extractor in registry order
 */
public record QualityReport(List<SampleResult> results) {

    public QualityReport {
        results = results != null ? List.copyOf(results) : List.of();
    }

    /**
     * Aggregate of one extractor's samples.
     *
     * @param extractor extractor name
     * @param averageScore mean sample score, 0 when the extractor has no samples
     * @param passed number of passing samples
     * @param total number of samples
     * @param failing names of failing samples
     */
    public record ExtractorScore(String extractor, double averageScore, int passed, int total, List<String> failing) {
    }

    /**
     * Groups results by extractor.
     *
     * @return scores in the order extractors first appear
     */
    public List<ExtractorScore> byExtractor() {
        Map<String, List<SampleResult>> grouped = new LinkedHashMap<>();
        for (SampleResult result : results) {
            grouped.computeIfAbsent(result.extractor(), key -> new ArrayList<>()).add(result);
        }

        List<ExtractorScore> scores = new ArrayList<>();
        grouped.forEach((extractor, samples) -> {
            double average = samples.stream().mapToDouble(SampleResult::score).average().orElse(0);
            List<String> failing = samples.stream().filter(s -> !s.passed()).map(SampleResult::sample).toList();
            scores.add(new ExtractorScore(extractor, average, samples.size() - failing.size(), samples.size(), failing));
        });
        return scores;
    }

    public double averageScore() {
        return results.stream().mapToDouble(SampleResult::score).average().orElse(0);
    }

    public long passedCount() {
        return results.stream().filter(SampleResult::passed).count();
    }

    public List<SampleResult> failures() {
        return results.stream().filter(r -> !r.passed()).toList();
    }

    public boolean allPassed() {
        return failures().isEmpty();
    }
}
