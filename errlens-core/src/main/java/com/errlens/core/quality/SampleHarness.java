package com.errlens.core.quality;

import com.errlens.core.extractor.ExtractorPlugin;
import com.errlens.core.extractor.ExtractorSample;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.FormattedError;
import com.errlens.core.router.AnsiStripper;
import com.errlens.core.router.DetectionRouter;
import com.errlens.core.router.ExtractorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Offline quality check that runs every extractor against its own samples.
 *
 * <p>Each sample is scored on the direct {@code extract} call:
 * {@code 0.5 * countScore + 0.5 * patternScore}, where {@code countScore} is 1
 * for an exact {@code totalErrors} match (otherwise {@code min/max}) and
 * {@code patternScore} is the share of expected substrings found in the
 * rendered result. The sample input is then routed to check that the router
 * picks the sample's own extractor.
 */
public final class SampleHarness {

    private static final Logger log = LoggerFactory.getLogger(SampleHarness.class);

    private SampleHarness() {
        // Utility class
    }

    /**
     * Runs every sample of every registered extractor.
     *
     * @param registry extractors to evaluate, also used for routing
     * @return aggregated report
     */
    public static QualityReport run(ExtractorRegistry registry) {
        DetectionRouter router = new DetectionRouter(registry);
        List<SampleResult> results = new ArrayList<>();
        for (ExtractorPlugin extractor : registry.extractors()) {
            for (ExtractorSample sample : extractor.getSamples()) {
                SampleResult result = runSample(extractor, sample, router);
                log.debug("Sample {}/{}: score {} ({})", result.extractor(), result.sample(),
                    String.format("%.2f", result.score()), result.passed() ? "pass" : "FAIL");
                results.add(result);
            }
        }
        QualityReport report = new QualityReport(results);
        log.info("Ran {} sample(s): {} passed", results.size(), report.passedCount());
        return report;
    }

    static SampleResult runSample(ExtractorPlugin extractor, ExtractorSample sample, DetectionRouter router) {
        String name = extractor.getMetadata().name();
        String output = AnsiStripper.strip(sample.input());
        String routedTo = router.select(output).extractor().getMetadata().name();

        ErrorExtractorResult result;
        try {
            result = extractor.extract(output, null);
        } catch (RuntimeException e) {
            log.warn("Sample {}/{} threw: {}", name, sample.name(), e.getMessage());
            return new SampleResult(name, sample.name(), sample.expectedErrors(), 0, sample.expectedPatterns(), 0,
                routedTo, e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        String rendered = render(result);
        List<String> missing = sample.expectedPatterns().stream()
            .filter(pattern -> !rendered.contains(pattern))
            .toList();

        double score = 0.5 * countScore(sample.expectedErrors(), result.totalErrors())
            + 0.5 * patternScore(sample.expectedPatterns().size(), missing.size());
        return new SampleResult(name, sample.name(), sample.expectedErrors(), result.totalErrors(), missing, score,
            routedTo, null);
    }

    static double countScore(int expected, int actual) {
        if (expected == actual) {
            return 1.0;
        }
        return (double) Math.min(expected, actual) / Math.max(expected, actual);
    }

    static double patternScore(int expectedCount, int missingCount) {
        if (expectedCount == 0) {
            return 1.0;
        }
        return (double) (expectedCount - missingCount) / expectedCount;
    }

    /**
     * Flattens the human-facing parts of a result into one searchable string.
     */
    static String render(ErrorExtractorResult result) {
        StringBuilder text = new StringBuilder(result.summary());
        append(text, result.guidance());
        append(text, result.errorSummary());
        for (FormattedError error : result.errors()) {
            append(text, error.message());
            append(text, error.code());
            append(text, error.context());
        }
        return text.toString();
    }

    private static void append(StringBuilder text, String part) {
        if (part != null) {
            text.append('\n').append(part);
        }
    }
}
