package com.errlens.core.extractor;

import com.errlens.core.assembler.ResultAssembler;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.ExtractionMetadata;
import com.errlens.core.model.FormattedError;

import java.util.List;
import java.util.function.Function;

/**
 * Configurable extractor for router, registry and plugin tests.
 */
public class StubExtractor implements ExtractorPlugin {

    private final ExtractorMetadata metadata;
    private final int priority;
    private final int threshold;
    private ExtractorHints hints = ExtractorHints.none();
    private Function<String, DetectionResult> detector = output -> DetectionResult.none();
    private Function<String, ErrorExtractorResult> extractor;
    private List<ExtractorSample> samples = List.of();

    public StubExtractor(String name, int priority, int threshold) {
        this.metadata = new ExtractorMetadata(name, "1.0.0", "tests", "Stub extractor " + name, List.of("stub"));
        this.priority = priority;
        this.threshold = threshold;
        this.extractor = output -> ResultAssembler.build(
            List.of(FormattedError.of(name + " error")), "1 " + name + " error", null, null,
            ExtractionMetadata.of(90, 0, List.of()));
    }

    /**
     * Detects with the given confidence whenever the output contains the marker.
     */
    public StubExtractor detecting(String marker, int confidence) {
        this.detector = output -> output.contains(marker)
            ? DetectionResult.of(confidence, List.of(marker), "found " + marker)
            : DetectionResult.none();
        return this;
    }

    public StubExtractor withDetector(Function<String, DetectionResult> newDetector) {
        this.detector = newDetector;
        return this;
    }

    public StubExtractor withExtractor(Function<String, ErrorExtractorResult> newExtractor) {
        this.extractor = newExtractor;
        return this;
    }

    public StubExtractor withHints(ExtractorHints newHints) {
        this.hints = newHints;
        return this;
    }

    public StubExtractor withSamples(List<ExtractorSample> newSamples) {
        this.samples = newSamples;
        return this;
    }

    @Override
    public ExtractorMetadata getMetadata() {
        return metadata;
    }

    @Override
    public ExtractorHints getHints() {
        return hints;
    }

    @Override
    public int getPriority() {
        return priority;
    }

    @Override
    public int getDetectionThreshold() {
        return threshold;
    }

    @Override
    public DetectionResult detect(String output) {
        return detector.apply(output);
    }

    @Override
    public ErrorExtractorResult extract(String output, String context) {
        return extractor.apply(output);
    }

    @Override
    public List<ExtractorSample> getSamples() {
        return samples;
    }
}
