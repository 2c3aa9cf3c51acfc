package com.errlens.core.extractor.base;

import com.errlens.core.assembler.ResultAssembler;
import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.extractor.ExtractorMetadata;
import com.errlens.core.extractor.ExtractorPlugin;
import com.errlens.core.model.ErrorExtractorResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Abstract base class for built-in extractors providing common functionality.
 *
 * <p>This class reduces code duplication across extractor implementations by providing:
 * <ul>
 *   <li>Logger initialization (one logger per extractor class)</li>
 *   <li>Metadata construction from a name, description and tags</li>
 *   <li>{@code null}/blank input handling and a guard around detection exceptions</li>
 *   <li>Result creation helpers ({@link #emptyResult()}, {@link #detected(int, String, List)})</li>
 * </ul>
 *
 * <p>Concrete extractors implement {@link #detectFormat(String)} and
 * {@link #extractErrors(String, String)}; both only ever see non-blank input.
 *
 * @see ExtractorPlugin
 */
public abstract class AbstractExtractor implements ExtractorPlugin {

    protected static final String DEFAULT_VERSION = "1.0.0";
    protected static final String DEFAULT_AUTHOR = "errlens";

    /**
     * Logger instance for this extractor.
     * Automatically initialized with the concrete extractor class name.
     */
    protected final Logger log;

    private final ExtractorMetadata metadata;

    /**
     * Creates an extractor with default version and author.
     *
     * @param name unique kebab-case name
     * @param description one-line description
     * @param tags descriptive tags
     */
    protected AbstractExtractor(String name, String description, String... tags) {
        this.log = LoggerFactory.getLogger(getClass());
        this.metadata = new ExtractorMetadata(name, DEFAULT_VERSION, DEFAULT_AUTHOR, description, List.of(tags));
    }

    @Override
    public ExtractorMetadata getMetadata() {
        return metadata;
    }

    /**
     * Returns the extractor name.
     *
     * @return metadata name
     */
    protected String name() {
        return metadata.name();
    }

    /**
     * Returns the noun used in the empty summary, e.g. {@code "test"} in {@code "0 test(s) failed"}.
     *
     * @return failure unit
     */
    protected String getFailureUnit() {
        return "test";
    }

    @Override
    public final DetectionResult detect(String output) {
        if (output == null || output.isBlank()) {
            return DetectionResult.none();
        }
        try {
            return detectFormat(output);
        } catch (RuntimeException e) {
            log.warn("Detection failed in {}: {}", name(), e.getMessage());
            return DetectionResult.none();
        }
    }

    @Override
    public final ErrorExtractorResult extract(String output, String context) {
        if (output == null || output.isBlank()) {
            return emptyResult();
        }
        return extractErrors(output, context);
    }

    /**
     * Format-specific detection on non-blank input.
     *
     * @param output tool output
     * @return detection result
     */
    protected abstract DetectionResult detectFormat(String output);

    /**
     * Format-specific extraction on non-blank input.
     *
     * <p>Exceptions propagate to the caller; the router then reruns the output through
     * the generic fallback and records the failure as an issue.
     *
     * @param output tool output
     * @param context optional context hint, used only for guidance text
     * @return extraction result
     */
    protected abstract ErrorExtractorResult extractErrors(String output, String context);

    // ==================== Result Helpers ====================

    /**
     * Summary used when nothing failed.
     *
     * @return {@code "0 <unit>(s) failed"}
     */
    protected String emptySummary() {
        return "0 " + getFailureUnit() + "(s) failed";
    }

    /**
     * Creates the empty result for this extractor.
     *
     * @return result without errors
     */
    protected ErrorExtractorResult emptyResult() {
        return ResultAssembler.empty(emptySummary());
    }

    /**
     * Creates a detection result, or {@link DetectionResult#none()} for non-positive confidence.
     *
     * @param confidence 0-100
     * @param reason explanation
     * @param patterns matched pattern labels
     * @return detection result
     */
    protected DetectionResult detected(int confidence, String reason, List<String> patterns) {
        return DetectionResult.of(Math.min(100, confidence), patterns, reason);
    }
}
