package com.errlens.core.extractor;

import com.errlens.core.model.ErrorExtractorResult;

import java.util.List;

/**
 * Contract implemented by every output-format extractor.
 *
 * <p>Extractors are discovered via Java Service Provider Interface (SPI). Each one
 * understands a single tool's console output (a compiler, linter or test runner)
 * and turns it into an {@link ErrorExtractorResult}.
 *
 * <p>The router evaluates extractors in descending {@link #getPriority()} order.
 * Before {@link #detect(String)} runs, the cheap substring {@link #getHints() hints}
 * are checked; candidates failing them are skipped without pattern matching.
 *
 * <p><b>Contract:</b>
 * <ul>
 *   <li>{@code detect} is total: it never throws, whatever the input</li>
 *   <li>{@code extract} should not throw; if it does, the router falls back to the generic
 *       extractor and reports the failure in {@code metadata.issues}</li>
 *   <li>both are side-effect free: no file system, process, network or reflection access</li>
 *   <li>no state is carried between calls, so instances are safe to share across threads</li>
 *   <li>{@code extract} does not depend on {@code detect} having been called first</li>
 * </ul>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.errlens.core.extractor.ExtractorPlugin}
 *
 * @see DetectionResult
 * @see ExtractorHints
 */
public interface ExtractorPlugin {

    /**
     * Returns static descriptive metadata.
     *
     * <p>{@link ExtractorMetadata#name()} is the unique, kebab-case identifier
     * used in configuration and in detection metadata (e.g., "vitest", "maven-surefire").
     *
     * @return extractor metadata
     */
    ExtractorMetadata getMetadata();

    /**
     * Returns the substring pre-filter evaluated before {@link #detect(String)}.
     *
     * <p>The default accepts every input.
     *
     * @return hints for this extractor
     */
    default ExtractorHints getHints() {
        return ExtractorHints.none();
    }

    /**
     * Returns evaluation priority.
     *
     * <p>Higher values are evaluated first. Distinctive, low-collision formats
     * (machine-readable reports, compiler codes) sit above generic wording
     * such as "N passing / N failing".
     *
     * @return priority between 0 and 100
     */
    int getPriority();

    /**
     * Returns the minimum detection confidence at which the router accepts this extractor.
     *
     * @return acceptance threshold (0-100)
     */
    default int getDetectionThreshold() {
        return 70;
    }

    /**
     * Estimates how likely the output was produced by this extractor's tool.
     *
     * <p>Returns {@link DetectionResult#none()} when the format does not match rather than guessing.
     *
     * @param output ANSI-free tool output
     * @return detection result
     */
    DetectionResult detect(String output);

    /**
     * Extracts structured errors from the output.
     *
     * <p>On empty or all-success input returns a result with no errors and a
     * {@code "0 <unit>(s) failed"} summary.
     *
     * @param output ANSI-free tool output
     * @param context optional free text (e.g., step name or command) used only in guidance
     * @return extraction result
     */
    ErrorExtractorResult extract(String output, String context);

    /**
     * Extracts without a context hint.
     *
     * @param output ANSI-free tool output
     * @return extraction result
     */
    default ErrorExtractorResult extract(String output) {
        return extract(output, null);
    }

    /**
     * Returns ground-truth samples used by the offline quality harness.
     *
     * @return samples, never null
     */
    default List<ExtractorSample> getSamples() {
        return List.of();
    }
}
