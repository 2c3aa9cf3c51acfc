package com.errlens.core.router;

import com.errlens.core.assembler.ResultAssembler;
import com.errlens.core.extractor.DetectionConfidence;
import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.extractor.ExtractorPlugin;
import com.errlens.core.model.DetectionMetadata;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.ExtractionMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks the extractor for a blob of output and runs it.
 *
 * <p>Routing is a first-qualifying-match cascade. Candidates are evaluated in
 * registry order (descending priority); a candidate is skipped when its hints
 * reject the output, and selected as soon as its detection confidence reaches
 * its own threshold. Remaining candidates are not evaluated. When nothing
 * qualifies the generic fallback runs.
 *
 * <p>The router never throws for any input. An extractor that throws during
 * {@code extract} is replaced by the fallback and the failure recorded in
 * {@code metadata.issues}.
 */
public class DetectionRouter {

    private static final Logger log = LoggerFactory.getLogger(DetectionRouter.class);

    static final String FALLBACK_REASON = "No specific extractor matched, using generic fallback";

    private final ExtractorRegistry registry;

    public DetectionRouter(ExtractorRegistry registry) {
        this.registry = registry;
    }

    /**
     * Outcome of candidate selection.
     *
     * @param extractor selected extractor
     * @param detection detection metadata to stamp on the result
     */
    public record Selection(ExtractorPlugin extractor, DetectionMetadata detection) {
    }

    /**
     * Selects the extractor for ANSI-free output.
     *
     * @param output cleaned output
     * @return selected extractor, the fallback when no candidate qualifies
     */
    public Selection select(String output) {
        for (ExtractorPlugin candidate : registry.candidates()) {
            String name = candidate.getMetadata().name();
            if (!candidate.getHints().matches(output)) {
                log.debug("Skipping {}: hints did not match", name);
                continue;
            }
            DetectionResult detection = safeDetect(candidate, output);
            log.debug("Evaluated {}: confidence {} (threshold {})", name, detection.confidence(),
                candidate.getDetectionThreshold());
            if (detection.confidence() >= candidate.getDetectionThreshold() && detection.matched()) {
                return new Selection(candidate, toMetadata(name, detection));
            }
        }
        return fallbackSelection();
    }

    /**
     * Builds a selection for an extractor chosen by the caller, with detection
     * metadata from that extractor's own {@code detect}.
     *
     * @param extractor extractor to run
     * @param output cleaned output
     * @return selection for {@link #run(Selection, String, String)}
     */
    public Selection selectExplicit(ExtractorPlugin extractor, String output) {
        DetectionResult detection = safeDetect(extractor, output);
        return new Selection(extractor, toMetadata(extractor.getMetadata().name(), detection));
    }

    /**
     * Routes and extracts.
     *
     * @param output cleaned output
     * @param context optional context hint passed to the extractor
     * @return extraction result carrying detection metadata
     */
    public ErrorExtractorResult route(String output, String context) {
        Selection selection = select(output);
        log.debug("Selected extractor: {}", selection.extractor().getMetadata().name());
        return run(selection, output, context);
    }

    /**
     * Runs a selected extractor, falling back to the generic extractor if it throws.
     *
     * @param selection selected extractor and its detection
     * @param output cleaned output
     * @param context optional context hint
     * @return extraction result carrying detection metadata
     */
    public ErrorExtractorResult run(Selection selection, String output, String context) {
        ExtractorPlugin extractor = selection.extractor();
        try {
            return stamp(extractor.extract(output, context), selection.detection());
        } catch (RuntimeException e) {
            String name = extractor.getMetadata().name();
            log.warn("Extractor {} failed, falling back to {}: {}", name,
                registry.fallback().getMetadata().name(), e.getMessage());
            log.debug("Extractor failure details", e);

            String issue = "Extractor " + name + " failed: " + e.getMessage();
            Selection fallback = fallbackSelection();
            if (extractor == fallback.extractor()) {
                return ResultAssembler.empty("No errors detected", 0, List.of(issue))
                    .withMetadata(ExtractionMetadata.of(0, 0, List.of(issue)).withDetection(fallback.detection()));
            }
            ErrorExtractorResult result = run(fallback, output, context);
            return result.withMetadata(result.metadata().withIssue(issue));
        }
    }

    /**
     * Evaluates every registered extractor against the output without extracting.
     *
     * @param output cleaned output
     * @return one report per extractor, in evaluation order
     */
    public List<CandidateReport> diagnose(String output) {
        Selection selection = select(output);
        List<CandidateReport> reports = new ArrayList<>();
        for (ExtractorPlugin plugin : registry.extractors()) {
            boolean hints = plugin.getHints().matches(output);
            DetectionResult detection = hints ? safeDetect(plugin, output) : DetectionResult.none();
            reports.add(new CandidateReport(
                plugin.getMetadata().name(),
                plugin.getPriority(),
                plugin.getDetectionThreshold(),
                hints,
                detection,
                plugin == selection.extractor()
            ));
        }
        return reports;
    }

    private Selection fallbackSelection() {
        ExtractorPlugin fallback = registry.fallback();
        DetectionMetadata detection = new DetectionMetadata(fallback.getMetadata().name(),
            DetectionConfidence.FALLBACK.score(), List.of("no specific patterns"), FALLBACK_REASON);
        return new Selection(fallback, detection);
    }

    private DetectionResult safeDetect(ExtractorPlugin plugin, String output) {
        try {
            DetectionResult result = plugin.detect(output);
            return result != null ? result : DetectionResult.none();
        } catch (RuntimeException e) {
            log.warn("Detection failed in {}: {}", plugin.getMetadata().name(), e.getMessage());
            return DetectionResult.none();
        }
    }

    /**
     * Adds detection metadata unless the extractor already provided its own.
     */
    static ErrorExtractorResult stamp(ErrorExtractorResult result, DetectionMetadata detection) {
        if (result.metadata().detection() != null) {
            return result;
        }
        return result.withMetadata(result.metadata().withDetection(detection));
    }

    static DetectionMetadata toMetadata(String extractor, DetectionResult detection) {
        return new DetectionMetadata(extractor, detection.confidence(), detection.patterns(), detection.reason());
    }
}
