package com.errlens.core;

import com.errlens.core.config.EngineConfig;
import com.errlens.core.extractor.ExtractorPlugin;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.plugin.PluginLoadError;
import com.errlens.core.plugin.PluginLoadResult;
import com.errlens.core.plugin.PluginLoader;
import com.errlens.core.router.AnsiStripper;
import com.errlens.core.router.CandidateReport;
import com.errlens.core.router.DetectionRouter;
import com.errlens.core.router.ExtractorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Entry point of the extraction engine.
 *
 * <p>Turns raw tool output into an {@link ErrorExtractorResult}: ANSI sequences
 * are stripped, the router picks an extractor, and the result is stamped with
 * detection metadata. Instances are immutable and safe to share across threads.
 *
 * <pre>{@code
 * ExtractionEngine engine = ExtractionEngine.create(ConfigLoader.load(Path.of("errlens.yaml")));
 * ErrorExtractorResult result = engine.extract("npm test", output);
 * }</pre>
 */
public class ExtractionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExtractionEngine.class);

    private final ExtractorRegistry registry;
    private final DetectionRouter router;
    private final List<PluginLoadError> pluginErrors;

    /**
     * Creates an engine over the built-in extractors only.
     */
    public ExtractionEngine() {
        this(ExtractorRegistry.builtIn());
    }

    /**
     * Creates an engine over the given registry.
     *
     * @param registry extractors taking part in routing
     */
    public ExtractionEngine(ExtractorRegistry registry) {
        this(registry, List.of());
    }

    private ExtractionEngine(ExtractorRegistry registry, List<PluginLoadError> pluginErrors) {
        this.registry = registry;
        this.router = new DetectionRouter(registry);
        this.pluginErrors = List.copyOf(pluginErrors);
    }

    /**
     * Creates an engine from configuration: built-in extractors, plugins from the
     * configured directory, minus disabled names.
     *
     * @param config engine configuration
     * @return configured engine
     */
    public static ExtractionEngine create(EngineConfig config) {
        List<ExtractorPlugin> extractors = new ArrayList<>(ExtractorRegistry.discoverBuiltIns());

        Set<String> builtInNames = new HashSet<>();
        extractors.forEach(extractor -> builtInNames.add(extractor.getMetadata().name()));
        PluginLoadResult plugins = PluginLoader.load(config.plugins(), builtInNames);
        extractors.addAll(plugins.plugins());

        return new ExtractionEngine(ExtractorRegistry.of(extractors, config.extractors()), plugins.errors());
    }

    /**
     * Extracts errors from raw tool output, choosing the extractor automatically.
     *
     * @param contextHint optional free text such as a step name or command, used in guidance
     * @param rawOutput raw output, may contain ANSI sequences or be null
     * @return extraction result with detection metadata
     */
    public ErrorExtractorResult extract(String contextHint, String rawOutput) {
        String output = AnsiStripper.strip(rawOutput);
        ErrorExtractorResult result = router.route(output, contextHint);
        log.debug("Extracted {} error(s) with {}", result.totalErrors(),
            result.metadata().detection() != null ? result.metadata().detection().extractor() : "unknown");
        return result;
    }

    /**
     * Extracts with a named extractor, bypassing routing.
     *
     * @param extractorName registered extractor name
     * @param contextHint optional context hint
     * @param rawOutput raw output
     * @return extraction result stamped with the named extractor's own detection
     * @throws IllegalArgumentException if no extractor has that name
     */
    public ErrorExtractorResult extractWith(String extractorName, String contextHint, String rawOutput) {
        ExtractorPlugin extractor = registry.find(extractorName)
            .orElseThrow(() -> new IllegalArgumentException("Unknown extractor: " + extractorName));
        String output = AnsiStripper.strip(rawOutput);
        return router.run(router.selectExplicit(extractor, output), output, contextHint);
    }

    /**
     * Evaluates every registered extractor against the output without extracting.
     *
     * @param rawOutput raw output
     * @return one report per extractor, in evaluation order
     */
    public List<CandidateReport> diagnose(String rawOutput) {
        return router.diagnose(AnsiStripper.strip(rawOutput));
    }

    public ExtractorRegistry registry() {
        return registry;
    }

    /**
     * Returns third-party plugins that were rejected while the engine was created.
     *
     * @return plugin load errors, empty when every plugin loaded
     */
    public List<PluginLoadError> pluginErrors() {
        return pluginErrors;
    }
}
