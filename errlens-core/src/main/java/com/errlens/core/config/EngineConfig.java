package com.errlens.core.config;

import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.plugin.TrustLevel;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration for the extraction engine.
 *
 * <p>Loaded from {@code errlens.yaml}. Every section is optional; missing
 * sections and fields fall back to the values of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * extractors:
 *   disabled: [tap]
 *
 * plugins:
 *   directory: errlens-plugins
 *   trust: sandbox
 *   timeoutMs: 5000
 *   maxInputChars: 5000000
 *
 * output:
 *   format: yaml
 *   maxDisplayErrors: 10
 * }</pre>
 *
 * @param extractors built-in extractor selection
 * @param plugins third-party plugin loading
 * @param output CLI output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
    @JsonProperty("extractors") ExtractorsConfig extractors,
    @JsonProperty("plugins") PluginConfig plugins,
    @JsonProperty("output") OutputConfig output
) {
    public EngineConfig {
        extractors = extractors != null ? extractors : ExtractorsConfig.defaults();
        plugins = plugins != null ? plugins : PluginConfig.defaults();
        output = output != null ? output : OutputConfig.defaults();
    }

    /**
     * Creates the default configuration: every extractor enabled, no plugin directory, YAML output.
     *
     * @return default configuration
     */
    public static EngineConfig defaults() {
        return new EngineConfig(ExtractorsConfig.defaults(), PluginConfig.defaults(), OutputConfig.defaults());
    }

    /**
     * Built-in extractor selection.
     *
     * @param disabled extractor names removed from routing
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExtractorsConfig(
        @JsonProperty("disabled") List<String> disabled
    ) {
        public ExtractorsConfig {
            disabled = disabled != null ? List.copyOf(disabled) : List.of();
        }

        public static ExtractorsConfig defaults() {
            return new ExtractorsConfig(List.of());
        }

        /**
         * Checks if an extractor takes part in routing.
         *
         * @param name extractor name
         * @return false when the name is listed as disabled
         */
        public boolean isEnabled(String name) {
            return !disabled.contains(name);
        }
    }

    /**
     * Third-party plugin loading.
     *
     * @param directory directory scanned for plugin jars, null to load none
     * @param trust how loaded plugins are run
     * @param timeoutMs per-call budget for sandboxed plugins
     * @param maxInputChars inputs longer than this are truncated before reaching a sandboxed plugin
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PluginConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("trust") TrustLevel trust,
        @JsonProperty("timeoutMs") Long timeoutMs,
        @JsonProperty("maxInputChars") Integer maxInputChars
    ) {
        public static final long DEFAULT_TIMEOUT_MS = 5_000L;
        public static final int DEFAULT_MAX_INPUT_CHARS = 5_000_000;

        public PluginConfig {
            trust = trust != null ? trust : TrustLevel.SANDBOX;
            timeoutMs = timeoutMs != null && timeoutMs > 0 ? timeoutMs : DEFAULT_TIMEOUT_MS;
            maxInputChars = maxInputChars != null && maxInputChars > 0 ? maxInputChars : DEFAULT_MAX_INPUT_CHARS;
        }

        public static PluginConfig defaults() {
            return new PluginConfig(null, TrustLevel.SANDBOX, DEFAULT_TIMEOUT_MS, DEFAULT_MAX_INPUT_CHARS);
        }
    }

    /**
     * Output format of the CLI.
     */
    public enum OutputFormat {
        YAML,
        JSON
    }

    /**
     * CLI output settings.
     *
     * @param format serialization format
     * @param maxDisplayErrors number of records printed, never above {@link ErrorExtractorResult#MAX_ERRORS}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("format") OutputFormat format,
        @JsonProperty("maxDisplayErrors") Integer maxDisplayErrors
    ) {
        public OutputConfig {
            format = format != null ? format : OutputFormat.YAML;
            if (maxDisplayErrors == null || maxDisplayErrors < 1 || maxDisplayErrors > ErrorExtractorResult.MAX_ERRORS) {
                maxDisplayErrors = ErrorExtractorResult.MAX_ERRORS;
            }
        }

        public static OutputConfig defaults() {
            return new OutputConfig(OutputFormat.YAML, ErrorExtractorResult.MAX_ERRORS);
        }
    }
}
