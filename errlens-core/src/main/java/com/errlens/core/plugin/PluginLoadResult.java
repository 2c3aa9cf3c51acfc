package com.errlens.core.plugin;

import com.errlens.core.extractor.ExtractorPlugin;

import java.util.List;

/**
 * Outcome of loading a plugin directory.
 *
 * @param plugins extractors ready for registration, already wrapped according to the trust level
 * @param errors plugins that were rejected
 */
public record PluginLoadResult(List<ExtractorPlugin> plugins, List<PluginLoadError> errors) {

    public PluginLoadResult {
        plugins = plugins != null ? List.copyOf(plugins) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static PluginLoadResult empty() {
        return new PluginLoadResult(List.of(), List.of());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
