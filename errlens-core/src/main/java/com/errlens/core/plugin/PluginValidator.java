package com.errlens.core.plugin;

import com.errlens.core.extractor.ExtractorMetadata;
import com.errlens.core.extractor.ExtractorPlugin;

import java.util.List;
import java.util.Set;

/**
 * Checks that a third-party extractor satisfies the plugin contract before it is registered.
 *
 * <p>Rejected plugins are reported, never registered. Calls into the plugin that
 * throw are treated as a contract violation.
 */
public final class PluginValidator {

    private PluginValidator() {
        // Utility class
    }

    /**
     * Validates a plugin.
     *
     * @param plugin plugin to check
     * @param source where the plugin came from
     * @param registeredNames names already taken by built-in or earlier plugins
     * @throws PluginValidationException if the plugin violates the contract
     */
    public static void validate(ExtractorPlugin plugin, String source, Set<String> registeredNames)
            throws PluginValidationException {
        if (plugin == null) {
            throw new PluginValidationException("Plugin must not be null", source);
        }

        ExtractorMetadata metadata;
        int priority;
        List<?> samples;
        try {
            metadata = plugin.getMetadata();
            priority = plugin.getPriority();
            samples = plugin.getSamples();
        } catch (RuntimeException e) {
            throw new PluginValidationException("Plugin failed while describing itself: " + e.getMessage(), source);
        }

        if (metadata == null) {
            throw new PluginValidationException("Plugin missing required metadata", source);
        }
        if (isBlank(metadata.name())) {
            throw new PluginValidationException("Plugin metadata missing name", source);
        }
        if (isBlank(metadata.version())) {
            throw new PluginValidationException("Plugin metadata missing version", source);
        }
        if (isBlank(metadata.description())) {
            throw new PluginValidationException("Plugin metadata missing description", source);
        }
        if (priority < 0 || priority > 100) {
            throw new PluginValidationException("Priority must be between 0 and 100, was " + priority, source);
        }
        if (samples == null) {
            throw new PluginValidationException("Plugin missing required samples list", source);
        }
        if (registeredNames.contains(metadata.name())) {
            throw new PluginValidationException("Plugin name '" + metadata.name() + "' is already registered", source);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
