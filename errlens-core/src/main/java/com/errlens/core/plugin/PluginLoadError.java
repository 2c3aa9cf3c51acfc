package com.errlens.core.plugin;

/**
 * A plugin that could not be registered.
 *
 * @param source jar or class the plugin came from
 * @param message why it was rejected
 */
public record PluginLoadError(String source, String message) {
}
