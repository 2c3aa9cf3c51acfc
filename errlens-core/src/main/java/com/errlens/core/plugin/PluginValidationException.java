package com.errlens.core.plugin;

/**
 * Thrown when a third-party extractor does not satisfy the plugin contract.
 */
public class PluginValidationException extends Exception {

    private final String source;

    public PluginValidationException(String message, String source) {
        super(message);
        this.source = source;
    }

    /**
     * Returns where the plugin came from, typically the jar file name.
     *
     * @return plugin source
     */
    public String getSource() {
        return source;
    }
}
