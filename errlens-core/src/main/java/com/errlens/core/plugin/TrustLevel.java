package com.errlens.core.plugin;

/**
 * How a third-party extractor plugin is run.
 */
public enum TrustLevel {
    /** Wrapped in a {@link SandboxedExtractor}: time-boxed, input-capped and result-checked. */
    SANDBOX,
    /** Registered as is, with the same standing as a built-in extractor. */
    FULL
}
