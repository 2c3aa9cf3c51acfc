package com.errlens.cli;

import com.errlens.core.ExtractionEngine;
import com.errlens.core.config.ConfigLoader;
import com.errlens.core.extractor.ExtractorHints;
import com.errlens.core.extractor.ExtractorMetadata;
import com.errlens.core.extractor.ExtractorPlugin;
import com.errlens.core.router.ExtractorRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list registered extractors in evaluation order.
 *
 * <p>Built-in extractors are discovered via Java Service Provider Interface (SPI);
 * third-party plugins come from the configured plugin directory.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * errlens list
 * }</pre>
 */
@Command(
    name = "list",
    description = "List registered extractors in evaluation order",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: errlens.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        ExtractorRegistry registry = ExtractionEngine.create(ConfigLoader.load(configPath)).registry();
        PrintWriter out = spec.commandLine().getOut();

        out.println("Registered Extractors:");
        out.println();
        for (ExtractorPlugin extractor : registry.extractors()) {
            ExtractorMetadata metadata = extractor.getMetadata();
            boolean fallback = extractor == registry.fallback();
            out.printf("  • %s (v%s)%s%n", metadata.name(), metadata.version(), fallback ? " [fallback]" : "");
            out.printf("    %s%n", metadata.description());
            out.printf("    Priority: %d, Threshold: %s%n", extractor.getPriority(),
                fallback ? "-" : String.valueOf(extractor.getDetectionThreshold()));
            if (!metadata.tags().isEmpty()) {
                out.printf("    Tags: %s%n", String.join(", ", metadata.tags()));
            }
            String hints = describe(extractor.getHints());
            if (!hints.isEmpty()) {
                out.printf("    Hints: %s%n", hints);
            }
            out.println();
        }
        out.printf("%d extractor(s)%n", registry.size());
        out.flush();
        return 0;
    }

    private static String describe(ExtractorHints hints) {
        List<String> parts = new ArrayList<>();
        if (!hints.required().isEmpty()) {
            parts.add("requires " + hints.required());
        }
        if (!hints.anyOf().isEmpty()) {
            parts.add("any of " + hints.anyOf());
        }
        if (!hints.forbidden().isEmpty()) {
            parts.add("none of " + hints.forbidden());
        }
        return String.join("; ", parts);
    }
}
