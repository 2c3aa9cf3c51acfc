package com.errlens.cli;

import com.errlens.core.ExtractionEngine;
import com.errlens.core.config.ConfigLoader;
import com.errlens.core.config.EngineConfig;
import com.errlens.core.config.EngineConfig.OutputFormat;
import com.errlens.core.model.ErrorExtractorResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to extract structured errors from tool output.
 *
 * <p>The output is routed to the best-matching extractor unless one is named
 * with {@code --extractor}. At most {@code output.maxDisplayErrors} records are
 * printed; {@code totalErrors} always reports the full count.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Extract from a file
 * errlens extract build.log
 *
 * # Extract from stdin with a known format, as JSON
 * npx tsc --noEmit | errlens extract -e typescript -f json
 * }</pre>
 */
@Command(
    name = "extract",
    description = "Extract structured errors from build, lint or test output",
    mixinStandardHelpOptions = true
)
public class ExtractCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExtractCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "Input file, or - for stdin (default: stdin)",
        defaultValue = InputReader.STDIN
    )
    private String input;

    @Option(
        names = {"-x", "--context"},
        description = "Context hint such as the step name or command, used in guidance"
    )
    private String context;

    @Option(
        names = {"-e", "--extractor"},
        description = "Use this extractor instead of detecting the format"
    )
    private String extractor;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (overrides config)"
    )
    private OutputFormat format;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: errlens.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        EngineConfig config = ConfigLoader.load(configPath);
        ExtractionEngine engine = ExtractionEngine.create(config);

        String output;
        try {
            output = InputReader.read(input);
        } catch (IOException e) {
            log.error("Cannot read input: {}", e.getMessage());
            log.debug("Input read failure", e);
            return 1;
        }

        ErrorExtractorResult result;
        if (extractor != null) {
            try {
                result = engine.extractWith(extractor, context, output);
            } catch (IllegalArgumentException e) {
                log.error("{}. Run 'errlens list' to see registered extractors", e.getMessage());
                return 1;
            }
        } else {
            result = engine.extract(context, output);
        }

        ErrorExtractorResult displayed = result.limitErrors(config.output().maxDisplayErrors());
        OutputFormat effectiveFormat = format != null ? format : config.output().format();
        try {
            spec.commandLine().getOut().println(ResultWriter.write(displayed, effectiveFormat).stripTrailing());
            spec.commandLine().getOut().flush();
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize result: {}", e.getMessage());
            log.debug("Serialization failure", e);
            return 1;
        }
        return 0;
    }
}
