package com.errlens;

import ch.qos.logback.classic.Level;
import com.errlens.cli.DetectCommand;
import com.errlens.cli.ExtractCommand;
import com.errlens.cli.ListCommand;
import com.errlens.cli.SamplesCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for errlens.
 *
 * <p>errlens reads the console output of a compiler, linter or test runner and
 * prints a short, structured description of what failed.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code extract} - Extract structured errors from tool output</li>
 *   <li>{@code detect} - Show how each extractor scores the output</li>
 *   <li>{@code list} - List registered extractors</li>
 *   <li>{@code samples} - Run every extractor against its built-in samples</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all log output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p>Log output goes to stderr, so stdout stays machine-readable.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Extract from a saved log
 * errlens extract build.log
 *
 * # Pipe test output straight in, as JSON
 * npm test 2>&1 | errlens extract --format json --context "npm test"
 *
 * # Why did the output route where it did?
 * errlens detect build.log
 * }</pre>
 */
@Command(
    name = "errlens",
    mixinStandardHelpOptions = true,
    version = "errlens 1.0.0-SNAPSHOT",
    description = "Structured error extraction from build, lint and test output",
    subcommands = {
        ExtractCommand.class,
        DetectCommand.class,
        ListCommand.class,
        SamplesCommand.class
    }
)
public class ErrLensCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all log output except errors")
    private boolean quiet;

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return ready-to-execute command line
     */
    public static CommandLine commandLine() {
        ErrLensCLI cli = new ErrLensCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
