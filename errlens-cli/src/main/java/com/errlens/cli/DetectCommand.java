package com.errlens.cli;

import com.errlens.core.ExtractionEngine;
import com.errlens.core.config.ConfigLoader;
import com.errlens.core.router.CandidateReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to show how every extractor scores a piece of output.
 *
 * <p>Useful when output routes to an unexpected extractor: the table shows
 * each candidate's hint verdict, detection confidence and threshold in
 * evaluation order, and marks the one that was selected.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * errlens detect build.log
 * }</pre>
 */
@Command(
    name = "detect",
    description = "Show detection scores of every extractor for the given output",
    mixinStandardHelpOptions = true
)
public class DetectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DetectCommand.class);

    private static final String ROW = "%-3s %-18s %8s %9s %5s %10s  %s%n";

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
        names = {"-c", "--config"},
        description = "Configuration file (default: errlens.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        String output;
        try {
            output = InputReader.read(input);
        } catch (IOException e) {
            log.error("Cannot read input: {}", e.getMessage());
            return 1;
        }

        ExtractionEngine engine = ExtractionEngine.create(ConfigLoader.load(configPath));
        List<CandidateReport> reports = engine.diagnose(output);

        PrintWriter out = spec.commandLine().getOut();
        out.printf(ROW, "", "EXTRACTOR", "PRIORITY", "THRESHOLD", "HINTS", "CONFIDENCE", "REASON");
        for (CandidateReport report : reports) {
            out.printf(ROW,
                report.selected() ? "=>" : "",
                report.extractor(),
                report.priority(),
                report.threshold(),
                report.hintsMatched() ? "yes" : "no",
                report.detection().confidence(),
                report.detection().reason());
        }
        reports.stream().filter(CandidateReport::selected).findFirst()
            .ifPresent(selected -> out.printf("%nSelected: %s%n", selected.extractor()));
        out.flush();
        return 0;
    }
}
