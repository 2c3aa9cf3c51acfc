package com.errlens.cli;

import com.errlens.core.ExtractionEngine;
import com.errlens.core.config.ConfigLoader;
import com.errlens.core.quality.QualityReport;
import com.errlens.core.quality.SampleHarness;
import com.errlens.core.quality.SampleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to run every registered extractor against its own samples.
 *
 * <p>Exits with {@code 1} when any sample fails, so it can gate a build.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * errlens samples
 * }</pre>
 */
@Command(
    name = "samples",
    description = "Score every extractor against its built-in samples",
    mixinStandardHelpOptions = true
)
public class SamplesCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SamplesCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: errlens.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        ExtractionEngine engine = ExtractionEngine.create(ConfigLoader.load(configPath));
        QualityReport report = SampleHarness.run(engine.registry());
        PrintWriter out = spec.commandLine().getOut();

        out.printf("%-18s %6s %8s%n", "EXTRACTOR", "SCORE", "PASSED");
        for (QualityReport.ExtractorScore score : report.byExtractor()) {
            out.printf("%-18s %6.2f %8s%n", score.extractor(), score.averageScore(),
                score.passed() + "/" + score.total());
        }
        out.println();
        out.printf("Overall: %.2f, %d/%d sample(s) passed%n", report.averageScore(), report.passedCount(),
            report.results().size());

        if (report.allPassed()) {
            out.flush();
            return 0;
        }

        out.println();
        out.println("Failing samples:");
        for (SampleResult failure : report.failures()) {
            out.printf("  ✗ %s/%s: expected %d error(s), got %d, score %.2f%n", failure.extractor(),
                failure.sample(), failure.expectedErrors(), failure.actualErrors(), failure.score());
            if (!failure.routedCorrectly()) {
                out.printf("      routed to %s%n", failure.routedTo());
            }
            failure.missingPatterns().forEach(pattern -> out.printf("      missing: %s%n", pattern));
            if (failure.error() != null) {
                out.printf("      error: %s%n", failure.error());
            }
        }
        out.flush();
        log.error("{} sample(s) failed", report.failures().size());
        return 1;
    }
}
