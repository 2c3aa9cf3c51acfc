package com.errlens.core.extractor.impl.generic;

import com.errlens.core.assembler.ResultAssembler;
import com.errlens.core.extractor.DetectionConfidence;
import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.extractor.ExtractorHints;
import com.errlens.core.extractor.ExtractorSample;
import com.errlens.core.extractor.base.AbstractLineExtractor;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.ExtractionMetadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Fallback extractor for output no specific extractor recognizes.
 *
 * <p>It never produces records. Instead it keeps the lines most likely to
 * explain the failure (error keywords, {@code file:line} references and
 * summary lines) and drops package-manager noise, so the digest stays short.
 */
public class GenericExtractor extends AbstractLineExtractor {

    /**
     * Name of the extractor the router falls back to.
     */
    public static final String NAME = "generic";

    private static final int MAX_RELEVANT_LINES = 20;

    private static final List<String> ERROR_KEYWORDS = List.of(
        "failed", "fail", "error", "exception", "traceback", "assertionerror",
        "typeerror", "valueerror", "panic:", "fatal:", "syntaxerror", "referenceerror",
        "comparisonerror", "comparisonfailure", "arithmeticexception",
        "at ", "-->", "undefined:"
    );

    private static final List<String> SUMMARY_MARKERS = List.of(" failed", " passed", " error", " success", " example");

    private static final List<Pattern> NOISE = List.of(
        Pattern.compile("^>"),
        Pattern.compile("npm ERR!"),
        Pattern.compile("^npm WARN"),
        Pattern.compile("^warning:", Pattern.CASE_INSENSITIVE),
        Pattern.compile("node_modules"),
        Pattern.compile("^Download", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^Resolving packages", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^Already up[- ]to[- ]date", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^\\s*[\\[(]?\\d{1,3}%")
    );

    private static final Pattern FILE_LINE_REF =
        Pattern.compile("\\.(?:py|go|rs|rb|java|kt|cpp|c|h|js|mjs|cjs|ts|tsx|jsx):\\d+");

    private static final Pattern FAILURE_WORD = Pattern.compile(
        "\\b(?:error|fail(?:ed|ure)?|exception|traceback)\\b|panic:|fatal:", Pattern.CASE_INSENSITIVE);

    public GenericExtractor() {
        super(NAME, "Fallback extractor for unrecognized output formats", "generic", "fallback");
    }

    @Override
    public ExtractorHints getHints() {
        return ExtractorHints.none();
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    protected String getFailureUnit() {
        return "error";
    }

    @Override
    protected DetectionResult detectFormat(String output) {
        if (!matches(FAILURE_WORD, output)) {
            return DetectionResult.none();
        }
        return detected(DetectionConfidence.FALLBACK.score(), "Error keywords found, no specific format matched",
            List.of("no specific patterns"));
    }

    @Override
    protected ErrorExtractorResult emptyResult() {
        return ResultAssembler.empty("No errors detected");
    }

    @Override
    protected ErrorExtractorResult extractErrors(String output, String context) {
        List<String> lines = lines(output);
        List<String> relevant = new ArrayList<>();
        List<String> meaningful = new ArrayList<>();

        for (String line : lines) {
            if (line.isBlank() || isNoise(line)) {
                continue;
            }
            meaningful.add(line);
            if (isRelevant(line)) {
                relevant.add(line);
            }
        }

        boolean hasErrors = !relevant.isEmpty();
        List<String> digest = hasErrors ? relevant : meaningful;
        log.debug("Generic extraction kept {} of {} lines", Math.min(digest.size(), MAX_RELEVANT_LINES), lines.size());

        return ResultAssembler.build(
            List.of(),
            hasErrors ? "Command failed - see output" : "No errors detected",
            hasErrors ? "Review the output above and fix the errors" : null,
            String.join("\n", digest.subList(0, Math.min(digest.size(), MAX_RELEVANT_LINES))),
            ExtractionMetadata.of(50, 50, List.of())
        );
    }

    private boolean isNoise(String line) {
        return NOISE.stream().anyMatch(p -> p.matcher(line).find());
    }

    private boolean isRelevant(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        return ERROR_KEYWORDS.stream().anyMatch(lower::contains)
            || matches(FILE_LINE_REF, line)
            || SUMMARY_MARKERS.stream().anyMatch(lower::contains);
    }

    @Override
    public List<ExtractorSample> getSamples() {
        return List.of(
            new ExtractorSample(
                "go-test-failure",
                "Go test output, which has no dedicated extractor",
                """
                go: downloading github.com/stretchr/testify v1.9.0
                --- FAIL: TestParseConfig (0.00s)
                    config_test.go:27: expected port 8080, got 0
                FAIL
                FAIL\tgithub.com/acme/app/config\t0.012s
                """,
                0,
                List.of("Command failed - see output", "config_test.go:27: expected port 8080, got 0")),
            new ExtractorSample(
                "npm-noise-filtered",
                "Script failure surrounded by npm noise",
                """
                > app@1.0.0 build
                > node scripts/build.js

                Error: Cannot find module './routes'
                    at Module._resolveFilename (node:internal/modules/cjs/loader:1145:15)
                npm ERR! code 1
                npm ERR! path /home/ci/app
                """,
                0,
                List.of("Error: Cannot find module './routes'", "Review the output above"))
        );
    }
}
