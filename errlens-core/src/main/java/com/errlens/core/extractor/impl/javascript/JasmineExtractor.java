package com.errlens.core.extractor.impl.javascript;

import com.errlens.core.assembler.ResultAssembler;
import com.errlens.core.assembler.TestFailure;
import com.errlens.core.extractor.DetectionConfidence;
import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.extractor.ExtractorHints;
import com.errlens.core.extractor.ExtractorSample;
import com.errlens.core.extractor.base.AbstractLineExtractor;
import com.errlens.core.extractor.base.ExtractorPatterns;
import com.errlens.core.extractor.base.StackLocation;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.ExtractionMetadata;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extractor for Jasmine's default console reporter.
 *
 * <p>Each entry of the {@code Failures:} section has a {@code Message:} block
 * and a {@code Stack:} block; the first {@code UserContext.<anonymous>} frame
 * (or any {@code (file.js:line:col)} frame) gives the location.
 */
public class JasmineExtractor extends AbstractLineExtractor {

    private static final int ENTRY_WINDOW = 30;
    private static final int STACK_WINDOW = 40;

    private static final Pattern ENTRY = Pattern.compile("^(\\d+)\\)\\s+(.+)$");
    private static final Pattern ENTRY_START = Pattern.compile("^\\d+\\)\\s+");
    private static final Pattern ANY_FRAME = Pattern.compile("\\(([^:)]+):(\\d+)(?::(\\d+))?\\)");

    private static final Pattern FAILURES_HEADER = Pattern.compile("^Failures:\\s*$", Pattern.MULTILINE);
    private static final Pattern ENTRY_MARKER = Pattern.compile("^\\d+\\)\\s+\\S", Pattern.MULTILINE);
    private static final Pattern FAILED_SUMMARY = Pattern.compile("\\d+ specs?, [1-9]\\d* failures?");

    public JasmineExtractor() {
        super("jasmine", "Extracts Jasmine test framework errors", "jasmine", "testing", "javascript");
    }

    @Override
    public ExtractorHints getHints() {
        return ExtractorHints.required("spec").withAnyOf("Failures:");
    }

    @Override
    public int getPriority() {
        return 85;
    }

    @Override
    public int getDetectionThreshold() {
        return 85;
    }

    @Override
    protected DetectionResult detectFormat(String output) {
        boolean failuresSection = matches(FAILURES_HEADER, output) && matches(ENTRY_MARKER, output);
        boolean failedSummary = matches(FAILED_SUMMARY, output);

        if (!failuresSection && !failedSummary) {
            return DetectionResult.none();
        }
        List<String> patterns = new ArrayList<>();
        if (failuresSection) {
            patterns.add("Failures: section with numbered entries");
        }
        if (failedSummary) {
            patterns.add("N specs, M failures summary");
        }
        return detected(DetectionConfidence.SINGLE_SIGNAL.score(), "Jasmine test framework output detected", patterns);
    }

    @Override
    protected ErrorExtractorResult extractErrors(String output, String context) {
        if (!output.contains("spec") && !output.contains("Failures:")) {
            return ResultAssembler.build(
                List.of(),
                "Unable to parse Jasmine output - invalid format",
                "Ensure the input is valid Jasmine test output",
                output.trim(),
                ExtractionMetadata.of(0, 0, List.of("Not Jasmine output format"))
            );
        }
        return ResultAssembler.fromTestFailures(parseFailures(lines(output)), 95, List.of());
    }

    private List<TestFailure> parseFailures(List<String> lines) {
        List<TestFailure> failures = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            Matcher entry = matchLine(ENTRY, lines.get(i));
            if (entry == null) {
                i++;
                continue;
            }

            String testName = entry.group(2).trim();
            String message = null;
            StackLocation location = null;

            int j = i + 1;
            while (j < lines.size() && j < i + ENTRY_WINDOW) {
                String trimmed = lines.get(j).trim();
                if (matches(ENTRY_START, lines.get(j))) {
                    break;
                }
                if ("Message:".equals(trimmed)) {
                    List<String> messageLines = new ArrayList<>();
                    j++;
                    while (j < lines.size() && !"Stack:".equals(lines.get(j).trim()) && !lines.get(j).isBlank()) {
                        messageLines.add(lines.get(j).trim());
                        j++;
                    }
                    message = String.join(" ", messageLines).trim();
                    continue;
                }
                if ("Stack:".equals(trimmed)) {
                    j++;
                    location = readStack(lines, i, j);
                    while (j < lines.size() && !lines.get(j).isBlank() && !matches(ENTRY_START, lines.get(j))) {
                        j++;
                    }
                    continue;
                }
                j++;
            }

            String errorType = ExtractorPatterns.extractErrorType(message).orElse(null);
            failures.add(new TestFailure(
                location != null ? location.file() : null,
                location != null ? location.line() : null,
                location != null ? location.column() : null,
                message,
                testName,
                errorType,
                null));
            i = j;
        }
        return failures;
    }

    private StackLocation readStack(List<String> lines, int entryStart, int stackStart) {
        for (int j = stackStart; j < lines.size() && j < entryStart + STACK_WINDOW; j++) {
            String line = lines.get(j);
            if (matches(ENTRY_START, line)) {
                break;
            }
            if (line.contains("UserContext.<anonymous>")) {
                StackLocation location = ExtractorPatterns.parseStackLocation(line,
                    List.of(ExtractorPatterns.CONTEXT_ANONYMOUS_FRAME)).orElse(null);
                if (location != null) {
                    return location;
                }
            }
            if (line.contains(" (") && line.contains(".js:")) {
                StackLocation location = ExtractorPatterns.parseStackLocation(line, List.of(ANY_FRAME)).orElse(null);
                if (location != null) {
                    return location;
                }
            }
        }
        return null;
    }

    @Override
    public List<ExtractorSample> getSamples() {
        return List.of(
            new ExtractorSample(
                "single-assertion-error",
                "Single Jasmine test failure with assertion error",
                """
                Started
                F

                Failures:
                1) Calculator Test Matrix Failure Type 1: Assertion Errors should match expected value
                  Message:
                    Expected 4 to equal 5.
                  Stack:
                        at <Jasmine>
                        at UserContext.<anonymous> (/private/tmp/jasmine-comprehensive.test.js:9:17)
                        at <Jasmine>

                1 spec, 1 failure
                Finished in 0.037 seconds
                """,
                1,
                List.of("Expected 4 to equal 5", "/private/tmp/jasmine-comprehensive.test.js:9")),
            new ExtractorSample(
                "multiple-test-failures",
                "Multiple Jasmine test failures with different error types",
                """
                Started
                FFF

                Failures:
                1) Suite > Test 1
                  Message:
                    Expected 1 to equal 2.
                  Stack:
                        at UserContext.<anonymous> (test.js:10:15)

                2) Suite > Test 2
                  Message:
                    TypeError: Cannot read properties of null
                  Stack:
                        at UserContext.<anonymous> (test.js:20:15)

                3) Suite > Test 3
                  Message:
                    Error: ENOENT: no such file or directory
                  Stack:
                        at UserContext.<anonymous> (test.js:30:15)

                3 specs, 3 failures
                """,
                3,
                List.of("Expected 1 to equal 2", "TypeError", "ENOENT", "Verify file paths"))
        );
    }
}
