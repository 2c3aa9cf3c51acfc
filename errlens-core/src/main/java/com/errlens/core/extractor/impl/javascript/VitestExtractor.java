package com.errlens.core.extractor.impl.javascript;

import com.errlens.core.assembler.ResultAssembler;
import com.errlens.core.extractor.DetectionConfidence;
import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.extractor.ExtractorHints;
import com.errlens.core.extractor.ExtractorSample;
import com.errlens.core.extractor.base.AbstractLineExtractor;
import com.errlens.core.extractor.base.ExtractorPatterns;
import com.errlens.core.extractor.base.StackLocation;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.ExtractionMetadata;
import com.errlens.core.model.FormattedError;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extractor for Vitest console output.
 *
 * <p>Besides regular test failures this extractor recognises three run-level
 * problems that Vitest reports outside the test tree:
 * <ul>
 *   <li>{@code Unhandled Rejection} sections (labelled {@code Runtime Error})</li>
 *   <li>coverage threshold violations, reported against {@code vitest.config.ts}</li>
 *   <li>{@code [vitest-worker]} timeouts</li>
 * </ul>
 *
 * <p>Failed tests are read in two layouts: {@code FAIL file.test.ts > Suite > test}
 * and {@code × test} under a {@code ❯ file.test.ts (} header. The latter is only
 * honoured after the {@code Failed Tests} separator so that the summary tree does
 * not produce duplicates.
 */
public class VitestExtractor extends AbstractLineExtractor {

    private static final String TEST_FILE = "[^\\s]+\\.(?:test|spec)\\.[cm]?[jt]sx?";

    // Failure layout
    private static final Pattern DETAIL_SECTION = Pattern.compile("⎯+\\s*Failed Tests|^\\s*FAIL\\s+");
    private static final Pattern FILE_HEADER = Pattern.compile("❯\\s+(" + TEST_FILE + ")\\s+\\(");
    private static final Pattern FAILURE_WITH_FILE = Pattern.compile("(?:FAIL|❌|×)\\s+(" + TEST_FILE + ")\\s*>\\s*(.+)");
    private static final Pattern FAILURE_NAME_ONLY = Pattern.compile("×\\s+(.+?)(?:\\s+\\d+ms)?$");
    private static final Pattern ERROR_LINE = Pattern.compile("((?:AssertionError|Error):\\s*.+)");
    private static final Pattern ARROW_ERROR = Pattern.compile("→\\s+(.+)");
    private static final Pattern SNAPSHOT_MISMATCH = Pattern.compile("Snapshot\\s+`([^`]+)`\\s+mismatched");
    private static final Pattern SOURCE_LINE = Pattern.compile("^\\s*(\\d+)\\|\\s*(.+)");
    private static final Pattern NUMBERED_LINE = Pattern.compile("^\\d+\\|");
    private static final List<Pattern> LOCATION_PATTERNS = List.of(
        Pattern.compile("❯\\s*(" + TEST_FILE + "):(\\d+):(\\d+)"),
        Pattern.compile("at\\s+.+\\((" + TEST_FILE + "):(\\d+):(\\d+)\\)")
    );

    // Run-level problems
    private static final Pattern REJECTION_SPLIT = Pattern.compile("⎯+\\s*Unhandled Rejection\\s*⎯+");
    private static final Pattern REJECTION_ERROR =
        Pattern.compile("^\\s*((?:Type|Reference|Range|Syntax)?Error:[^\\n]+(?:\\n\\s*[^\\n❯⎯]+)?)");
    private static final Pattern REJECTION_FRAME = Pattern.compile("❯\\s+\\S+\\s+([\\w:/.@-]+):(\\d+):(\\d+)");
    private static final Pattern COVERAGE = Pattern.compile(
        "ERROR:\\s+Coverage for (\\w+) \\(([\\d.]+)%\\) does not meet (?:global )?threshold \\(([\\d.]+)%\\)");
    private static final Pattern WORKER_TIMEOUT = Pattern.compile(
        "⎯+\\s*Unhandled Errors?\\s*⎯+\\s*\\n\\s*Error:\\s*\\[vitest-worker\\]:\\s*(Timeout[^\\n]+)");
    private static final Pattern EXPECTED_HEAD = Pattern.compile("- Expected[^\\n]*\\n[^\\n]*\\n- (.+)");
    private static final Pattern RECEIVED_HEAD = Pattern.compile("\\+ Received[^\\n]*\\n[^\\n]*\\n\\+ (.+)");

    // Detection markers
    private static final Pattern RUN_HEADER = Pattern.compile("^\\s*RUN\\s+v\\d+\\.\\d+\\.\\d+", Pattern.MULTILINE);
    private static final Pattern FAIL_MARKER = Pattern.compile("FAIL\\s+\\S+\\.test\\.[jt]s");
    private static final Pattern ARROW_MARKER = Pattern.compile("❯\\s+\\S+\\.test\\.[jt]s");
    private static final Pattern CROSS_MARKER = Pattern.compile("×\\s+[^❯\\n]+");
    private static final Pattern UNHANDLED_MARKER = Pattern.compile("⎯+\\s*Unhandled");
    private static final Pattern CAUGHT_MARKER = Pattern.compile("Vitest caught \\d+ unhandled errors?");
    private static final Pattern TEST_FILES_FAILED = Pattern.compile("Test Files\\s+\\d+ failed");

    private static final String SENTINEL_CONFIG = "vitest.config.ts";
    private static final String VERIFY_HINT = "Run: npm test -- <test-file> to verify the fix.";

    public VitestExtractor() {
        super("vitest", "Extracts Vitest test failures, runtime errors and coverage violations",
            "vitest", "testing", "test-failures", "javascript");
    }

    @Override
    public ExtractorHints getHints() {
        return ExtractorHints.anyOf("FAIL", "test.ts", "test.js", "❯", "×", "Unhandled", "Coverage for");
    }

    @Override
    public int getPriority() {
        return 100;
    }

    @Override
    public int getDetectionThreshold() {
        return 90;
    }

    @Override
    protected DetectionResult detectFormat(String output) {
        List<String> patterns = new ArrayList<>();
        addIfMatches(patterns, FAIL_MARKER, output, "FAIL file.test marker");
        addIfMatches(patterns, ARROW_MARKER, output, "❯ file.test marker");
        addIfMatches(patterns, CROSS_MARKER, output, "× failed test marker");
        addIfMatches(patterns, UNHANDLED_MARKER, output, "Unhandled errors section");
        addIfMatches(patterns, CAUGHT_MARKER, output, "Vitest caught unhandled errors");
        addIfMatches(patterns, TEST_FILES_FAILED, output, "Test Files failed summary");

        if (!patterns.isEmpty() && matches(RUN_HEADER, output)) {
            patterns.add(0, "RUN vX.Y.Z header");
            return detected(DetectionConfidence.UNAMBIGUOUS.score(), "Vitest run header with failure markers", patterns);
        }
        if (patterns.size() >= 2) {
            return detected(DetectionConfidence.STRONG.score(), "Multiple Vitest failure patterns detected", patterns);
        }
        if (matches(COVERAGE, output)) {
            patterns.add("coverage threshold violation");
            return detected(DetectionConfidence.STRONG.score(), "Vitest coverage threshold failure detected", patterns);
        }
        if (patterns.size() == 1) {
            return detected(70, "Single Vitest failure pattern detected", patterns);
        }
        return DetectionResult.none();
    }

    private void addIfMatches(List<String> patterns, Pattern pattern, String output, String label) {
        if (matches(pattern, output)) {
            patterns.add(label);
        }
    }

    @Override
    protected ErrorExtractorResult extractErrors(String output, String context) {
        List<VitestFailure> failures = new ArrayList<>(runtimeErrors(output));
        coverageError(output, failures);
        workerTimeout(output, failures);
        parseTestFailures(lines(output), failures);

        if (failures.isEmpty()) {
            return emptyResult();
        }

        boolean timedOut = failures.stream().anyMatch(f -> f.message.contains("Test timed out"));
        String expected = firstGroup(EXPECTED_HEAD, output);
        String actual = firstGroup(RECEIVED_HEAD, output);

        List<FormattedError> errors = failures.stream().map(VitestFailure::toError).toList();
        String digest = ResultAssembler.numberedDigest(failures, "Test", f -> f.digest(expected, actual));

        return ResultAssembler.build(
            errors,
            failures.size() + " test failure(s)",
            guidance(failures.size(), expected, actual, timedOut),
            digest,
            ExtractionMetadata.of(DetectionConfidence.STRONG.score(), ResultAssembler.completeness(errors), List.of())
        );
    }

    private void parseTestFailures(List<String> lines, List<VitestFailure> failures) {
        VitestFailure current = null;
        String currentFile = null;
        boolean inDetailSection = false;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);

            if (!inDetailSection && matches(DETAIL_SECTION, line)) {
                inDetailSection = true;
            }

            Matcher header = findFirst(FILE_HEADER, line);
            if (header != null) {
                currentFile = header.group(1);
                continue;
            }

            VitestFailure opened = openFailure(line, currentFile, inDetailSection);
            if (opened != null) {
                if (current != null) {
                    failures.add(current);
                }
                current = opened;
                continue;
            }
            if (current == null) {
                continue;
            }

            if (current.message.isEmpty()) {
                boolean snapshot = matches(SNAPSHOT_MISMATCH, line);
                if (snapshot || matches(ERROR_LINE, line) || matches(ARROW_ERROR, line)) {
                    i = readMessage(lines, i, snapshot, current);
                }
                continue;
            }

            if (current.location == null) {
                StackLocation location = ExtractorPatterns.parseStackLocation(line, LOCATION_PATTERNS).orElse(null);
                if (location != null) {
                    current.location = location;
                    continue;
                }
            }

            Matcher source = findFirst(SOURCE_LINE, line);
            if (source != null) {
                current.sourceLine = source.group(1) + "| " + source.group(2).trim();
            }
        }

        if (current != null) {
            failures.add(current);
        }
    }

    private VitestFailure openFailure(String line, String currentFile, boolean inDetailSection) {
        Matcher withFile = findFirst(FAILURE_WITH_FILE, line);
        if (withFile != null) {
            return new VitestFailure(withFile.group(1), withFile.group(2).trim());
        }
        if (currentFile != null && inDetailSection) {
            Matcher nameOnly = findFirst(FAILURE_NAME_ONLY, line);
            if (nameOnly != null) {
                return new VitestFailure(currentFile, nameOnly.group(1).trim());
            }
        }
        return null;
    }

    /**
     * Reads an error message and its continuation lines.
     *
     * <p>Snapshot diffs keep their line structure and are not capped; other
     * messages are compacted onto one line, end at the first blank line and are
     * truncated after {@link #MAX_CONTINUATION_LINES} continuation lines.
     *
     * @return index of the last consumed line
     */
    private int readMessage(List<String> lines, int start, boolean snapshot, VitestFailure failure) {
        StringBuilder message = new StringBuilder(messageStart(lines.get(start)));
        int consumed = 0;
        int j = start + 1;

        for (; j < lines.size(); j++) {
            String raw = lines.get(j);
            String trimmed = raw.trim();
            if (isStopMarker(trimmed)) {
                break;
            }
            if (!snapshot && consumed >= MAX_CONTINUATION_LINES) {
                if (!trimmed.isEmpty()) {
                    message.append(' ').append(TRUNCATION_MARKER);
                }
                break;
            }
            if (snapshot) {
                message.append('\n').append(raw);
            } else if (trimmed.isEmpty()) {
                break;
            } else {
                message.append(' ').append(trimmed);
                consumed++;
            }
        }

        failure.message = message.toString();
        return j - 1;
    }

    private String messageStart(String line) {
        Matcher error = findFirst(ERROR_LINE, line);
        if (error != null) {
            return error.group(1).trim();
        }
        Matcher arrow = findFirst(ARROW_ERROR, line);
        if (arrow != null) {
            return arrow.group(1).trim();
        }
        return line.trim();
    }

    private boolean isStopMarker(String trimmed) {
        return trimmed.startsWith("❯")
            || matches(NUMBERED_LINE, trimmed)
            || trimmed.startsWith("FAIL")
            || trimmed.startsWith("✓")
            || trimmed.startsWith("❌")
            || trimmed.startsWith("×")
            || trimmed.startsWith("⎯")
            || trimmed.startsWith("at ");
    }

    // ==================== Run-level problems ====================

    private List<VitestFailure> runtimeErrors(String output) {
        List<VitestFailure> failures = new ArrayList<>();
        String[] sections = REJECTION_SPLIT.split(output);
        for (int i = 1; i < sections.length; i++) {
            Matcher error = REJECTION_ERROR.matcher(sections[i]);
            if (!error.find()) {
                continue;
            }
            StackLocation location = rejectionLocation(sections[i]);
            VitestFailure failure = new VitestFailure(location != null ? location.file() : "unknown", "Runtime Error");
            failure.message = error.group(1).trim().replaceAll("\\n\\s+", " ");
            failure.location = location;
            failures.add(failure);
        }
        return failures;
    }

    /**
     * Picks the first application frame, falling back to the first {@code node:internal} frame.
     */
    private StackLocation rejectionLocation(String section) {
        StackLocation fallback = null;
        for (String line : lines(section)) {
            Matcher frame = findFirst(REJECTION_FRAME, line);
            if (frame == null) {
                continue;
            }
            StackLocation location = new StackLocation(frame.group(1), parseNumber(frame.group(2)), parseNumber(frame.group(3)));
            if (!location.file().startsWith("node:internal")) {
                return location;
            }
            if (fallback == null) {
                fallback = location;
            }
        }
        return fallback;
    }

    private void coverageError(String output, List<VitestFailure> failures) {
        Matcher coverage = findFirst(COVERAGE, output);
        if (coverage == null) {
            return;
        }
        VitestFailure failure = new VitestFailure(SENTINEL_CONFIG, "Coverage Threshold");
        failure.message = "Coverage for " + coverage.group(1) + " (" + coverage.group(2)
            + "%) does not meet threshold (" + coverage.group(3) + "%)";
        failures.add(failure);
    }

    private void workerTimeout(String output, List<VitestFailure> failures) {
        Matcher timeout = findFirst(WORKER_TIMEOUT, output);
        if (timeout == null) {
            return;
        }
        VitestFailure failure = new VitestFailure(SENTINEL_CONFIG, "Vitest Worker Timeout");
        failure.message = timeout.group(1).trim()
            + ". This is usually caused by system resource constraints or competing processes."
            + " Try: 1) Kill background processes, 2) Reduce --pool-workers, 3) Increase --test-timeout";
        failures.add(failure);
    }

    private String firstGroup(Pattern pattern, String output) {
        Matcher matcher = findFirst(pattern, output);
        return matcher != null ? matcher.group(1).trim() : null;
    }

    private static String guidance(int count, String expected, String actual, boolean timedOut) {
        StringBuilder guidance = new StringBuilder(count + " test(s) failed. ");

        if (timedOut) {
            guidance.append("Test(s) timed out. ");
            if (count == 1) {
                guidance.append("Options: 1) Increase timeout with test.timeout() or testTimeout config, ")
                    .append("2) Optimize test to run faster, ")
                    .append("3) Mock slow operations (API calls, file I/O, child processes). ");
            } else {
                guidance.append("Multiple tests timing out suggests resource constraints. ")
                    .append("Try: 1) Run tests individually to identify slow tests, ")
                    .append("2) Increase testTimeout config, ")
                    .append("3) Reduce parallel test workers (--pool-workers=2). ");
            }
            return guidance.append(VERIFY_HINT).toString();
        }

        if (count == 1) {
            guidance.append("Fix the assertion in the test file at the location shown. ");
            if (expected != null && actual != null) {
                guidance.append("The test expected \"").append(expected)
                    .append("\" but got \"").append(actual).append("\". ");
            }
            guidance.append(VERIFY_HINT);
        } else {
            guidance.append("Fix each failing test individually. Run: npm test -- <test-file> to test each file.");
        }
        return guidance.toString();
    }

    private static final class VitestFailure {
        private final String file;
        private final String hierarchy;
        private String message = "";
        private StackLocation location;
        private String sourceLine;

        VitestFailure(String file, String hierarchy) {
            this.file = file;
            this.hierarchy = hierarchy;
        }

        FormattedError toError() {
            Integer line = location != null ? location.line() : null;
            Integer column = location != null ? location.column() : null;
            String text = message.isBlank() ? "Test failed" : message;
            return FormattedError.at(file, line, column, text).withContext(hierarchy);
        }

        String digest(String expected, String actual) {
            StringBuilder block = new StringBuilder(location != null ? location.describe() : file);
            block.append("\nTest: ").append(hierarchy);
            if (!message.isBlank()) {
                block.append("\nError: ").append(message);
            }
            if (expected != null && actual != null) {
                block.append("\nExpected: ").append(expected).append("\nActual: ").append(actual);
            }
            if (sourceLine != null) {
                block.append('\n').append(sourceLine);
            }
            return block.toString();
        }
    }

    @Override
    public List<ExtractorSample> getSamples() {
        return List.of(
            new ExtractorSample(
                "single-test-failure",
                "Single Vitest test failure with assertion error",
                """
                FAIL  test/unit/config/environment.test.ts > EnvironmentConfig > should parse HTTP_PORT
                AssertionError: expected 3000 to be 9999 // Object.is equality
                 ❯ test/unit/config/environment.test.ts:57:30
                   57|     expect(config.HTTP_PORT).toBe(9999);
                """,
                1,
                List.of("AssertionError", "test/unit/config/environment.test.ts", "should parse HTTP_PORT")),
            new ExtractorSample(
                "multiple-test-failures",
                "Multiple Vitest test failures across different files",
                """
                FAIL  test/unit/config/environment.test.ts > EnvironmentConfig > test 1
                AssertionError: expected 3000 to be 9999
                 ❯ test/unit/config/environment.test.ts:57:30

                FAIL  test/unit/auth/factory.test.ts > AuthFactory > test 2
                Error: Cannot create auth provider
                 ❯ test/unit/auth/factory.test.ts:100:15
                """,
                2,
                List.of("AssertionError", "Cannot create auth provider", "2 test failure(s)")),
            new ExtractorSample(
                "coverage-threshold-failure",
                "Coverage threshold not met",
                """
                 Test Files  1139 passed (1139)
                      Tests  1139 passed (1139)

                ERROR: Coverage for functions (86.47%) does not meet global threshold (87%)
                """,
                1,
                List.of("Coverage", "threshold", "vitest.config.ts")),
            new ExtractorSample(
                "unhandled-rejection",
                "Unhandled promise rejection reported outside of any test",
                """
                ⎯⎯⎯⎯⎯⎯ Unhandled Errors ⎯⎯⎯⎯⎯⎯

                Vitest caught 1 unhandled error during the test run.
                This might cause false positive tests.

                ⎯⎯⎯⎯⎯⎯ Unhandled Rejection ⎯⎯⎯⎯⎯⎯
                TypeError: Cannot read properties of undefined (reading 'id')
                 ❯ processUser src/users.ts:42:18
                 ❯ processTicksAndRejections node:internal/process/task_queues:95:5
                """,
                1,
                List.of("Runtime Error", "TypeError", "src/users.ts"))
        );
    }
}
