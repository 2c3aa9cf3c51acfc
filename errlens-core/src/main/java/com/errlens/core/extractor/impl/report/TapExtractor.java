package com.errlens.core.extractor.impl.report;

import com.errlens.core.assembler.GuidancePatterns;
import com.errlens.core.assembler.ResultAssembler;
import com.errlens.core.assembler.TestFailure;
import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.extractor.ExtractorHints;
import com.errlens.core.extractor.ExtractorSample;
import com.errlens.core.extractor.base.AbstractLineExtractor;
import com.errlens.core.model.DetectionMetadata;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.ExtractionMetadata;
import com.errlens.core.model.FormattedError;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extractor for TAP (Test Anything Protocol) output from tape, node-tap and compatible runners.
 *
 * <p>A failure is a {@code not ok N description} line, optionally followed by a
 * YAML diagnostic block delimited by {@code ---} and {@code ...}. The most
 * recent {@code # comment} names the test.
 */
public class TapExtractor extends AbstractLineExtractor {

    private static final String NAME = "tap";
    private static final int MINIMUM_SCORE = 30;

    private static final Pattern VERSION = Pattern.compile("^TAP version \\d+");
    private static final Pattern NOT_OK = Pattern.compile("^not ok\\s+\\d+\\s*(?:-\\s*)?(.*)$");
    private static final Pattern YAML_FIELD = Pattern.compile("^\\s+(at|operator|expected|actual|message):\\s*(.+)$");
    private static final Pattern PARENTHESIZED = Pattern.compile("\\(([^)]+)\\)");
    private static final Pattern PATH_LINE_COLUMN = Pattern.compile("^(.+):(\\d+):(\\d+)$");

    private static final List<GuidancePatterns.Rule> TAP_GUIDANCE = List.of(
        rule("assertion", "Review the assertion logic and expected vs actual values"),
        rule("timeout", "Increase timeout limit or optimize async operations"),
        rule("file-not-found", "Verify file path exists and permissions are correct"),
        rule("type-error", "Check for null/undefined values before accessing properties")
    );

    public TapExtractor() {
        super(NAME, "Extracts test failures from TAP (Test Anything Protocol) output", "tap", "testing", "tape", "node-tap");
    }

    private static GuidancePatterns.Rule rule(String errorType, String guidance) {
        return new GuidancePatterns.Rule(errorType, List.of(), List.of(errorType), guidance);
    }

    @Override
    public ExtractorHints getHints() {
        return ExtractorHints.anyOf("not ok", "TAP version", "---");
    }

    @Override
    public int getPriority() {
        return 78;
    }

    @Override
    protected String getFailureUnit() {
        return "TAP failure";
    }

    @Override
    protected DetectionResult detectFormat(String output) {
        DetectionMetadata detection = score(output);
        if (detection.confidence() < MINIMUM_SCORE || !detection.patterns().contains("not ok N failure marker")) {
            return DetectionResult.none();
        }
        return DetectionResult.of(detection.confidence(), detection.patterns(), detection.reason());
    }

    private DetectionMetadata score(String output) {
        int score = 0;
        List<String> patterns = new ArrayList<>();
        boolean version = false;
        boolean notOk = false;
        boolean yaml = false;
        boolean comment = false;

        for (String line : lines(output)) {
            String trimmed = line.trim();
            if (!version && matches(VERSION, trimmed)) {
                score += 30;
                patterns.add("TAP version header");
                version = true;
            }
            if (!notOk && matches(NOT_OK, trimmed)) {
                score += 20;
                patterns.add("not ok N failure marker");
                notOk = true;
            }
            if (!yaml && "---".equals(trimmed)) {
                score += 15;
                patterns.add("YAML diagnostic block (---)");
                yaml = true;
            }
            if (!comment && trimmed.startsWith("# ")) {
                score += 10;
                patterns.add("Test comment marker (#)");
                comment = true;
            }
        }

        String reason;
        if (score >= 60) {
            reason = "TAP protocol output detected";
        } else if (score >= MINIMUM_SCORE) {
            reason = "Possible TAP output";
        } else {
            reason = "Not TAP output";
        }
        return new DetectionMetadata(NAME, Math.min(score, 100), patterns, reason);
    }

    @Override
    protected ErrorExtractorResult extractErrors(String output, String context) {
        DetectionMetadata detection = score(output);
        if (detection.confidence() < MINIMUM_SCORE) {
            return ResultAssembler.empty("Not TAP output", detection.confidence(), List.of())
                .withMetadata(ExtractionMetadata.of(detection.confidence(), 100, List.of()).withDetection(detection));
        }

        List<TestFailure> failures = parseFailures(lines(output));
        if (failures.isEmpty()) {
            return emptyResult().withMetadata(ExtractionMetadata.of(100, 100, List.of()).withDetection(detection));
        }

        List<FormattedError> errors = failures.stream().map(ResultAssembler::toFormattedError).toList();
        ExtractionMetadata metadata = ExtractionMetadata.of(95, ResultAssembler.completeness(errors), List.of())
            .withDetection(detection);
        return ResultAssembler.build(
            errors,
            failures.size() + " test(s) failed",
            GuidancePatterns.generate(failures, TAP_GUIDANCE),
            ResultAssembler.formatCleanOutput(ResultAssembler.cap(errors)),
            metadata
        );
    }

    private List<TestFailure> parseFailures(List<String> lines) {
        List<TestFailure> failures = new ArrayList<>();
        String currentTest = null;

        for (int i = 0; i < lines.size(); i++) {
            String trimmed = lines.get(i).trim();

            if (trimmed.startsWith("#")) {
                currentTest = trimmed.substring(1).trim();
                continue;
            }

            Matcher notOk = matchLine(NOT_OK, trimmed);
            if (notOk == null) {
                continue;
            }

            Diagnostics diagnostics = new Diagnostics();
            if (i + 1 < lines.size() && "---".equals(lines.get(i + 1).trim())) {
                int j = i + 2;
                while (j < lines.size() && !lines.get(j).trim().startsWith("...")) {
                    diagnostics.read(lines.get(j));
                    j++;
                }
                i = j;
            }

            String description = notOk.group(1).trim();
            String message = description.isEmpty() && diagnostics.message != null ? diagnostics.message : description;
            if (diagnostics.expected != null && diagnostics.actual != null) {
                message += " (expected: " + diagnostics.expected + ", actual: " + diagnostics.actual + ")";
            }

            String errorType = classify(message);
            String guidance = TAP_GUIDANCE.stream()
                .filter(r -> r.key().equals(errorType))
                .map(GuidancePatterns.Rule::guidance)
                .findFirst()
                .orElse(null);
            failures.add(new TestFailure(diagnostics.file, diagnostics.line, diagnostics.column,
                message.isBlank() ? null : message, currentTest, errorType, guidance));
        }
        return failures;
    }

    /**
     * Maps a failure description to a guidance key, {@code null} when none applies.
     */
    static String classify(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("timeout") || lower.contains("timed out")) {
            return "timeout";
        }
        if (lower.contains("enoent") || lower.contains("no such file")) {
            return "file-not-found";
        }
        if (lower.contains("cannot read properties") || lower.contains("typeerror")) {
            return "type-error";
        }
        if (lower.contains("expected") || lower.contains("should")) {
            return "assertion";
        }
        return null;
    }

    /**
     * Fields of one YAML diagnostic block.
     */
    private final class Diagnostics {
        private String file;
        private Integer line;
        private Integer column;
        private String message;
        private String expected;
        private String actual;

        void read(String yamlLine) {
            Matcher field = matchLine(YAML_FIELD, yamlLine);
            if (field == null) {
                return;
            }
            String value = unquote(field.group(2).trim());
            switch (field.group(1)) {
                case "at" -> readLocation(value);
                case "message" -> message = value;
                case "expected" -> expected = value;
                case "actual" -> actual = value;
                default -> log.debug("Ignoring TAP diagnostic field: {}", field.group(1));
            }
        }

        /**
         * Accepts {@code Test.<anonymous> (file:///path/test.js:28:5)} and bare {@code path/test.js:28:5}.
         */
        private void readLocation(String value) {
            Matcher parenthesized = findFirst(PARENTHESIZED, value);
            String path = parenthesized != null ? parenthesized.group(1) : value;
            if (path.startsWith("file://")) {
                path = path.substring("file://".length());
            }
            Matcher location = matchLine(PATH_LINE_COLUMN, path);
            if (location != null) {
                file = location.group(1);
                line = parseNumber(location.group(2));
                column = parseNumber(location.group(3));
            }
        }

        private String unquote(String value) {
            if (value.length() >= 2 && (value.startsWith("'") && value.endsWith("'")
                    || value.startsWith("\"") && value.endsWith("\""))) {
                return value.substring(1, value.length() - 1);
            }
            return value;
        }
    }

    @Override
    public List<ExtractorSample> getSamples() {
        return List.of(
            new ExtractorSample(
                "basic-failure",
                "Simple TAP failure with YAML diagnostics",
                """
                TAP version 13
                # Test › should pass assertion
                not ok 1 should have 5 errors
                  ---
                    operator: equal
                    expected: 5
                    actual:   1
                    at: Test.<anonymous> (file:///tmp/test.js:28:5)
                  ...
                """,
                1,
                List.of("/tmp/test.js:28", "should have 5 errors", "expected: 5, actual: 1")),
            new ExtractorSample(
                "mixed-failures",
                "Passing and failing tests with timeout and missing file failures",
                """
                TAP version 13
                # parser
                ok 1 parses empty input
                not ok 2 test timed out after 5000ms
                  ---
                    at: test/parser.test.js:41:3
                  ...
                # loader
                not ok 3 ENOENT: no such file or directory, open 'fixtures/missing.json'
                  ---
                    at: Test.<anonymous> (file:///work/test/loader.test.js:12:9)
                  ...

                1..3
                # tests 3
                # pass  1
                # fail  2
                """,
                2,
                List.of("test/parser.test.js:41", "Increase timeout limit", "Verify file path exists"))
        );
    }
}
