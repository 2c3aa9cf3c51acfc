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
 * Extractor for Mocha's spec reporter.
 *
 * <p>Failures are listed after the {@code N passing / N failing} summary as
 * numbered entries indented by exactly two spaces. The entry either carries the
 * whole name on one line ({@code 1) Suite > Test:}) or spreads the describe
 * hierarchy over deeper-indented lines.
 */
public class MochaExtractor extends AbstractLineExtractor {

    private static final int SCAN_WINDOW = 40;

    private static final Pattern FAILURE_OPENER = Pattern.compile("^ {2}(\\d+)\\)\\s+(.*)$");
    private static final Pattern ANY_NUMBERED = Pattern.compile("^\\s+\\d+\\)\\s+");
    private static final Pattern HIERARCHY_LINE = Pattern.compile("^\\s{5,}\\S");
    private static final Pattern ERROR_START = Pattern.compile("^\\s+(Error|AssertionError|TypeError)");
    private static final Pattern ERROR_LINE = Pattern.compile("^\\s+([A-Za-z]*Error)(?:\\s\\[\\w+\\])?\\s*:\\s*(.+)");
    private static final Pattern TIMEOUT_FILE = Pattern.compile("\\(([^)]+\\.(?:js|ts|mjs|cjs))\\)");

    private static final Pattern FAILING_SUMMARY = Pattern.compile("^\\s*\\d+ failing", Pattern.MULTILINE);
    private static final Pattern NUMBERED_MARKER = Pattern.compile("^ {2}\\d+\\)\\s+\\S", Pattern.MULTILINE);

    public MochaExtractor() {
        super("mocha", "Extracts Mocha test framework errors", "mocha", "testing", "javascript");
    }

    @Override
    public ExtractorHints getHints() {
        return ExtractorHints.required("failing").withAnyOf("passing");
    }

    @Override
    public int getPriority() {
        return 80;
    }

    @Override
    public int getDetectionThreshold() {
        return 80;
    }

    @Override
    protected DetectionResult detectFormat(String output) {
        boolean summary = matches(FAILING_SUMMARY, output);
        boolean numbered = matches(NUMBERED_MARKER, output);

        if (summary && numbered) {
            return detected(DetectionConfidence.GENERIC_WORDING.score(), "Mocha test framework output detected",
                List.of("failing/passing summary", "numbered failure entries"));
        }
        if (summary) {
            return detected(DetectionConfidence.FALLBACK.score(), "Mocha failing summary without failure entries",
                List.of("failing/passing summary"));
        }
        return DetectionResult.none();
    }

    @Override
    protected ErrorExtractorResult extractErrors(String output, String context) {
        if (!output.contains("failing") && !output.contains("passing")) {
            return ResultAssembler.build(
                List.of(),
                "Unable to parse Mocha output - invalid format",
                "Ensure the input is valid Mocha test output",
                output.trim(),
                ExtractionMetadata.of(0, 0, List.of("Not Mocha output format"))
            );
        }
        return ResultAssembler.fromTestFailures(parseFailures(lines(output)), 95, List.of());
    }

    private List<TestFailure> parseFailures(List<String> lines) {
        List<TestFailure> failures = new ArrayList<>();
        int i = detailsStart(lines);
        while (i < lines.size()) {
            Matcher opener = matchLine(FAILURE_OPENER, lines.get(i));
            if (opener == null) {
                i++;
                continue;
            }

            String firstPart = opener.group(2).trim();
            List<String> nameParts = new ArrayList<>();
            if (!firstPart.isEmpty()) {
                nameParts.add(stripColon(firstPart));
            }

            int j = i + 1;
            if (!firstPart.endsWith(":")) {
                for (; j < lines.size(); j++) {
                    String next = lines.get(j);
                    if (next.isBlank() || matches(ERROR_START, next)) {
                        break;
                    }
                    if (matches(HIERARCHY_LINE, next)) {
                        nameParts.add(stripColon(next.trim()));
                    }
                }
            }

            String message = null;
            String errorType = null;
            StackLocation location = null;
            String timeoutFile = null;

            for (; j < lines.size() && j < i + SCAN_WINDOW; j++) {
                String next = lines.get(j);
                if (matches(ANY_NUMBERED, next)) {
                    break;
                }
                if (message == null) {
                    Matcher error = findFirst(ERROR_LINE, next);
                    if (error != null) {
                        errorType = error.group(1);
                        message = error.group(2).trim();
                    }
                }
                if (location == null && next.contains("at Context.<anonymous>")) {
                    location = ExtractorPatterns.parseStackLocation(next,
                        List.of(ExtractorPatterns.CONTEXT_ANONYMOUS_FRAME)).orElse(null);
                }
                if (location == null && timeoutFile == null && message != null && message.contains("Timeout")) {
                    Matcher timeout = findFirst(TIMEOUT_FILE, message);
                    if (timeout != null) {
                        timeoutFile = timeout.group(1);
                    }
                }
            }

            String file = location != null ? location.file() : timeoutFile;
            Integer line = location != null ? location.line() : null;
            Integer column = location != null ? location.column() : null;
            failures.add(new TestFailure(file, line, column, message, String.join(" > ", nameParts), errorType, null));
            log.debug("Mocha failure #{} parsed: {}", opener.group(1), nameParts);

            i = j;
        }
        return failures;
    }

    /**
     * Root-level tests carry their {@code N)} number in the run tree too, so numbered
     * entries are only read after the {@code N failing} line when there is one.
     */
    private int detailsStart(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            if (matches(FAILING_SUMMARY, lines.get(i))) {
                return i + 1;
            }
        }
        return 0;
    }

    private static String stripColon(String text) {
        return text.endsWith(":") ? text.substring(0, text.length() - 1) : text;
    }

    @Override
    public List<ExtractorSample> getSamples() {
        return List.of(
            new ExtractorSample(
                "single-assertion-error",
                "Single Mocha test failure with AssertionError",
                """

                  Calculator Test Matrix
                    Failure Type 1: Assertion Errors
                      1) should match expected value

                  0 passing (10ms)
                  1 failing

                  1) Calculator Test Matrix
                       Failure Type 1: Assertion Errors
                         should match expected value:

                      AssertionError [ERR_ASSERTION]: Expected 4 to equal 5
                      at Context.<anonymous> (file:///tmp/test.js:16:14)
                """,
                1,
                List.of("Review test assertions", "Expected 4 to equal 5", "Failure Type 1: Assertion Errors > should match expected value")),
            new ExtractorSample(
                "multiple-test-failures",
                "Multiple Mocha test failures with different error types",
                """

                  0 passing (20ms)
                  3 failing

                  1) Suite > Test 1:
                     Error: First error
                      at Context.<anonymous> (test.js:10:15)

                  2) Suite > Test 2:
                     TypeError: Cannot read properties of null
                      at Context.<anonymous> (test.js:20:15)

                  3) Suite > Test 3:
                     AssertionError: Values not equal
                      at Context.<anonymous> (test.js:30:15)
                """,
                3,
                List.of("First error", "Cannot read properties of null", "test.js:30"))
        );
    }
}
