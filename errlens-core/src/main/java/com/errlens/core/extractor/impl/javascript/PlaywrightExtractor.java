package com.errlens.core.extractor.impl.javascript;

import com.errlens.core.assembler.ResultAssembler;
import com.errlens.core.extractor.DetectionConfidence;
import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.extractor.ExtractorHints;
import com.errlens.core.extractor.ExtractorSample;
import com.errlens.core.extractor.base.AbstractLineExtractor;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.ExtractionMetadata;
import com.errlens.core.model.FormattedError;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extractor for the Playwright Test list reporter.
 *
 * <p>Each failure is reported as {@code N) file.spec.ts:line:col › title}
 * followed by an indented block holding the {@code Error:} text, an optional
 * call log, a code frame and the {@code at file.spec.ts:line:col} frame that
 * gives the precise location.
 */
public class PlaywrightExtractor extends AbstractLineExtractor {

    private static final Pattern OPENER =
        Pattern.compile("^\\s+(\\d+)\\)\\s+(.*\\.spec\\.ts):(\\d+):(\\d+)\\s+›\\s+(.+?)\\s*$");
    private static final Pattern RUN_SUMMARY = Pattern.compile("^\\s+\\d+ (?:failed|passed|flaky|skipped|did not run)");
    private static final Pattern ERROR_BLOCK =
        Pattern.compile("Error:\\s*(.+?)(?:\\n\\s*\\n|\\n(?=\\s+at\\s)|\\s*\\z)", Pattern.DOTALL);
    private static final Pattern STACK_FRAME = Pattern.compile("at\\s+(.*\\.spec\\.ts):(\\d+):(\\d+)");
    private static final Pattern PROJECT_RELATIVE = Pattern.compile("(tests?/.+\\.spec\\.ts)");

    private static final Pattern NUMBERED_MARKER =
        Pattern.compile("^\\s+\\d+\\)\\s+\\S*\\.spec\\.ts:\\d+:\\d+\\s+›", Pattern.MULTILINE);
    private static final Pattern CROSS_MARKER = Pattern.compile("✘\\s+\\d+\\s+\\S*\\.spec\\.ts:\\d+:\\d+\\s+›");

    private static final String DEFAULT_GUIDANCE = "Fix the failing Playwright tests at the locations shown";

    /**
     * Playwright failure categories, matched in declaration order.
     */
    enum FailureType {
        ELEMENT_NOT_FOUND("Element not found - verify the locator matches an element that is attached and visible on the page",
            "waiting for locator", "waiting for selector", "element(s) not found", "resolved to 0 elements"),
        NAVIGATION_ERROR("Cannot navigate to the page - verify the URL and that the server under test is running",
            "page.goto", "net::ERR_", "NS_ERROR_"),
        TIMEOUT("Test timeout exceeded - increase the timeout or wait explicitly for the expected condition",
            "timeout", "Timeout"),
        ASSERTION_ERROR("Review the failing assertion - expected and received values differ",
            "expect(", "toBe", "toEqual", "toHave", "Expected");

        private final String guidance;
        private final List<String> markers;

        FailureType(String guidance, String... markers) {
            this.guidance = guidance;
            this.markers = List.of(markers);
        }

        String getGuidance() {
            return guidance;
        }

        static FailureType classify(String message) {
            for (FailureType type : values()) {
                if (type.markers.stream().anyMatch(message::contains)) {
                    return type;
                }
            }
            return null;
        }
    }

    public PlaywrightExtractor() {
        super("playwright", "Extracts Playwright test failures", "playwright", "testing", "e2e", "javascript");
    }

    @Override
    public ExtractorHints getHints() {
        return ExtractorHints.required(".spec.ts").withAnyOf("✘", "›");
    }

    @Override
    public int getPriority() {
        return 95;
    }

    @Override
    public int getDetectionThreshold() {
        return 90;
    }

    @Override
    protected DetectionResult detectFormat(String output) {
        List<String> patterns = new ArrayList<>();
        if (matches(CROSS_MARKER, output)) {
            patterns.add("✘ failed test marker");
        }
        if (matches(NUMBERED_MARKER, output)) {
            patterns.add("numbered failure with spec location (N) file.spec.ts:line:col ›)");
        }
        if (patterns.isEmpty()) {
            return DetectionResult.none();
        }
        return detected(DetectionConfidence.DISTINCTIVE.score(), "Playwright test output detected", patterns);
    }

    @Override
    protected ErrorExtractorResult extractErrors(String output, String context) {
        List<String> lines = lines(output);
        List<FormattedError> errors = new ArrayList<>();
        List<String> issues = new ArrayList<>();
        Set<String> guidance = new LinkedHashSet<>();
        int located = 0;

        for (int i = 0; i < lines.size(); i++) {
            Matcher opener = matchLine(OPENER, lines.get(i));
            if (opener == null) {
                continue;
            }
            String title = opener.group(5);
            List<String> block = collectUntil(lines, i + 1, Integer.MAX_VALUE,
                line -> matches(OPENER, line) || matches(RUN_SUMMARY, line));
            String blockText = String.join("\n", block);

            String message = errorMessage(block, blockText);
            FailureType type = FailureType.classify(message);

            Matcher frame = findFirst(STACK_FRAME, blockText);
            FormattedError error;
            if (frame != null) {
                located++;
                error = FormattedError.at(normalizePath(frame.group(1)), parseNumber(frame.group(2)),
                    parseNumber(frame.group(3)), title + ": " + message);
            } else {
                issues.add("No stack trace found for failure: " + title);
                error = FormattedError.at(normalizePath(opener.group(2)), parseNumber(opener.group(3)),
                    parseNumber(opener.group(4)), title + ": " + message);
            }
            if (type != null) {
                error = error.withGuidance(type.getGuidance());
                guidance.add(type.getGuidance());
            }
            errors.add(error.withContext(title));
            i += block.size();
        }

        if (errors.isEmpty()) {
            return emptyResult();
        }

        int completeness = (int) Math.round(located * 100.0 / errors.size());
        List<String> reportedIssues = issues.isEmpty() ? List.of() : issues;
        return ResultAssembler.build(
            errors,
            errors.size() + " test(s) failed",
            guidance.isEmpty() ? DEFAULT_GUIDANCE : String.join("\n", guidance),
            ResultAssembler.formatCleanOutput(ResultAssembler.cap(errors)),
            ExtractionMetadata.of(confidence(issues.size(), completeness), completeness, reportedIssues)
        );
    }

    private String errorMessage(List<String> block, String blockText) {
        Matcher error = findFirst(ERROR_BLOCK, blockText);
        if (error != null) {
            return error.group(1).trim().replaceAll("\\s*\\n\\s*", " ");
        }
        return block.stream()
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .findFirst()
            .orElse("Test failed");
    }

    /**
     * 90, minus 10 per issue (at most 40), minus half of the completeness shortfall below 80.
     */
    static int confidence(int issueCount, int completeness) {
        int confidence = 90 - Math.min(40, issueCount * 10);
        if (completeness < 80) {
            confidence -= (80 - completeness) / 2;
        }
        return Math.max(0, confidence);
    }

    private String normalizePath(String path) {
        Matcher relative = findFirst(PROJECT_RELATIVE, path);
        return relative != null ? relative.group(1) : path.trim();
    }

    @Override
    public List<ExtractorSample> getSamples() {
        return List.of(
            new ExtractorSample(
                "single-assertion-failure",
                "Single Playwright assertion failure with code frame",
                """
                Running 1 test using 1 worker

                  ✘   1 tests/example.spec.ts:10:5 › should fail (100ms)


                  1) tests/example.spec.ts:10:5 › should fail

                    Error: expect(received).toBe(expected)

                    Expected: "foo"
                    Received: "bar"

                      10 |     test('should fail', async () => {
                      11 |       const value = 'bar';
                    > 12 |       expect(value).toBe('foo');
                         |                     ^
                      13 |     });

                      at tests/example.spec.ts:12:21

                  1 failed
                """,
                1,
                List.of("tests/example.spec.ts:12", "expect(received).toBe(expected)", "should fail")),
            new ExtractorSample(
                "timeout-and-navigation",
                "Element wait timeout and a navigation failure",
                """
                Running 2 tests using 1 worker

                  ✘   1 tests/login.spec.ts:5:3 › Login › submits the form (30.0s)
                  ✘   2 tests/nav.spec.ts:8:3 › opens the docs page (120ms)


                  1) tests/login.spec.ts:5:3 › Login › submits the form

                    Error: page.click: Test timeout of 30000ms exceeded.
                    Call log:
                      - waiting for locator('#submit')

                      at /home/ci/app/tests/login.spec.ts:9:16

                  2) tests/nav.spec.ts:8:3 › opens the docs page

                    Error: page.goto: net::ERR_CONNECTION_REFUSED at http://localhost:3000/docs

                      at tests/nav.spec.ts:10:14

                  2 failed
                """,
                2,
                List.of("Login › submits the form", "tests/login.spec.ts:9", "Element not found", "Cannot navigate"))
        );
    }
}
