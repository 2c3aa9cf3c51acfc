package com.errlens.core.extractor.impl.javascript;

import com.errlens.core.assembler.GuidancePatterns;
import com.errlens.core.assembler.ResultAssembler;
import com.errlens.core.assembler.TestFailure;
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
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extractor for AVA's verbose reporter.
 *
 * <p>AVA prints a list of {@code ✘ [fail]: Suite › test} lines followed by one
 * detailed block per failure. A block starts with the bare {@code Suite › test}
 * title and may contain a {@code file:line} location, a numbered code snippet,
 * an inspected error object, a {@code Difference} section and the assertion
 * message. Detection is additive: each AVA-specific signal adds to a score.
 */
public class AvaExtractor extends AbstractLineExtractor {

    private static final int DETECTION_MINIMUM = 40;
    private static final int BLOCK_WINDOW = 60;
    private static final String TIMEOUT_MESSAGE = "Test timeout exceeded";
    private static final String ERROR_THROWN = "Error thrown in test:";
    private static final String REJECTED_PROMISE = "Rejected promise returned by test. Reason:";

    private static final Pattern FAIL_MARKER = Pattern.compile("✘\\s+\\[fail]:");
    private static final Pattern FAIL_SUMMARY = Pattern.compile("✘\\s+\\[fail]:\\s+(.+)");
    private static final Pattern FILE_URL_MARKER = Pattern.compile("›\\s+file://");
    private static final Pattern SNIPPET_LINE = Pattern.compile("^\\d+:");
    private static final Pattern ERROR_OBJECT_START = Pattern.compile("^(?:TypeError|Error|.*Error)\\s*\\{$");
    private static final Pattern ERROR_LINE = Pattern.compile("^(?:TypeError|Error|.*Error):\\s+(.+)$");
    private static final Pattern OBJECT_MESSAGE = Pattern.compile("message:\\s*'([^']+)'");
    private static final Pattern OBJECT_CODE = Pattern.compile("code:\\s*'([^']+)'");
    private static final Pattern DIFF_LINE = Pattern.compile("^[+-]\\s");
    private static final Pattern STACK_AT = Pattern.compile("^at\\s+");

    private static final Map<String, String> TYPE_GUIDANCE = Map.of(
        "assertion", "Review the assertion logic and expected vs actual values",
        "timeout", "Increase timeout limit with t.timeout() or optimize async operations",
        "file-not-found", "Verify file path exists and permissions are correct",
        "type-error", "Check for null/undefined values before accessing properties",
        "import-error", "Verify module path and ensure dependencies are installed"
    );

    private static final List<GuidancePatterns.Rule> GUIDANCE_RULES;

    static {
        List<GuidancePatterns.Rule> rules = new ArrayList<>(GuidancePatterns.COMMON);
        rules.add(new GuidancePatterns.Rule("ava-timeout", List.of(), List.of("timeout"),
            "Tests are timing out - use t.timeout() to increase limit or optimize async operations"));
        GUIDANCE_RULES = List.copyOf(rules);
    }

    public AvaExtractor() {
        super("ava", "Extracts test failures from AVA test framework output", "ava", "test", "javascript", "typescript");
    }

    @Override
    public ExtractorHints getHints() {
        return ExtractorHints.anyOf("✘", "[fail]", "file://");
    }

    @Override
    public int getPriority() {
        return 82;
    }

    @Override
    protected DetectionResult detectFormat(String output) {
        List<String> patterns = new ArrayList<>();
        int score = score(output, patterns);
        if (score < DETECTION_MINIMUM) {
            return DetectionResult.none();
        }
        String reason = score >= 50 ? "AVA test output detected" : "Possible AVA test output";
        return detected(score, reason, patterns);
    }

    private int score(String output, List<String> patterns) {
        int score = 0;
        boolean failMarker = false;
        boolean hierarchy = false;
        boolean fileUrl = false;
        boolean errorMarker = false;

        for (String line : lines(output)) {
            String trimmed = line.trim();
            if (!failMarker && matches(FAIL_MARKER, trimmed)) {
                score += 30;
                patterns.add("AVA failure marker (✘ [fail]:)");
                failMarker = true;
            }
            if (!hierarchy && trimmed.contains("›") && !trimmed.startsWith("›") && trimmed.length() > 15) {
                score += 20;
                patterns.add("AVA test hierarchy (›)");
                hierarchy = true;
            }
            if (!fileUrl && matches(FILE_URL_MARKER, trimmed)) {
                score += 20;
                patterns.add("file:// URL format");
                fileUrl = true;
            }
            if (!errorMarker && (ERROR_THROWN.equals(trimmed) || REJECTED_PROMISE.equals(trimmed))) {
                score += 15;
                patterns.add("AVA error marker");
                errorMarker = true;
            }
            if (trimmed.contains(TIMEOUT_MESSAGE)) {
                score += 10;
                patterns.add("AVA timeout message");
            }
            if (matches(ExtractorPatterns.SIMPLE_FILE_LINE, trimmed)) {
                score += 5;
                patterns.add("file:line format");
            }
        }
        return Math.min(score, 100);
    }

    @Override
    protected ErrorExtractorResult extractErrors(String output, String context) {
        int score = score(output, new ArrayList<>());
        if (score < DETECTION_MINIMUM) {
            return ResultAssembler.empty("Not AVA test output", score, List.of());
        }

        List<AvaFailure> failures = parseFailures(lines(output));
        if (failures.isEmpty()) {
            return emptyResult();
        }

        List<FormattedError> errors = failures.stream().map(AvaFailure::toError).toList();
        List<TestFailure> forGuidance = failures.stream()
            .map(f -> new TestFailure(f.file, f.line, null, f.message, f.testName, f.errorType, f.guidance))
            .toList();

        return ResultAssembler.build(
            errors,
            failures.size() + " test(s) failed",
            GuidancePatterns.generate(forGuidance, GUIDANCE_RULES),
            ResultAssembler.formatCleanOutput(ResultAssembler.cap(errors)),
            ExtractionMetadata.of(90, ResultAssembler.completeness(errors), List.of())
        );
    }

    private List<AvaFailure> parseFailures(List<String> lines) {
        List<Integer> headers = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            if (isBlockTitle(lines.get(i).trim(), 10)) {
                headers.add(i);
            }
        }

        List<AvaFailure> failures = new ArrayList<>();
        if (!headers.isEmpty()) {
            for (int h = 0; h < headers.size(); h++) {
                int start = headers.get(h);
                int end = h + 1 < headers.size() ? headers.get(h + 1) : lines.size();
                AvaFailure failure = new AvaFailure(lines.get(start).trim());
                parseBlock(lines, start + 1, end, failure);
                failures.add(failure.classify());
            }
            return failures;
        }

        List<Integer> summaries = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).contains("✘") && lines.get(i).contains("[fail]:")) {
                summaries.add(i);
            }
        }
        for (int s = 0; s < summaries.size(); s++) {
            int start = summaries.get(s);
            int end = s + 1 < summaries.size() ? summaries.get(s + 1) : lines.size();
            Matcher summary = findFirst(FAIL_SUMMARY, lines.get(start).trim());
            AvaFailure failure = new AvaFailure(summary != null ? summary.group(1) : null);
            parseBlock(lines, start + 1, end, failure);
            failures.add(failure.classify());
        }
        return failures;
    }

    /**
     * A detailed block title is a {@code Suite › test} line that is neither a
     * summary line, a location, a snippet, an error line nor part of an inspected object.
     */
    private boolean isBlockTitle(String trimmed, int minLength) {
        return trimmed.contains("›")
            && !trimmed.contains("[fail]:")
            && !trimmed.startsWith("›")
            && !trimmed.contains("file://")
            && !matches(SNIPPET_LINE, trimmed)
            && !trimmed.startsWith("Error")
            && !trimmed.contains("{")
            && !trimmed.contains("}")
            && trimmed.length() > minLength;
    }

    private void parseBlock(List<String> lines, int start, int end, AvaFailure failure) {
        boolean foundSnippet = false;
        boolean inErrorObject = false;
        int limit = Math.min(end, start + BLOCK_WINDOW);

        for (int i = start; i < limit; i++) {
            String trimmed = lines.get(i).trim();

            if ("─".equals(trimmed)) {
                break;
            }

            if (failure.file == null) {
                StackLocation location = ExtractorPatterns.parseStackLocation(trimmed,
                    List.of(ExtractorPatterns.SIMPLE_FILE_LINE, ExtractorPatterns.ARROW_FILE_URL)).orElse(null);
                if (location != null) {
                    failure.file = location.file();
                    failure.line = location.line();
                    continue;
                }
            }

            if (matches(SNIPPET_LINE, trimmed)) {
                foundSnippet = true;
                continue;
            }
            if (matches(ERROR_OBJECT_START, trimmed)) {
                inErrorObject = true;
                continue;
            }
            if (inErrorObject) {
                if ("}".equals(trimmed)) {
                    inErrorObject = false;
                } else {
                    readObjectField(trimmed, failure);
                }
                continue;
            }

            Matcher errorLine = findFirst(ERROR_LINE, trimmed);
            if (errorLine != null) {
                if (failure.message == null) {
                    failure.message = errorLine.group(1);
                }
                if (failure.file == null) {
                    findApplicationFrame(lines, i + 1, failure);
                }
                continue;
            }

            if (trimmed.contains(TIMEOUT_MESSAGE)) {
                if (failure.message == null) {
                    failure.message = TIMEOUT_MESSAGE;
                }
                failure.errorType = "timeout";
                continue;
            }
            if (ERROR_THROWN.equals(trimmed) || REJECTED_PROMISE.equals(trimmed)) {
                continue;
            }
            if (trimmed.startsWith("Difference") && trimmed.contains("actual") && trimmed.contains("expected")) {
                if (failure.message == null) {
                    failure.message = "Assertion failed";
                }
                if (failure.errorType == null) {
                    failure.errorType = "assertion";
                }
                continue;
            }
            if (trimmed.startsWith("Difference") || trimmed.startsWith("Expected:")
                    || trimmed.startsWith("Received:") || matches(DIFF_LINE, trimmed)) {
                continue;
            }

            if (foundSnippet && failure.message == null && isAssertionMessage(trimmed)) {
                failure.message = trimmed;
            }
        }
    }

    private void readObjectField(String trimmed, AvaFailure failure) {
        Matcher message = findFirst(OBJECT_MESSAGE, trimmed);
        if (message != null && failure.message == null) {
            failure.message = message.group(1);
        }
        Matcher code = findFirst(OBJECT_CODE, trimmed);
        if (code != null) {
            if ("ENOENT".equals(code.group(1))) {
                failure.errorType = "file-not-found";
            } else if ("ERR_MODULE_NOT_FOUND".equals(code.group(1))) {
                failure.errorType = "import-error";
            }
        }
    }

    private void findApplicationFrame(List<String> lines, int start, AvaFailure failure) {
        for (String stackLine : collectUntil(lines, start, 9, line -> false)) {
            StackLocation location = ExtractorPatterns.parseStackLocation(stackLine,
                List.of(ExtractorPatterns.ARROW_FILE_URL)).orElse(null);
            if (location != null && !location.file().contains("node_modules") && !location.file().contains("/ava/lib/")) {
                failure.file = location.file();
                failure.line = location.line();
                return;
            }
        }
    }

    private boolean isAssertionMessage(String trimmed) {
        return !trimmed.isEmpty()
            && trimmed.length() < 150
            && !matches(SNIPPET_LINE, trimmed)
            && !trimmed.contains("Difference")
            && !trimmed.contains("{")
            && !trimmed.contains("}")
            && !matches(STACK_AT, trimmed)
            && !trimmed.contains("file://")
            && !trimmed.contains(".js:")
            && !trimmed.contains(".ts:");
    }

    static String classifyMessage(String message) {
        String lower = message.toLowerCase();
        if (lower.contains("timeout") || lower.contains("timed out")) {
            return "timeout";
        }
        if (lower.contains("enoent") || lower.contains("no such file")) {
            return "file-not-found";
        }
        if (lower.contains("cannot read properties") || lower.contains("typeerror")) {
            return "type-error";
        }
        if (lower.contains("expected") || lower.contains("should") || lower.contains("difference")) {
            return "assertion";
        }
        if (lower.contains("cannot find module") || lower.contains("module not found")) {
            return "import-error";
        }
        return "unknown";
    }

    private static final class AvaFailure {
        private final String testName;
        private String file;
        private Integer line;
        private String message;
        private String errorType;
        private String guidance;

        AvaFailure(String testName) {
            this.testName = testName;
        }

        AvaFailure classify() {
            if (errorType == null && message != null) {
                errorType = classifyMessage(message);
            }
            if (errorType != null) {
                guidance = TYPE_GUIDANCE.get(errorType);
            }
            return this;
        }

        FormattedError toError() {
            String text = message != null ? message : testName != null ? testName : "Test failed";
            return FormattedError.at(file != null ? file : "unknown", line, null, text)
                .withContext(testName)
                .withGuidance(guidance);
        }
    }

    @Override
    public List<ExtractorSample> getSamples() {
        return List.of(
            new ExtractorSample(
                "basic-assertion-failure",
                "Simple assertion failure with file and line",
                """

                  ✘ [fail]: Extractors › should extract TypeScript errors correctly should have 5 errors

                  Extractors › should extract TypeScript errors correctly

                  tests/ava/comprehensive-failures.test.js:28

                   27:   // Expected: 1 error, but we assert 5 (INTENTIONAL FAILURE)
                   28:   t.is(result.errors.length, 5, 'should have 5 errors');
                   29: });

                  should have 5 errors

                  Difference (- actual, + expected):

                  - 1
                  + 5

                  › file://tests/ava/comprehensive-failures.test.js:28:5
                """,
                1,
                List.of("tests/ava/comprehensive-failures.test.js:28", "should have 5 errors")),
            new ExtractorSample(
                "timeout-and-missing-fixture",
                "A timed out test and a test failing on a missing fixture file",
                """

                  ✘ [fail]: Api › fetches user Test timeout exceeded
                  ✘ [fail]: Fs › reads fixture Error thrown in test
                  ─

                  Api › fetches user

                  Test timeout exceeded

                  Fs › reads fixture

                  tests/fs.test.js:12

                   11:   const data = await readFile('fixtures/missing.json');
                   12:   t.truthy(data);
                   13: });

                  Error thrown in test:

                  Error {
                    code: 'ENOENT',
                    message: 'ENOENT: no such file or directory, open fixtures/missing.json',
                  }
                """,
                2,
                List.of("Test timeout exceeded", "tests/fs.test.js:12", "Verify file paths and ensure test fixtures exist"))
        );
    }
}
