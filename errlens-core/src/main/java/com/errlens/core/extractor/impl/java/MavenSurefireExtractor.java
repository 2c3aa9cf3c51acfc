package com.errlens.core.extractor.impl.java;

import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.extractor.ExtractorHints;
import com.errlens.core.extractor.ExtractorSample;
import com.errlens.core.extractor.base.AbstractLineExtractor;
import com.errlens.core.model.DetectionMetadata;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.FormattedError;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extractor for JUnit failures reported by the Maven Surefire and Failsafe plugins.
 *
 * <p>Two layouts are read:
 * <ul>
 *   <li>detailed: {@code [ERROR] pkg.Class.method -- Time elapsed ... <<< FAILURE!}
 *       followed by the exception line and stack trace</li>
 *   <li>short: {@code [ERROR]   Class.method:42 message} lines of the final
 *       {@code Failures:} report, used only when no detailed entry was seen</li>
 * </ul>
 */
public class MavenSurefireExtractor extends AbstractLineExtractor {

    private static final String NAME = "maven-surefire";
    private static final int MAX_STACK_FRAMES = 3;
    private static final int MAX_MESSAGE_LINES = 5;

    private static final Pattern TEST_SUMMARY =
        Pattern.compile("^\\[ERROR]\\s+Tests run:\\s+(\\d+),\\s+Failures:\\s+(\\d+),\\s+Errors:\\s+(\\d+)");
    private static final Pattern TEST_HEADER = Pattern.compile("^\\[ERROR]\\s+(\\S+)\\s+.*<<<\\s+(FAILURE|ERROR)!");
    private static final Pattern SHORT_FORM =
        Pattern.compile("^\\[ERROR]\\s+([^:\\s]+)\\.([^:.\\s]+):(\\d+)\\s+(?:(\\w+(?:Error|Exception|Failure))\\s+)?(.+)$");
    private static final Pattern EXCEPTION_LINE =
        Pattern.compile("^([\\w.$]+(?:Error|Exception|AssertionFailedError)):\\s*(.*)$");
    private static final Pattern STACK_FRAME = Pattern.compile("^\\s+at\\s+([^(]+)\\(([^:)]+):(\\d+)\\)");
    private static final Pattern ASSERTION = Pattern.compile("AssertionError|AssertionFailedError");

    public MavenSurefireExtractor() {
        super(NAME, "Extracts test failures from Maven Surefire and Failsafe plugin output",
            "maven", "java", "junit", "testing", "surefire", "failsafe");
    }

    @Override
    public ExtractorHints getHints() {
        return ExtractorHints.required("[ERROR]", "Tests run:")
            .withAnyOf("FAILURE!", "ERROR!", "maven-surefire-plugin", "maven-failsafe-plugin", "Failures:");
    }

    @Override
    public int getPriority() {
        return 75;
    }

    @Override
    protected DetectionResult detectFormat(String output) {
        return MavenResults.toDetectionResult(score(output));
    }

    /**
     * Plugin references alone never count: a passing build mentions the plugin too.
     */
    private DetectionMetadata score(String output) {
        int pluginScore = 0;
        int failureScore = 0;
        List<String> patterns = new ArrayList<>();

        for (String line : lines(output)) {
            if (line.contains("maven-surefire-plugin") || line.contains("maven-failsafe-plugin")) {
                pluginScore += 40;
                patterns.add("Maven test plugin reference");
            }
            if (matches(TEST_SUMMARY, line)) {
                failureScore += 40;
                patterns.add("Test summary (Tests run, Failures, Errors)");
            }
            if (line.contains("<<< FAILURE!") || line.contains("<<< ERROR!")) {
                failureScore += 20;
                patterns.add("Test failure markers");
            }
            if (line.contains("[ERROR] Failures:") || line.contains("[ERROR] Errors:")) {
                failureScore += 15;
                patterns.add("Test failure section headers");
            }
            if (matches(ASSERTION, line)) {
                failureScore += 10;
                patterns.add("JUnit assertion errors");
            }
        }

        int score = failureScore == 0 ? 0 : pluginScore + failureScore;
        String reason = MavenResults.reason(score, "Maven Surefire/Failsafe test output detected",
            "Possible Maven test output", "Not Maven test output");
        return MavenResults.detection(NAME, score, failureScore == 0 ? List.of() : patterns, reason);
    }

    @Override
    protected ErrorExtractorResult extractErrors(String output, String context) {
        DetectionMetadata detection = score(output);
        if (detection.confidence() < MavenResults.MINIMUM_SCORE) {
            return MavenResults.lowConfidence("test", detection);
        }

        List<String> lines = lines(output);
        Integer reportedFailures = null;
        Integer reportedErrors = null;
        for (String line : lines) {
            Matcher summary = findFirst(TEST_SUMMARY, line);
            if (summary != null) {
                reportedFailures = parseCount(summary.group(2));
                reportedErrors = parseCount(summary.group(3));
            }
        }

        List<SurefireFailure> failures = parseDetailed(lines);
        if (failures.isEmpty()) {
            failures = parseShortForm(lines);
        }

        List<FormattedError> errors = failures.stream().map(SurefireFailure::toError).toList();
        int failureCount = reportedFailures != null ? reportedFailures
            : (int) failures.stream().filter(f -> !f.error).count();
        int errorCount = reportedErrors != null ? reportedErrors
            : (int) failures.stream().filter(f -> f.error).count();

        String command = context != null && !context.isBlank() ? context : "mvn test";
        List<String> issues = failures.size() > 20 ? List.of("Many test failures - output may be truncated") : List.of();
        return MavenResults.build(
            detection,
            errors,
            ((long) failureCount + errorCount) + " test failure(s): " + failureCount + " failures, " + errorCount + " errors",
            failures.isEmpty() ? null : "Fix test failures. Run " + command + " to see full details.",
            MavenResults.digest(errors, "Test"),
            95,
            90,
            issues
        );
    }

    private List<SurefireFailure> parseDetailed(List<String> lines) {
        List<SurefireFailure> failures = new ArrayList<>();
        SurefireFailure current = null;
        boolean inStackTrace = false;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);

            Matcher header = findFirst(TEST_HEADER, line);
            if (header != null && !matches(TEST_SUMMARY, line)) {
                if (current != null) {
                    failures.add(current);
                }
                current = SurefireFailure.fromTestId(header.group(1), "ERROR".equals(header.group(2)));
                inStackTrace = false;
                continue;
            }
            if (current == null) {
                continue;
            }

            if (current.exceptionType == null) {
                Matcher exception = matchLine(EXCEPTION_LINE, line.trim());
                if (exception != null) {
                    current.exceptionType = exception.group(1);
                    current.message = exception.group(2).trim();
                    if (current.message.isEmpty()) {
                        current.message = readDetachedMessage(lines, i + 1);
                    }
                    inStackTrace = true;
                    continue;
                }
            }

            if (inStackTrace) {
                Matcher frame = findFirst(STACK_FRAME, line);
                if (frame != null) {
                    String file = frame.group(2);
                    if (current.file == null && file.endsWith(".java")) {
                        current.file = file;
                        current.line = parseNumber(frame.group(3));
                    }
                    current.stackTrace.add("  at " + frame.group(1).trim() + "(" + file + ":" + frame.group(3) + ")");
                    if (current.stackTrace.size() >= MAX_STACK_FRAMES) {
                        inStackTrace = false;
                    }
                }
            }
        }
        if (current != null) {
            failures.add(current);
        }
        return failures;
    }

    /**
     * Reads a message printed below an exception line with an empty message, as AssertJ does.
     */
    private String readDetachedMessage(List<String> lines, int start) {
        List<String> messageLines = new ArrayList<>();
        for (int j = start; j < lines.size() && messageLines.size() < MAX_MESSAGE_LINES; j++) {
            String line = lines.get(j);
            if (matches(STACK_FRAME, line) || line.startsWith("[")) {
                break;
            }
            if (!line.isBlank()) {
                messageLines.add(line.trim());
            }
        }
        return String.join(" ", messageLines);
    }

    private List<SurefireFailure> parseShortForm(List<String> lines) {
        List<SurefireFailure> failures = new ArrayList<>();
        for (String line : lines) {
            Matcher shortForm = matchLine(SHORT_FORM, line);
            if (shortForm == null) {
                continue;
            }
            SurefireFailure failure = new SurefireFailure(shortForm.group(1), shortForm.group(2), false);
            failure.line = parseNumber(shortForm.group(3));
            failure.exceptionType = shortForm.group(4);
            failure.message = shortForm.group(5).trim();
            failures.add(failure);
        }
        return failures;
    }

    private static final class SurefireFailure {
        private final String testClass;
        private final String testMethod;
        private final boolean error;
        private final List<String> stackTrace = new ArrayList<>();
        private String file;
        private Integer line;
        private String exceptionType;
        private String message = "";

        SurefireFailure(String testClass, String testMethod, boolean error) {
            this.testClass = testClass;
            this.testMethod = testMethod;
            this.error = error;
        }

        /**
         * Splits {@code pkg.Class.method} on the last dot.
         */
        static SurefireFailure fromTestId(String testId, boolean error) {
            int dot = testId.lastIndexOf('.');
            if (dot <= 0) {
                return new SurefireFailure(testId, "", error);
            }
            return new SurefireFailure(testId.substring(0, dot), testId.substring(dot + 1), error);
        }

        FormattedError toError() {
            String testId = testMethod.isEmpty() ? testClass : testClass + "." + testMethod;
            String text = message.isBlank() ? "Test failed" : message;
            if (exceptionType != null && !text.contains(exceptionType)) {
                text = exceptionType + ": " + text;
            }
            if (!stackTrace.isEmpty()) {
                text += "\n" + stackTrace.get(0);
            }
            String path = file != null ? file : testClass.replace('.', '/') + ".java";
            return FormattedError.at(path, line, null, "Test: " + testId + "\n" + text).withContext(testId);
        }
    }

    @Override
    public List<ExtractorSample> getSamples() {
        return List.of(
            new ExtractorSample(
                "basic-assertion-failure",
                "Simple JUnit assertion failure",
                """
                [ERROR] Tests run: 1, Failures: 1, Errors: 0
                [ERROR] com.example.FooTest.testBar -- Time elapsed: 0.123 s <<< FAILURE!
                java.lang.AssertionError: Expected 5 but was 3
                \tat com.example.FooTest.testBar(FooTest.java:42)
                \tat java.base/java.lang.reflect.Method.invoke(Method.java:565)
                """,
                1,
                List.of("com.example.FooTest.testBar", "Expected 5 but was 3", "FooTest.java:42")),
            new ExtractorSample(
                "null-pointer-exception",
                "NullPointerException during test",
                """
                [INFO] --- maven-surefire-plugin:3.2.5:test (default-test) @ app ---
                [ERROR] Tests run: 1, Failures: 0, Errors: 1
                [ERROR] com.example.FooTest.testNull -- Time elapsed: 0.01 s <<< ERROR!
                java.lang.NullPointerException: Cannot invoke "String.length()" because "value" is null
                \tat com.example.FooTest.testNull(FooTest.java:77)
                """,
                1,
                List.of("java.lang.NullPointerException", "1 test failure(s): 0 failures, 1 errors")),
            new ExtractorSample(
                "assertj-failure",
                "AssertJ assertion with multi-line message",
                """
                [ERROR] Tests run: 1, Failures: 1, Errors: 0
                [ERROR] com.example.Test.testAssertJ -- <<< FAILURE!
                java.lang.AssertionError:

                Expecting actual:
                  "Hello World"
                to contain:
                  "Goodbye"
                \tat com.example.Test.testAssertJ(Test.java:25)
                """,
                1,
                List.of("Expecting actual: \"Hello World\" to contain: \"Goodbye\"", "Test.java:25"))
        );
    }
}
