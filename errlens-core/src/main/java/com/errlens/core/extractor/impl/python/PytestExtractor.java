package com.errlens.core.extractor.impl.python;

import com.errlens.core.assembler.ResultAssembler;
import com.errlens.core.assembler.TestFailure;
import com.errlens.core.extractor.DetectionConfidence;
import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.extractor.ExtractorHints;
import com.errlens.core.extractor.ExtractorSample;
import com.errlens.core.extractor.base.AbstractLineExtractor;
import com.errlens.core.extractor.base.ExtractorPatterns;
import com.errlens.core.model.ErrorExtractorResult;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extractor for pytest console output.
 *
 * <p>The {@code FAILURES} and {@code ERRORS} sections are the rich sources: each
 * {@code ___ name ___} block carries the {@code E   } message lines and the
 * {@code path.py:line: ExcType} location. The {@code short test summary info}
 * lines are only used when neither section produced a record, e.g. with
 * {@code -q --tb=no}.
 */
public class PytestExtractor extends AbstractLineExtractor {

    private static final Pattern PLATFORM = Pattern.compile("platform\\s+\\S+\\s+--\\s+Python\\s+[\\d.]+,\\s+pytest-[\\d.]+");
    private static final Pattern PY_TEST_PATHS = Pattern.compile("(?:FAILED|ERROR)\\s+\\S+\\.py");
    private static final Pattern PASSED_COUNT = Pattern.compile("\\d+\\s+passed");
    private static final Pattern FAILED_COUNT = Pattern.compile("\\d+\\s+failed");
    private static final Pattern ERROR_COUNT = Pattern.compile("\\d+\\s+error");
    private static final String SHORT_SUMMARY = "short test summary";
    private static final String FAILURES_SECTION = "= FAILURES =";
    private static final String ERRORS_SECTION = "= ERRORS =";

    private static final Pattern SECTION_HEADER = Pattern.compile("^={3,}\\s");
    private static final Pattern BLOCK_HEADER = Pattern.compile("^_{3,}\\s+(.+?)\\s+_{3,}$");
    private static final Pattern COLLECTING_HEADER = Pattern.compile("^_{3,}\\s+ERROR\\s+collecting\\s+(.+?)\\s+_{3,}$");
    private static final Pattern E_LINE = Pattern.compile("^E\\s{3}(.+)$");
    private static final Pattern FAILURE_LOCATION = Pattern.compile("^(\\S[^:]*\\.py):(\\d+):\\s*(?!in\\s)(\\w+)\\s*$");
    private static final Pattern TRACE_FRAME = Pattern.compile("^(\\S[^:]*\\.py):(\\d+):\\s*in\\s+");
    private static final Pattern SUMMARY_FAILED = Pattern.compile("^FAILED\\s+(\\S+\\.py)(?:::(\\S+))?\\s+-\\s+(.+)$");
    private static final Pattern SUMMARY_ERROR = Pattern.compile("^ERROR\\s+(\\S+\\.py)\\s+-\\s+(.+)$");

    public PytestExtractor() {
        super("pytest", "Extracts Python pytest test framework errors", "pytest", "testing", "python");
    }

    @Override
    public ExtractorHints getHints() {
        return ExtractorHints.anyOf("pytest", ".py::", ".py")
            .withForbidden("at <Jasmine>", "at Context.<anonymous>");
    }

    @Override
    public int getPriority() {
        return 92;
    }

    @Override
    public int getDetectionThreshold() {
        return 85;
    }

    @Override
    protected DetectionResult detectFormat(String output) {
        boolean pyTestPaths = matches(PY_TEST_PATHS, output);
        boolean failureEvidence = pyTestPaths
            || output.contains(FAILURES_SECTION)
            || output.contains(ERRORS_SECTION)
            || matches(FAILED_COUNT, output)
            || matches(ERROR_COUNT, output);

        if (!failureEvidence) {
            return DetectionResult.none();
        }
        if (matches(PLATFORM, output)) {
            return detected(DetectionConfidence.DISTINCTIVE.score(),
                "Python pytest output detected (platform line with pytest version)", List.of("pytest platform line"));
        }
        if (output.contains(SHORT_SUMMARY) && pyTestPaths) {
            return detected(DetectionConfidence.STRONG.score(),
                "Python pytest output detected (short test summary with .py paths)",
                List.of(SHORT_SUMMARY, "FAILED/ERROR .py paths"));
        }
        boolean pytestSummary = matches(PASSED_COUNT, output)
            && (matches(FAILED_COUNT, output) || matches(ERROR_COUNT, output)
                || output.contains(FAILURES_SECTION) || output.contains(ERRORS_SECTION));
        if (pytestSummary && pyTestPaths) {
            return detected(DetectionConfidence.SINGLE_SIGNAL.score(),
                "Possible pytest output (summary format with .py paths)",
                List.of("pytest summary format", "FAILED/ERROR .py paths"));
        }
        return DetectionResult.none();
    }

    @Override
    protected ErrorExtractorResult extractErrors(String output, String context) {
        List<String> lines = lines(output);
        List<TestFailure> failures = new ArrayList<>(parseFailuresSection(lines));
        failures.addAll(parseErrorsSection(lines));
        if (!failures.isEmpty()) {
            return ResultAssembler.fromTestFailures(failures, 95, List.of());
        }

        List<TestFailure> summary = parseShortSummary(lines);
        if (!summary.isEmpty()) {
            return ResultAssembler.fromTestFailures(summary, 90, List.of());
        }
        return ResultAssembler.fromTestFailures(List.of(), 95, List.of());
    }

    // ==================== FAILURES section ====================

    private List<TestFailure> parseFailuresSection(List<String> lines) {
        List<TestFailure> failures = new ArrayList<>();
        int i = sectionStart(lines, FAILURES_SECTION);
        if (i < 0) {
            return failures;
        }

        while (i < lines.size()) {
            String line = lines.get(i);
            if (isSectionHeader(line, "FAILURES")) {
                break;
            }
            Matcher block = matchLine(BLOCK_HEADER, line);
            if (block == null) {
                i++;
                continue;
            }

            List<String> messageLines = new ArrayList<>();
            String file = null;
            Integer lineNumber = null;
            String errorType = null;

            int j = i + 1;
            for (; j < lines.size() && !isBoundary(lines.get(j), "FAILURES"); j++) {
                String blockLine = lines.get(j);
                Matcher eLine = matchLine(E_LINE, blockLine);
                if (eLine != null) {
                    messageLines.add(eLine.group(1).trim());
                }
                Matcher location = matchLine(FAILURE_LOCATION, blockLine);
                if (location != null) {
                    file = location.group(1);
                    lineNumber = parseNumber(location.group(2));
                    if (errorType == null) {
                        errorType = location.group(3);
                    }
                }
            }

            String message = messageLines.isEmpty() ? "Test failed" : String.join(" ", messageLines).trim();
            if (errorType == null) {
                errorType = ExtractorPatterns.extractErrorType(message).orElse(null);
            }
            failures.add(new TestFailure(file, lineNumber, null, message, block.group(1), errorType, null));
            i = j;
        }
        return failures;
    }

    // ==================== ERRORS section ====================

    private List<TestFailure> parseErrorsSection(List<String> lines) {
        List<TestFailure> errors = new ArrayList<>();
        int i = sectionStart(lines, ERRORS_SECTION);
        if (i < 0) {
            return errors;
        }

        while (i < lines.size()) {
            String line = lines.get(i);
            if (isSectionHeader(line, "ERRORS")) {
                break;
            }
            Matcher block = matchLine(COLLECTING_HEADER, line);
            if (block == null) {
                i++;
                continue;
            }

            String testFile = block.group(1);
            String message = null;
            String file = null;
            Integer lineNumber = null;

            int j = i + 1;
            for (; j < lines.size() && !isBoundary(lines.get(j), "ERRORS"); j++) {
                String blockLine = lines.get(j);
                Matcher frame = findFirst(TRACE_FRAME, blockLine);
                if (frame != null) {
                    file = frame.group(1);
                    lineNumber = parseNumber(frame.group(2));
                }
                Matcher eLine = matchLine(E_LINE, blockLine);
                if (eLine != null) {
                    message = eLine.group(1).trim();
                }
            }

            String errorType = ExtractorPatterns.extractErrorType(message).orElse(null);
            errors.add(new TestFailure(file != null ? file : testFile, lineNumber, null,
                message != null ? message : "Collection error", "ERROR collecting " + testFile, errorType, null));
            i = j;
        }
        return errors;
    }

    // ==================== Short summary ====================

    private List<TestFailure> parseShortSummary(List<String> lines) {
        List<TestFailure> failures = new ArrayList<>();
        for (String line : lines) {
            Matcher failed = matchLine(SUMMARY_FAILED, line);
            if (failed != null) {
                String message = failed.group(3).trim();
                String testName = failed.group(2) != null ? failed.group(2) : failed.group(1);
                failures.add(new TestFailure(failed.group(1), null, null, message, testName,
                    ExtractorPatterns.extractErrorType(message).orElse(null), null));
                continue;
            }
            Matcher error = matchLine(SUMMARY_ERROR, line);
            if (error != null) {
                String message = error.group(2).trim();
                failures.add(new TestFailure(error.group(1), null, null, message, "ERROR collecting " + error.group(1),
                    ExtractorPatterns.extractErrorType(message).orElse(null), null));
            }
        }
        return failures;
    }

    /**
     * Returns the index of the first line after the section header, or -1.
     */
    private static int sectionStart(List<String> lines, String marker) {
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).contains(marker)) {
                return i + 1;
            }
        }
        return -1;
    }

    private boolean isSectionHeader(String line, String currentSection) {
        return matches(SECTION_HEADER, line) && !line.contains(currentSection);
    }

    private boolean isBoundary(String line, String currentSection) {
        return matches(BLOCK_HEADER, line) || isSectionHeader(line, currentSection);
    }

    @Override
    public List<ExtractorSample> getSamples() {
        return List.of(
            new ExtractorSample(
                "collection-errors",
                "Pytest collection errors (import failures)",
                """
                ============================= test session starts ==============================
                platform darwin -- Python 3.9.6, pytest-8.4.1, pluggy-1.6.0
                rootdir: /Users/dev/project
                collected 10 items / 2 errors

                ==================================== ERRORS ====================================
                ________ ERROR collecting tests/test_foo.py ________
                tests/test_foo.py:9: in <module>
                    from mymodule import MyClass
                mymodule.py:50: in <module>
                    class MyClass:
                mymodule.py:55: in MyClass
                    def method(self, arg: str | None = None) -> dict:
                E   TypeError: unsupported operand type(s) for |: 'type' and 'NoneType'
                ________ ERROR collecting tests/test_bar.py ________
                tests/test_bar.py:3: in <module>
                    from missing_module import func
                E   ModuleNotFoundError: No module named 'missing_module'
                =========================== short test summary info ============================
                ERROR tests/test_foo.py - TypeError: unsupported operand type(s) for |: 'type' and 'NoneType'
                ERROR tests/test_bar.py - ModuleNotFoundError: No module named 'missing_module'
                ========================= 2 errors in 0.50s =========================
                """,
                2,
                List.of("TypeError", "ModuleNotFoundError", "mymodule.py:55")),
            new ExtractorSample(
                "assertion-failures",
                "Pytest assertion failures in test functions",
                """
                ============================= test session starts ==============================
                platform linux -- Python 3.11.0, pytest-7.4.0, pluggy-1.3.0
                rootdir: /home/dev/project
                collected 5 items

                tests/test_calc.py F.                                                    [ 40%]
                tests/test_utils.py .F.                                                  [ 100%]

                ================================== FAILURES ===================================
                ___________________________ TestCalc.test_divide ___________________________

                    def test_divide(self):
                >       assert divide(10, 0) == float('inf')
                E       ZeroDivisionError: division by zero

                tests/test_calc.py:15: ZeroDivisionError
                ___________________________ TestUtils.test_parse ___________________________

                    def test_parse(self):
                >       assert parse("abc") == 123
                E       AssertionError: assert None == 123
                E        +  where None = parse('abc')

                tests/test_utils.py:22: AssertionError
                =========================== short test summary info ============================
                FAILED tests/test_calc.py::TestCalc::test_divide - ZeroDivisionError: division by zero
                FAILED tests/test_utils.py::TestUtils::test_parse - AssertionError: assert None == 123
                ========================= 2 failed, 3 passed in 0.45s =========================
                """,
                2,
                List.of("ZeroDivisionError", "AssertionError: assert None == 123", "tests/test_calc.py:15"))
        );
    }
}
