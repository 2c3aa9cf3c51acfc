package com.errlens.core.extractor.impl.python;

import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.FormattedError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link PytestExtractor}.
 */
class PytestExtractorTest {

    private static final String ASSERTION_FAILURES = """
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
        """;

    private PytestExtractor extractor;

    @BeforeEach
    void setUpExtractor() {
        extractor = new PytestExtractor();
    }

    @Test
    void extract_withFailuresSection_prefersRichBlocksOverShortSummary() {
        // When
        ErrorExtractorResult result = extractor.extract(ASSERTION_FAILURES, null);

        // Then: locations come from the FAILURES blocks, not the summary lines
        assertThat(result.totalErrors()).isEqualTo(2);
        assertThat(result.summary()).isEqualTo("2 test(s) failed");

        FormattedError divide = result.errors().get(0);
        assertThat(divide.file()).isEqualTo("tests/test_calc.py");
        assertThat(divide.line()).isEqualTo(15);
        assertThat(divide.message()).isEqualTo("ZeroDivisionError: division by zero");
        assertThat(divide.context()).isEqualTo("TestCalc.test_divide");

        FormattedError parse = result.errors().get(1);
        assertThat(parse.location()).isEqualTo("tests/test_utils.py:22");
        assertThat(parse.message()).startsWith("AssertionError: assert None == 123 +");

        assertThat(result.guidance()).isEqualTo("Review test assertions and expected values");
        assertThat(result.metadata().confidence()).isEqualTo(95);
    }

    @Test
    void extract_withCollectionErrors_usesLastTraceFrame() {
        // Given
        String output = """
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
            """;

        // When
        ErrorExtractorResult result = extractor.extract(output, null);

        // Then
        assertThat(result.totalErrors()).isEqualTo(2);

        FormattedError foo = result.errors().get(0);
        assertThat(foo.location()).isEqualTo("mymodule.py:55");
        assertThat(foo.context()).isEqualTo("ERROR collecting tests/test_foo.py");
        assertThat(foo.message()).isEqualTo("TypeError: unsupported operand type(s) for |: 'type' and 'NoneType'");

        FormattedError bar = result.errors().get(1);
        assertThat(bar.location()).isEqualTo("tests/test_bar.py:3");
        assertThat(bar.message()).isEqualTo("ModuleNotFoundError: No module named 'missing_module'");

        assertThat(result.guidance()).isEqualTo("Check for null/undefined values and type mismatches");
    }

    @Test
    void extract_withShortSummaryOnly_fallsBackToSummaryLines() {
        // Given: pytest -q --tb=no
        String output = """
            =========================== short test summary info ============================
            FAILED tests/test_a.py::test_one - assert 1 == 2
            FAILED tests/test_b.py::test_two - KeyError: 'x'
            2 failed in 0.05s
            """;

        // When
        ErrorExtractorResult result = extractor.extract(output, null);

        // Then
        assertThat(result.totalErrors()).isEqualTo(2);
        FormattedError first = result.errors().get(0);
        assertThat(first.file()).isEqualTo("tests/test_a.py");
        assertThat(first.line()).isNull();
        assertThat(first.message()).isEqualTo("assert 1 == 2");
        assertThat(first.context()).isEqualTo("test_one");
        assertThat(result.metadata().confidence()).isEqualTo(90);
    }

    @Test
    void detect_withPlatformLine_returnsDistinctiveConfidence() {
        DetectionResult result = extractor.detect(ASSERTION_FAILURES);

        assertThat(result.confidence()).isEqualTo(95);
        assertThat(result.patterns()).containsExactly("pytest platform line");
    }

    @Test
    void detect_withShortSummaryAndPaths_returnsStrongConfidence() {
        String output = "=== short test summary info ===\nFAILED tests/test_a.py::test_one - assert 1 == 2\n";

        assertThat(extractor.detect(output).confidence()).isEqualTo(90);
    }

    @Test
    void detect_withoutFailureEvidence_returnsNone() {
        String output = "platform linux -- Python 3.11.0, pytest-7.4.0, pluggy-1.3.0\n3 passed in 0.02s\n";

        assertThat(extractor.detect(output).matched()).isFalse();
    }
}
