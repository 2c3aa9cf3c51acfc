package com.errlens.core.extractor.impl.javascript;

import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.FormattedError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link MochaExtractor}.
 */
class MochaExtractorTest {

    private static final String MULTIPLE_FAILURES = """

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
        """;

    private MochaExtractor extractor;

    @BeforeEach
    void setUpExtractor() {
        extractor = new MochaExtractor();
    }

    @Test
    void extract_withNumberedEntries_extractsEveryFailure() {
        // When
        ErrorExtractorResult result = extractor.extract(MULTIPLE_FAILURES, null);

        // Then
        assertThat(result.totalErrors()).isEqualTo(3);
        assertThat(result.summary()).isEqualTo("3 test(s) failed");

        FormattedError first = result.errors().get(0);
        assertThat(first.file()).isEqualTo("test.js");
        assertThat(first.line()).isEqualTo(10);
        assertThat(first.column()).isEqualTo(15);
        assertThat(first.message()).isEqualTo("First error");
        assertThat(first.context()).isEqualTo("Suite > Test 1");

        assertThat(result.errors()).extracting(FormattedError::message)
            .containsExactly("First error", "Cannot read properties of null", "Values not equal");
    }

    @Test
    void extract_withDifferentErrorTypes_emitsGuidanceInEncounterOrder() {
        ErrorExtractorResult result = extractor.extract(MULTIPLE_FAILURES, null);

        assertThat(result.guidance()).isEqualTo(
            "Check for null/undefined values and type mismatches\nReview test assertions and expected values");
    }

    @Test
    void extract_withMultiLineHierarchy_joinsDescribeLevels() {
        // Given
        String output = """

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
            """;

        // When
        ErrorExtractorResult result = extractor.extract(output, null);

        // Then: the tree entry above the summary is not counted
        assertThat(result.totalErrors()).isEqualTo(1);
        FormattedError error = result.errors().get(0);
        assertThat(error.context())
            .isEqualTo("Calculator Test Matrix > Failure Type 1: Assertion Errors > should match expected value");
        assertThat(error.message()).isEqualTo("Expected 4 to equal 5");
        assertThat(error.location()).isEqualTo("/tmp/test.js:16:14");
    }

    @Test
    void extract_withRootLevelTestInRunTree_countsItOnce() {
        // Given: a test outside any describe block is numbered at two spaces in the tree as well
        String output = """

              ✔ adds
              1) divides by zero

              1 passing (6ms)
              1 failing

              1) divides by zero:
                 Error: Division by zero
                  at Context.<anonymous> (test/math.test.js:9:11)
            """;

        // When
        ErrorExtractorResult result = extractor.extract(output, null);

        // Then
        assertThat(result.totalErrors()).isEqualTo(1);
        FormattedError error = result.errors().get(0);
        assertThat(error.context()).isEqualTo("divides by zero");
        assertThat(error.message()).isEqualTo("Division by zero");
        assertThat(error.location()).isEqualTo("test/math.test.js:9:11");
    }

    @Test
    void extract_withTimeout_takesFileFromMessage() {
        // Given
        String output = """

              0 passing (2s)
              1 failing

              1) slow suite
                   waits forever:
                 Error: Timeout of 2000ms exceeded. For async tests and hooks, ensure "done()" is called; if returning a Promise, ensure it resolves. (/app/test/slow.test.js)
                  at listOnTimeout (node:internal/timers:573:17)
            """;

        // When
        ErrorExtractorResult result = extractor.extract(output, null);

        // Then
        FormattedError error = result.errors().get(0);
        assertThat(error.file()).isEqualTo("/app/test/slow.test.js");
        assertThat(error.line()).isNull();
        assertThat(error.context()).isEqualTo("slow suite > waits forever");
        assertThat(result.guidance()).isEqualTo("Increase test timeout or optimize async operations");
    }

    @Test
    void extract_withoutMochaWording_reportsInvalidFormat() {
        ErrorExtractorResult result = extractor.extract("Segmentation fault (core dumped)", null);

        assertThat(result.totalErrors()).isZero();
        assertThat(result.summary()).isEqualTo("Unable to parse Mocha output - invalid format");
        assertThat(result.metadata().confidence()).isZero();
        assertThat(result.metadata().issues()).containsExactly("Not Mocha output format");
    }

    @Test
    void detect_withSummaryAndEntries_returnsGenericWordingConfidence() {
        assertThat(extractor.detect(MULTIPLE_FAILURES).confidence()).isEqualTo(80);
    }

    @Test
    void detect_withSummaryOnly_returnsFallbackConfidence() {
        DetectionResult result = extractor.detect("  2 passing (5ms)\n  1 failing\n");

        assertThat(result.confidence()).isEqualTo(50);
    }
}
