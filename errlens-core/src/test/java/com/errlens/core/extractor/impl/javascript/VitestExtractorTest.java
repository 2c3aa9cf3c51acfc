package com.errlens.core.extractor.impl.javascript;

import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.FormattedError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link VitestExtractor}.
 */
class VitestExtractorTest {

    private static final String SINGLE_FAILURE = """
        FAIL  test/unit/config/environment.test.ts > EnvironmentConfig > should parse HTTP_PORT
        AssertionError: expected 3000 to be 9999 // Object.is equality
         ❯ test/unit/config/environment.test.ts:57:30
           57|     expect(config.HTTP_PORT).toBe(9999);
        """;

    private VitestExtractor extractor;

    @BeforeEach
    void setUpExtractor() {
        extractor = new VitestExtractor();
    }

    @Test
    void extract_withSingleFailure_extractsLocationMessageAndHierarchy() {
        // When
        ErrorExtractorResult result = extractor.extract(SINGLE_FAILURE, null);

        // Then
        assertThat(result.totalErrors()).isEqualTo(1);
        assertThat(result.summary()).isEqualTo("1 test failure(s)");

        FormattedError error = result.errors().get(0);
        assertThat(error.file()).isEqualTo("test/unit/config/environment.test.ts");
        assertThat(error.line()).isEqualTo(57);
        assertThat(error.column()).isEqualTo(30);
        assertThat(error.message()).isEqualTo("AssertionError: expected 3000 to be 9999 // Object.is equality");
        assertThat(error.context()).isEqualTo("EnvironmentConfig > should parse HTTP_PORT");
    }

    @Test
    void extract_withSingleFailure_rendersNumberedDigestWithSourceLine() {
        // When
        ErrorExtractorResult result = extractor.extract(SINGLE_FAILURE, null);

        // Then
        assertThat(result.errorSummary()).isEqualTo("""
            [Test 1/1] test/unit/config/environment.test.ts:57:30
            Test: EnvironmentConfig > should parse HTTP_PORT
            Error: AssertionError: expected 3000 to be 9999 // Object.is equality
            57| expect(config.HTTP_PORT).toBe(9999);""");
        assertThat(result.guidance()).isEqualTo("1 test(s) failed. Fix the assertion in the test file at the location"
            + " shown. Run: npm test -- <test-file> to verify the fix.");
    }

    @Test
    void extract_withSummaryTreeAndDetailSection_reportsEachFailureOnce() {
        // Given: the × line in the tree repeats the failure detailed below
        String output = """
             ❯ src/math.test.ts (2 tests | 1 failed) 5ms
               × adds numbers 3ms

            ⎯⎯⎯⎯⎯⎯⎯ Failed Tests 1 ⎯⎯⎯⎯⎯⎯⎯

             FAIL  src/math.test.ts > adds numbers
            AssertionError: expected 3 to be 4
             ❯ src/math.test.ts:5:17
            """;

        // When
        ErrorExtractorResult result = extractor.extract(output, null);

        // Then
        assertThat(result.totalErrors()).isEqualTo(1);
        assertThat(result.errors().get(0).location()).isEqualTo("src/math.test.ts:5:17");
        assertThat(result.errors().get(0).context()).isEqualTo("adds numbers");
    }

    @Test
    void extract_withLongErrorMessage_capsContinuationLinesWithTruncationMarker() {
        // Given: seven continuation lines under the error
        String output = """
             FAIL  src/report.test.ts > renders totals
            Error: render failed
            detail one
            detail two
            detail three
            detail four
            detail five
            detail six
            detail seven
             ❯ src/report.test.ts:8:11
            """;

        // When
        ErrorExtractorResult result = extractor.extract(output, null);

        // Then
        FormattedError error = result.errors().get(0);
        assertThat(error.message()).isEqualTo(
            "Error: render failed detail one detail two detail three detail four detail five ...(truncated)");
        assertThat(error.location()).isEqualTo("src/report.test.ts:8:11");
    }

    @Test
    void extract_withFiveContinuationLines_keepsMessageWhole() {
        String output = """
             FAIL  src/report.test.ts > renders totals
            Error: render failed
            detail one
            detail two
            detail three
            detail four
            detail five
             ❯ src/report.test.ts:8:11
            """;

        ErrorExtractorResult result = extractor.extract(output, null);

        assertThat(result.errors().get(0).message())
            .isEqualTo("Error: render failed detail one detail two detail three detail four detail five");
    }

    @Test
    void extract_withCoverageViolation_reportsAgainstConfigFile() {
        // Given
        String output = """
             Test Files  1139 passed (1139)
                  Tests  1139 passed (1139)

            ERROR: Coverage for functions (86.47%) does not meet global threshold (87%)
            """;

        // When
        ErrorExtractorResult result = extractor.extract(output, null);

        // Then
        assertThat(result.totalErrors()).isEqualTo(1);
        FormattedError error = result.errors().get(0);
        assertThat(error.file()).isEqualTo("vitest.config.ts");
        assertThat(error.context()).isEqualTo("Coverage Threshold");
        assertThat(error.message()).isEqualTo("Coverage for functions (86.47%) does not meet threshold (87%)");
    }

    @Test
    void extract_withUnhandledRejection_usesFirstApplicationFrame() {
        // Given
        String output = """
            ⎯⎯⎯⎯⎯⎯ Unhandled Rejection ⎯⎯⎯⎯⎯⎯
            TypeError: Cannot read properties of undefined (reading 'id')
             ❯ processTicksAndRejections node:internal/process/task_queues:95:5
             ❯ processUser src/users.ts:42:18
            """;

        // When
        ErrorExtractorResult result = extractor.extract(output, null);

        // Then
        assertThat(result.totalErrors()).isEqualTo(1);
        FormattedError error = result.errors().get(0);
        assertThat(error.context()).isEqualTo("Runtime Error");
        assertThat(error.message()).isEqualTo("TypeError: Cannot read properties of undefined (reading 'id')");
        assertThat(error.location()).isEqualTo("src/users.ts:42:18");
    }

    @Test
    void extract_withSeveralFailures_returnsPerFileGuidance() {
        // Given
        String output = """
            FAIL  test/a.test.ts > A > one
            AssertionError: expected 1 to be 2
             ❯ test/a.test.ts:3:10

            FAIL  test/b.test.ts > B > two
            Error: boom
             ❯ test/b.test.ts:8:4
            """;

        // When
        ErrorExtractorResult result = extractor.extract(output, null);

        // Then
        assertThat(result.totalErrors()).isEqualTo(2);
        assertThat(result.errors()).extracting(FormattedError::location)
            .containsExactly("test/a.test.ts:3:10", "test/b.test.ts:8:4");
        assertThat(result.guidance()).isEqualTo(
            "2 test(s) failed. Fix each failing test individually. Run: npm test -- <test-file> to test each file.");
    }

    @Test
    void detect_withRunHeader_returnsUnambiguousConfidence() {
        // Given
        String output = " RUN  v1.6.0 /app\n\n" + SINGLE_FAILURE;

        // When
        DetectionResult result = extractor.detect(output);

        // Then
        assertThat(result.confidence()).isEqualTo(100);
        assertThat(result.patterns()).startsWith("RUN vX.Y.Z header");
    }

    @Test
    void detect_withTwoMarkers_returnsStrongConfidence() {
        assertThat(extractor.detect(SINGLE_FAILURE).confidence()).isEqualTo(90);
    }

    @Test
    void detect_withSingleMarker_returnsBelowThreshold() {
        DetectionResult result = extractor.detect("   × adds numbers 3ms");

        assertThat(result.confidence()).isEqualTo(70);
        assertThat(result.confidence()).isLessThan(extractor.getDetectionThreshold());
    }
}
