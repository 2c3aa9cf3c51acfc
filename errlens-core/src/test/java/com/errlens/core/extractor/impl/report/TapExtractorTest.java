package com.errlens.core.extractor.impl.report;

import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.FormattedError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link TapExtractor}.
 */
class TapExtractorTest {

    private TapExtractor extractor;

    @BeforeEach
    void setUpExtractor() {
        extractor = new TapExtractor();
    }

    @Test
    void extract_withYamlDiagnostics_readsLocationAndExpectedActual() {
        // Given
        String output = """
            TAP version 13
            # Test › should pass assertion
            not ok 1 should have 5 errors
              ---
                operator: equal
                expected: 5
                actual:   1
                at: Test.<anonymous> (file:///tmp/test.js:28:5)
              ...
            """;

        // When
        ErrorExtractorResult result = extractor.extract(output, null);

        // Then
        assertThat(result.totalErrors()).isEqualTo(1);
        FormattedError failure = result.errors().get(0);
        assertThat(failure.location()).isEqualTo("/tmp/test.js:28:5");
        assertThat(failure.message()).isEqualTo("should have 5 errors (expected: 5, actual: 1)");
        assertThat(failure.context()).isEqualTo("Test › should pass assertion");
        assertThat(failure.guidance()).isEqualTo("Review the assertion logic and expected vs actual values");

        assertThat(result.summary()).isEqualTo("1 test(s) failed");
        assertThat(result.guidance()).isEqualTo("Review the assertion logic and expected vs actual values");
        assertThat(result.errorSummary())
            .isEqualTo("/tmp/test.js:28: should have 5 errors (expected: 5, actual: 1) (Test › should pass assertion)");
        assertThat(result.metadata().confidence()).isEqualTo(95);
        assertThat(result.metadata().detection().extractor()).isEqualTo("tap");
    }

    @Test
    void extract_mixedResults_keepsOnlyNotOkLinesWithTheirComment() {
        // Given
        String output = """
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
            """;

        // When
        ErrorExtractorResult result = extractor.extract(output, null);

        // Then
        assertThat(result.totalErrors()).isEqualTo(2);
        assertThat(result.errors()).extracting(FormattedError::location)
            .containsExactly("test/parser.test.js:41:3", "/work/test/loader.test.js:12:9");
        assertThat(result.errors()).extracting(FormattedError::context).containsExactly("parser", "loader");
        assertThat(result.guidance()).isEqualTo("""
            Increase timeout limit or optimize async operations
            Verify file path exists and permissions are correct""");
    }

    @Test
    void extract_withoutDiagnostics_usesDescriptionAndUnknownFile() {
        // Given
        String output = """
            TAP version 13
            # render
            not ok 1 - TypeError: Cannot read properties of undefined (reading 'id')
            1..1
            """;

        // When
        ErrorExtractorResult result = extractor.extract(output, null);

        // Then
        FormattedError failure = result.errors().get(0);
        assertThat(failure.file()).isEqualTo("unknown");
        assertThat(failure.line()).isNull();
        assertThat(failure.message()).isEqualTo("TypeError: Cannot read properties of undefined (reading 'id')");
        assertThat(result.guidance()).isEqualTo("Check for null/undefined values before accessing properties");
    }

    @Test
    void extract_passingTap_returnsEmptyResult() {
        // Given
        String output = """
            TAP version 13
            # math
            ok 1 adds
            """;

        // When
        ErrorExtractorResult result = extractor.extract(output, null);

        // Then
        assertThat(result.totalErrors()).isZero();
        assertThat(result.summary()).isEqualTo("0 TAP failure(s) failed");
    }

    @Test
    void extract_nonTapOutput_reportsLowConfidence() {
        // When
        ErrorExtractorResult result = extractor.extract("Something went wrong", null);

        // Then
        assertThat(result.summary()).isEqualTo("Not TAP output");
        assertThat(result.metadata().detection().reason()).isEqualTo("Not TAP output");
    }

    @Test
    void detect_fullTapStream_scoresEveryMarker() {
        // Given
        String output = """
            TAP version 13
            # math
            not ok 1 divides
              ---
                message: 'division by zero'
              ...
            """;

        // When
        DetectionResult detection = extractor.detect(output);

        // Then
        assertThat(detection.confidence()).isEqualTo(75);
        assertThat(detection.patterns()).containsExactly(
            "TAP version header", "not ok N failure marker", "YAML diagnostic block (---)", "Test comment marker (#)");
    }

    @Test
    void detect_withoutFailureMarker_isNotDetected() {
        // Given: header and comment score 40 but nothing failed
        String output = """
            TAP version 13
            # math
            ok 1 adds
            """;

        // When / Then
        assertThat(extractor.detect(output).matched()).isFalse();
        assertThat(extractor.detect("not ok 1 lonely").matched()).isFalse();
    }

    @Test
    void classify_mapsWordingToGuidanceKeys() {
        assertThat(TapExtractor.classify("Test timed out")).isEqualTo("timeout");
        assertThat(TapExtractor.classify("ENOENT: missing")).isEqualTo("file-not-found");
        assertThat(TapExtractor.classify("TypeError: x is not a function")).isEqualTo("type-error");
        assertThat(TapExtractor.classify("should equal 3")).isEqualTo("assertion");
        assertThat(TapExtractor.classify("plain failure")).isNull();
    }
}
