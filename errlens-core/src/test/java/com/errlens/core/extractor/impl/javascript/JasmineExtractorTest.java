package com.errlens.core.extractor.impl.javascript;

import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.FormattedError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link JasmineExtractor}.
 */
class JasmineExtractorTest {

    private static final String MULTIPLE_FAILURES = """
        Started
        FFF

        Failures:
        1) Suite > Test 1
          Message:
            Expected 1 to equal 2.
          Stack:
                at UserContext.<anonymous> (test.js:10:15)

        2) Suite > Test 2
          Message:
            TypeError: Cannot read properties of null
          Stack:
                at UserContext.<anonymous> (test.js:20:15)

        3) Suite > Test 3
          Message:
            Error: ENOENT: no such file or directory
          Stack:
                at UserContext.<anonymous> (test.js:30:15)

        3 specs, 3 failures
        """;

    private JasmineExtractor extractor;

    @BeforeEach
    void setUpExtractor() {
        extractor = new JasmineExtractor();
    }

    @Test
    void extract_withFailuresSection_readsMessageAndStackBlocks() {
        // When
        ErrorExtractorResult result = extractor.extract(MULTIPLE_FAILURES, null);

        // Then
        assertThat(result.totalErrors()).isEqualTo(3);

        FormattedError first = result.errors().get(0);
        assertThat(first.location()).isEqualTo("test.js:10:15");
        assertThat(first.message()).isEqualTo("Expected 1 to equal 2.");
        assertThat(first.context()).isEqualTo("Suite > Test 1");

        assertThat(result.errors().get(1).message()).isEqualTo("TypeError: Cannot read properties of null");
        assertThat(result.errors().get(2).location()).isEqualTo("test.js:30:15");
    }

    @Test
    void extract_withMixedFailures_combinesGuidance() {
        ErrorExtractorResult result = extractor.extract(MULTIPLE_FAILURES, null);

        assertThat(result.guidance()).isEqualTo("""
            Review test assertions and expected values
            Check for null/undefined values and type mismatches
            Verify file paths and ensure test fixtures exist""");
    }

    @Test
    void extract_withJasmineFramesAroundUserFrame_skipsInternalFrames() {
        // Given
        String output = """
            Failures:
            1) Calculator adds
              Message:
                Expected 4 to equal 5.
              Stack:
                    at <Jasmine>
                    at UserContext.<anonymous> (/private/tmp/calc.test.js:9:17)
                    at <Jasmine>

            1 spec, 1 failure
            """;

        // When
        ErrorExtractorResult result = extractor.extract(output, null);

        // Then
        assertThat(result.errors().get(0).location()).isEqualTo("/private/tmp/calc.test.js:9:17");
    }

    @Test
    void extract_withoutJasmineWording_reportsInvalidFormat() {
        ErrorExtractorResult result = extractor.extract("Segmentation fault (core dumped)", null);

        assertThat(result.summary()).isEqualTo("Unable to parse Jasmine output - invalid format");
        assertThat(result.metadata().issues()).containsExactly("Not Jasmine output format");
    }

    @Test
    void detect_withFailuresSection_returnsSingleSignalConfidence() {
        DetectionResult result = extractor.detect(MULTIPLE_FAILURES);

        assertThat(result.confidence()).isEqualTo(85);
        assertThat(result.patterns())
            .containsExactly("Failures: section with numbered entries", "N specs, M failures summary");
    }

    @Test
    void detect_withZeroFailures_returnsNone() {
        assertThat(extractor.detect("3 specs, 0 failures").matched()).isFalse();
    }
}
