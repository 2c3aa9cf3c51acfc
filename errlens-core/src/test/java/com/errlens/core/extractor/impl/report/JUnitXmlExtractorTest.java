package com.errlens.core.extractor.impl.report;

import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.FormattedError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

/**
 * Functional tests for {@link JUnitXmlExtractor}.
 */
class JUnitXmlExtractorTest {

    private JUnitXmlExtractor extractor;

    @BeforeEach
    void setUpExtractor() {
        extractor = new JUnitXmlExtractor();
    }

    @Test
    void extract_surefireReport_resolvesSourceFileFromStackFrame() {
        // Given
        String output = """
            <?xml version="1.0" encoding="UTF-8"?>
            <testsuite name="com.example.OrderServiceTest" tests="3" failures="1" errors="1" skipped="0">
              <testcase name="calculatesTotal" classname="com.example.OrderServiceTest" time="0.01">
                <failure message="expected: &lt;42&gt; but was: &lt;41&gt;" type="org.opentest4j.AssertionFailedError">org.opentest4j.AssertionFailedError: expected: &lt;42&gt; but was: &lt;41&gt;
            \tat com.example.OrderServiceTest.calculatesTotal(OrderServiceTest.java:27)
            </failure>
              </testcase>
              <testcase name="rejectsEmptyOrder" classname="com.example.OrderServiceTest" time="0.002">
                <error message="Cannot invoke &quot;java.util.List.size()&quot; because &quot;items&quot; is null" type="java.lang.NullPointerException">java.lang.NullPointerException
            \tat com.example.OrderServiceTest.rejectsEmptyOrder(OrderServiceTest.java:41)
            </error>
              </testcase>
              <testcase name="passes" classname="com.example.OrderServiceTest" time="0.001"/>
            </testsuite>
            """;

        // When
        ErrorExtractorResult result = extractor.extract(output, null);

        // Then
        assertThat(result.totalErrors()).isEqualTo(2);
        assertThat(result.summary()).isEqualTo("2 test(s) failed");

        FormattedError failure = result.errors().get(0);
        assertThat(failure.file()).isEqualTo("com/example/OrderServiceTest.java");
        assertThat(failure.line()).isEqualTo(27);
        assertThat(failure.message()).isEqualTo("expected: <42> but was: <41>");
        assertThat(failure.context()).isEqualTo("calculatesTotal");

        FormattedError error = result.errors().get(1);
        assertThat(error.location()).isEqualTo("com/example/OrderServiceTest.java:41");
        assertThat(error.message()).isEqualTo("Cannot invoke \"java.util.List.size()\" because \"items\" is null");

        assertThat(result.guidance()).isEqualTo("Review test assertions and expected values");
        assertThat(result.metadata().confidence()).isEqualTo(95);
        assertThat(result.metadata().issues()).isEmpty();
    }

    @Test
    void extract_vitestReport_usesArrowLocationAndDecodedTestName() {
        // Given
        String output = """
            <?xml version="1.0" encoding="UTF-8" ?>
            <testsuites name="vitest tests" tests="1" failures="1" errors="0" time="0.002">
                <testsuite name="test/calculator.test.ts" tests="1" failures="1" errors="0" skipped="0" time="0.002">
                    <testcase classname="test/calculator.test.ts" name="Calculator &gt; should add numbers" time="0.001">
                        <failure message="expected 4 to be 5 // Object.is equality" type="AssertionError">
            AssertionError: expected 4 to be 5 // Object.is equality
             ❯ test/calculator.test.ts:10:21
                        </failure>
                    </testcase>
                </testsuite>
            </testsuites>
            """;

        // When
        ErrorExtractorResult result = extractor.extract(output, null);

        // Then
        assertThat(result.totalErrors()).isEqualTo(1);
        FormattedError failure = result.errors().get(0);
        assertThat(failure.location()).isEqualTo("test/calculator.test.ts:10:21");
        assertThat(failure.message()).isEqualTo("expected 4 to be 5 // Object.is equality");
        assertThat(failure.context()).isEqualTo("Calculator > should add numbers");
        assertThat(result.errorSummary())
            .isEqualTo("test/calculator.test.ts:10: expected 4 to be 5 // Object.is equality (Calculator > should add numbers)");
    }

    @Test
    void extract_nestedSuites_collectsFailuresFromEverySuite() {
        // Given: the first suite has a single testcase, the second a repeated one
        String output = """
            <testsuites>
              <testsuite name="a">
                <testcase classname="a" name="one"><failure message="boom one"/></testcase>
              </testsuite>
              <testsuite name="b">
                <testcase classname="b" name="two"><failure message="boom two"/></testcase>
                <testcase classname="b" name="three"/>
              </testsuite>
            </testsuites>
            """;

        // When
        ErrorExtractorResult result = extractor.extract(output, null);

        // Then
        assertThat(result.totalErrors()).isEqualTo(2);
        assertThat(result.errors()).extracting(FormattedError::message).containsExactly("boom one", "boom two");
        assertThat(result.errors()).extracting(FormattedError::context).containsExactly("one", "two");
    }

    @Test
    void extract_malformedXml_recoversFailuresByScanning() {
        // Given: an unescaped '<' inside an attribute value
        String output = """
            <?xml version="1.0" encoding="UTF-8"?>
            <testsuite name="math" tests="1" failures="1">
              <testcase classname="math" name="compares">
                <failure message="expected 1 < 0" type="AssertionError">AssertionError: expected 1 &lt; 0</failure>
              </testcase>
            </testsuite>
            """;

        // When
        ErrorExtractorResult result = extractor.extract(output, null);

        // Then
        assertThat(result.totalErrors()).isEqualTo(1);
        FormattedError failure = result.errors().get(0);
        assertThat(failure.file()).isEqualTo("math");
        assertThat(failure.message()).isEqualTo("expected 1 < 0");
        assertThat(failure.context()).isEqualTo("compares");
        assertThat(result.metadata().confidence()).isEqualTo(85);
        assertThat(result.metadata().issues())
            .containsExactly("Malformed XML - failures recovered by pattern scanning");
    }

    @Test
    void extract_truncatedReport_recoversUnclosedTestcases() {
        // Given: the report was cut off inside the last failure
        String output = """
            <?xml version="1.0" encoding="UTF-8"?>
            <testsuite name="math" tests="3" failures="3">
              <testcase classname="math" name="adds">
                <failure message="expected 3" type="AssertionError">AssertionError: expected 3
              <testcase classname="math" name="divides"/>
              <testcase classname="math" name="subtracts">
                <error type="java.lang.IllegalStateException">java.lang.IllegalStateException: negative
                at com.example.Calc.sub(Calc.java:9)
              </testcase>
              <testcase classname="math" name="multiplies">
                <failure message="expected 6" type="AssertionError">AssertionError: exp""";

        // When
        ErrorExtractorResult result = extractor.extract(output, null);

        // Then
        assertThat(result.totalErrors()).isEqualTo(3);
        assertThat(result.errors()).extracting(FormattedError::context)
            .containsExactly("adds", "subtracts", "multiplies");
        assertThat(result.errors()).extracting(FormattedError::message)
            .containsExactly("expected 3", "java.lang.IllegalStateException: negative", "expected 6");
        assertThat(result.metadata().issues())
            .containsExactly("Malformed XML - failures recovered by pattern scanning");
    }

    @Test
    void extract_manyUnclosedTestcases_scansInLinearTime() {
        // Given: thousands of openers that never close, in a report the XML parser rejects up front
        StringBuilder output = new StringBuilder("<testsuite name=\"big\" filter=\"a < b\">\n");
        for (int i = 0; i < 20_000; i++) {
            output.append("<testcase classname=\"big\" name=\"t").append(i).append("\">\n");
        }
        output.append("<testcase classname=\"big\" name=\"last\"><failure message=\"boom\"/>\n");

        // When
        ErrorExtractorResult result = assertTimeoutPreemptively(Duration.ofSeconds(2),
            () -> extractor.extract(output.toString(), null));

        // Then
        assertThat(result.totalErrors()).isEqualTo(1);
        assertThat(result.errors().get(0).message()).isEqualTo("boom");
        assertThat(result.errors().get(0).context()).isEqualTo("last");
    }

    @Test
    void extract_withoutTestsuiteElement_reportsInvalidFormat() {
        // When
        ErrorExtractorResult result = extractor.extract("Build finished with 2 failures", null);

        // Then
        assertThat(result.totalErrors()).isZero();
        assertThat(result.summary()).isEqualTo("Unable to parse JUnit XML - invalid format");
        assertThat(result.guidance()).isEqualTo("Ensure the input is valid JUnit XML format");
        assertThat(result.metadata().confidence()).isZero();
    }

    @Test
    void detect_withDeclarationAndFailure_isUnambiguous() {
        // Given
        String output = """
            <?xml version="1.0"?>
            <testsuite name="x"><testcase name="t"><failure message="m"/></testcase></testsuite>
            """;

        // When
        DetectionResult detection = extractor.detect(output);

        // Then
        assertThat(detection.confidence()).isEqualTo(100);
        assertThat(detection.patterns()).containsExactly("<?xml> declaration", "<testsuite>", "<failure>");
        assertThat(extractor.detect(output.replace("<?xml version=\"1.0\"?>", "")).confidence()).isEqualTo(90);
    }

    @Test
    void detect_passingReport_isNotDetected() {
        // Given
        String output = """
            <?xml version="1.0" encoding="UTF-8"?>
            <testsuite name="math" tests="1" failures="0"><testcase name="adds" classname="math"/></testsuite>
            """;

        // When / Then
        assertThat(extractor.detect(output).matched()).isFalse();
    }
}
