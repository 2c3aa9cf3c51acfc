package com.errlens.core.extractor.impl.report;

import com.errlens.core.assembler.ResultAssembler;
import com.errlens.core.assembler.TestFailure;
import com.errlens.core.extractor.DetectionConfidence;
import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.extractor.ExtractorHints;
import com.errlens.core.extractor.ExtractorSample;
import com.errlens.core.extractor.base.AbstractLineExtractor;
import com.errlens.core.extractor.base.ExtractorPatterns;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.ExtractionMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extractor for JUnit XML test reports as written by Surefire, Gradle, Vitest and Jest reporters.
 *
 * <p>Well-formed reports are read with Jackson's {@link XmlMapper}; suites may be
 * nested under {@code <testsuites>} and repeated elements arrive either as a
 * single node or as an array. Truncated or otherwise malformed reports are
 * scanned with patterns instead.
 */
public class JUnitXmlExtractor extends AbstractLineExtractor {

    private static final String INVALID_FORMAT = "Unable to parse JUnit XML - invalid format";

    private static final String TESTCASE_OPEN = "<testcase";
    private static final List<String> FAILURE_ELEMENTS = List.of("failure", "error");
    private static final Pattern ARROW_LOCATION = Pattern.compile("❯\\s+([\\w/.@-]+):(\\d+)(?::(\\d+))?");
    private static final Pattern JAVA_FRAME = Pattern.compile("at\\s+([\\w.$]+)\\.[\\w$<>]+\\(([\\w$]+\\.java):(\\d+)\\)");

    private final XmlMapper xmlMapper = new XmlMapper();

    public JUnitXmlExtractor() {
        super("junit", "Extracts test failures from JUnit XML reports", "junit", "xml", "testing", "report");
    }

    @Override
    public ExtractorHints getHints() {
        return ExtractorHints.required("<testsuite");
    }

    @Override
    public int getPriority() {
        return 100;
    }

    @Override
    public int getDetectionThreshold() {
        return 85;
    }

    @Override
    protected DetectionResult detectFormat(String output) {
        if (!output.contains("<testsuite")) {
            return DetectionResult.none();
        }
        boolean hasFailure = output.contains("<failure") || output.contains("<error");
        if (!hasFailure) {
            // A report of passing tests leaves nothing to extract
            return DetectionResult.none();
        }
        if (output.contains("<?xml")) {
            return detected(DetectionConfidence.UNAMBIGUOUS.score(), "JUnit XML report with test failures detected",
                List.of("<?xml> declaration", "<testsuite>", "<failure>"));
        }
        return detected(DetectionConfidence.STRONG.score(), "JUnit XML format with test failures detected",
            List.of("<testsuite>", "<failure>"));
    }

    @Override
    protected ErrorExtractorResult extractErrors(String output, String context) {
        if (!output.contains("<testsuite")) {
            return ResultAssembler.build(List.of(), INVALID_FORMAT, "Ensure the input is valid JUnit XML format",
                output.trim(), ExtractionMetadata.of(0, 0, List.of(INVALID_FORMAT)));
        }

        List<String> issues = new ArrayList<>();
        List<TestFailure> failures;
        try {
            failures = parseTree(xmlMapper.readTree(reportPart(output)));
        } catch (JsonProcessingException e) {
            log.debug("JUnit report is not well-formed XML, scanning with patterns: {}", e.getOriginalMessage());
            issues.add("Malformed XML - failures recovered by pattern scanning");
            failures = scan(output);
        }
        return ResultAssembler.fromTestFailures(failures, issues.isEmpty() ? 95 : 85, issues);
    }

    /**
     * Drops anything a tool printed before the XML declaration or the first suite.
     */
    private String reportPart(String output) {
        int start = output.indexOf("<?xml");
        if (start < 0) {
            start = output.indexOf("<testsuite");
        }
        return output.substring(start).trim();
    }

    // ==================== Tree Parsing ====================

    private List<TestFailure> parseTree(JsonNode root) {
        List<TestFailure> failures = new ArrayList<>();
        collectSuite(root, failures);
        return failures;
    }

    private void collectSuite(JsonNode suite, List<TestFailure> failures) {
        for (JsonNode testcase : asList(suite.get("testcase"))) {
            TestFailure failure = fromTestcase(testcase);
            if (failure != null) {
                failures.add(failure);
            }
        }
        for (JsonNode nested : asList(suite.get("testsuite"))) {
            collectSuite(nested, failures);
        }
    }

    private TestFailure fromTestcase(JsonNode testcase) {
        if (!testcase.isObject()) {
            return null;
        }
        JsonNode element = first(testcase.get("failure"));
        if (element == null) {
            element = first(testcase.get("error"));
        }
        if (element == null) {
            return null;
        }

        String message = element.isObject() ? textOf(element.get("message")) : null;
        String type = element.isObject() ? textOf(element.get("type")) : null;
        String body = element.isObject() ? textOf(element.get("")) : element.asText();
        return toFailure(textOf(testcase.get("classname")), textOf(testcase.get("name")), message, type, body);
    }

    // ==================== Pattern Scanning ====================

    /**
     * Cuts the output at every {@code <testcase} opener and reads each slice on its own,
     * so a missing closing tag only costs that test case its body end.
     */
    private List<TestFailure> scan(String output) {
        List<TestFailure> failures = new ArrayList<>();
        int start = output.indexOf(TESTCASE_OPEN);
        while (start >= 0) {
            int next = output.indexOf(TESTCASE_OPEN, start + TESTCASE_OPEN.length());
            TestFailure failure = scanTestcase(output.substring(start + TESTCASE_OPEN.length(),
                next >= 0 ? next : output.length()));
            if (failure != null) {
                failures.add(failure);
            }
            start = next;
        }
        return failures;
    }

    private TestFailure scanTestcase(String slice) {
        int openerEnd = slice.indexOf('>');
        if (openerEnd < 0) {
            return null;
        }
        String attributes = slice.substring(0, openerEnd);
        if (attributes.endsWith("/")) {
            return null;
        }
        String inner = upTo(slice.substring(openerEnd + 1), "</testcase>", "</testsuite");

        String element = null;
        int elementStart = -1;
        for (String candidate : FAILURE_ELEMENTS) {
            int index = elementStart(inner, candidate);
            if (index >= 0 && (elementStart < 0 || index < elementStart)) {
                element = candidate;
                elementStart = index;
            }
        }
        if (element == null) {
            return null;
        }

        String rest = inner.substring(elementStart + element.length() + 1);
        int tagEnd = rest.indexOf('>');
        String failureAttributes = tagEnd >= 0 ? rest.substring(0, tagEnd) : rest;
        String body = null;
        if (tagEnd >= 0 && !failureAttributes.endsWith("/")) {
            body = upTo(rest.substring(tagEnd + 1), "</" + element + ">");
        }
        return toFailure(
            decoded(attribute(attributes, "classname")),
            decoded(attribute(attributes, "name")),
            decoded(attribute(failureAttributes, "message")),
            decoded(attribute(failureAttributes, "type")),
            decoded(body)
        );
    }

    /**
     * Finds {@code <name} followed by whitespace, {@code /} or {@code >}, or the end of the text.
     */
    private static int elementStart(String text, String name) {
        String open = "<" + name;
        int index = text.indexOf(open);
        while (index >= 0) {
            int after = index + open.length();
            if (after == text.length() || Character.isWhitespace(text.charAt(after))
                    || text.charAt(after) == '/' || text.charAt(after) == '>') {
                return index;
            }
            index = text.indexOf(open, after);
        }
        return -1;
    }

    private static String upTo(String text, String... terminators) {
        int end = text.length();
        for (String terminator : terminators) {
            int index = text.indexOf(terminator);
            if (index >= 0 && index < end) {
                end = index;
            }
        }
        return text.substring(0, end);
    }

    private static String attribute(String attributes, String name) {
        Matcher matcher = Pattern.compile("(?:^|\\s)" + name + "=\"([^\"]*)\"").matcher(attributes);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static String decoded(String text) {
        return text == null ? null : ExtractorPatterns.decodeXmlEntities(text);
    }

    // ==================== Shared ====================

    private TestFailure toFailure(String classname, String testName, String message, String type, String body) {
        String file = classname;
        Integer line = null;
        Integer column = null;
        String text = body != null ? body.trim() : "";

        Matcher arrow = findFirst(ARROW_LOCATION, text);
        if (arrow != null) {
            file = arrow.group(1);
            line = parseNumber(arrow.group(2));
            column = parseNumber(arrow.group(3));
        } else if (classname != null) {
            Matcher frame = findFirst(JAVA_FRAME, text);
            if (frame != null && frame.group(1).equals(classname)) {
                int lastDot = classname.lastIndexOf('.');
                String packagePath = lastDot > 0 ? classname.substring(0, lastDot).replace('.', '/') + "/" : "";
                file = packagePath + frame.group(2);
                line = parseNumber(frame.group(3));
            }
        }

        String resolvedMessage = message;
        if (resolvedMessage == null || resolvedMessage.isBlank()) {
            resolvedMessage = text.lines().map(String::trim).filter(l -> !l.isEmpty()).findFirst().orElse(null);
        }
        return new TestFailure(file, line, column, resolvedMessage, testName, simpleTypeName(type), null);
    }

    /**
     * {@code java.lang.AssertionError} becomes {@code AssertionError} so common guidance applies.
     */
    private static String simpleTypeName(String type) {
        if (type == null || type.isBlank()) {
            return null;
        }
        int lastDot = type.lastIndexOf('.');
        return lastDot >= 0 ? type.substring(lastDot + 1) : type;
    }

    private List<JsonNode> asList(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        // A repeated element is an array, a single one is not
        if (!node.isArray()) {
            return List.of(node);
        }
        List<JsonNode> nodes = new ArrayList<>();
        node.forEach(nodes::add);
        return nodes;
    }

    private JsonNode first(JsonNode node) {
        List<JsonNode> nodes = asList(node);
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    private static String textOf(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }

    @Override
    public List<ExtractorSample> getSamples() {
        return List.of(
            new ExtractorSample(
                "single-test-failure",
                "Single Vitest failure with location",
                """
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
                """,
                1,
                List.of("1 test(s) failed", "test/calculator.test.ts:10", "Calculator > should add numbers")),
            new ExtractorSample(
                "surefire-report",
                "Surefire report with a failure and an error",
                """
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
                """,
                2,
                List.of("2 test(s) failed", "com/example/OrderServiceTest.java:27", "expected: <42> but was: <41>",
                    "\"items\" is null"))
        );
    }
}
