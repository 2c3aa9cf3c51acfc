package com.errlens.core.extractor.impl.javascript;

import com.errlens.core.assembler.ResultAssembler;
import com.errlens.core.extractor.DetectionConfidence;
import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.extractor.ExtractorHints;
import com.errlens.core.extractor.ExtractorSample;
import com.errlens.core.extractor.base.AbstractLineExtractor;
import com.errlens.core.extractor.base.ExtractorPatterns;
import com.errlens.core.extractor.base.StackLocation;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.ExtractionMetadata;
import com.errlens.core.model.FormattedError;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extractor for Jest console output.
 *
 * <p>Jest prints a per-file tree ({@code FAIL file}, describe headings and
 * {@code ✕ test} lines) followed by detailed {@code ● Suite › test} blocks that
 * carry the assertion message and a stack trace. Tree entries open records;
 * detailed blocks either enrich the matching record or open a new one.
 */
public class JestExtractor extends AbstractLineExtractor {

    private static final Pattern FAIL_LINE = Pattern.compile("^\\s*FAIL\\s+(?:[\\w-]+\\s+)?([\\w/.-]+\\.test\\.\\w+)");
    private static final Pattern PASS_LINE = Pattern.compile("^\\s*PASS\\s+");
    private static final Pattern INLINE_FAILURE = Pattern.compile("^\\s+✕\\s+(.+?)(?:\\s+\\(\\d+\\s*ms\\))?$");
    private static final Pattern DETAILED_HEADER = Pattern.compile("^\\s*●\\s+(.+)$");
    private static final Pattern SUITE_LINE = Pattern.compile("^\\s+([A-Z][\\w\\s›-]+)$");
    private static final Pattern CODE_FRAME = Pattern.compile("^\\s*>?\\s*\\d*\\s*\\|");
    private static final Pattern STACK_FRAME = Pattern.compile("^\\s*at\\s");
    private static final Pattern RUN_SUMMARY = Pattern.compile("^(Test Suites|Tests|Snapshots|Time):");

    private static final Pattern FAIL_MARKER = Pattern.compile("^[ \\t]*FAIL[ \\t]+(?:[\\w-]+[ \\t]+)?\\S+\\.[cm]?[jt]sx?\\b", Pattern.MULTILINE);
    private static final Pattern DETAILED_MARKER = Pattern.compile("^[ \\t]*●[ \\t]+", Pattern.MULTILINE);

    private static final String GUIDANCE = "Fix each failing test individually. Check test setup, mocks, and assertions.";

    public JestExtractor() {
        super("jest", "Extracts Jest test framework errors", "jest", "testing", "test-runner", "javascript");
    }

    @Override
    public ExtractorHints getHints() {
        return ExtractorHints.anyOf("FAIL", "✕", "●");
    }

    @Override
    public int getPriority() {
        return 90;
    }

    @Override
    public int getDetectionThreshold() {
        return 90;
    }

    @Override
    protected DetectionResult detectFormat(String output) {
        boolean failMarker = matches(FAIL_MARKER, output);
        boolean crossMarker = output.contains("✕");
        boolean detailedMarker = matches(DETAILED_MARKER, output);

        if (failMarker || (crossMarker && detailedMarker)) {
            List<String> patterns = new ArrayList<>();
            if (failMarker) {
                patterns.add("FAIL marker");
            }
            if (crossMarker) {
                patterns.add("test markers (✕)");
            }
            if (detailedMarker) {
                patterns.add("● detailed format");
            }
            return detected(DetectionConfidence.STRONG.score(), "Jest test framework output detected", patterns);
        }
        if (crossMarker) {
            return detected(DetectionConfidence.FALLBACK.score(), "Possible Jest output (partial markers)",
                List.of("test markers (✕)"));
        }
        return DetectionResult.none();
    }

    @Override
    protected ErrorExtractorResult extractErrors(String output, String context) {
        List<String> lines = lines(output);
        Map<String, JestFailure> failures = new LinkedHashMap<>();
        Deque<String> hierarchy = new ArrayDeque<>();
        String currentFile = null;
        boolean inDetails = false;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);

            Matcher fail = findFirst(FAIL_LINE, line);
            if (fail != null) {
                currentFile = fail.group(1);
                hierarchy.clear();
                inDetails = false;
                continue;
            }
            if (matches(PASS_LINE, line) || matches(RUN_SUMMARY, line)) {
                currentFile = null;
                continue;
            }
            if (currentFile == null) {
                continue;
            }

            Matcher inline = matchLine(INLINE_FAILURE, line);
            if (inline != null && !inDetails) {
                adjustHierarchy(hierarchy, indentOf(line));
                String name = joinHierarchy(hierarchy, inline.group(1).trim());
                failures.putIfAbsent(currentFile + "#" + name, new JestFailure(currentFile, name));
                continue;
            }

            Matcher detailed = matchLine(DETAILED_HEADER, line);
            if (detailed != null) {
                inDetails = true;
                String name = detailed.group(1).trim();
                if (name.startsWith("Console")) {
                    continue;
                }
                String file = currentFile;
                JestFailure failure = failures.computeIfAbsent(file + "#" + name, key -> new JestFailure(file, name));
                readDetails(lines, i + 1, failure);
                continue;
            }

            if (!inDetails) {
                Matcher suite = matchLine(SUITE_LINE, line);
                if (suite != null && !line.contains("✓") && !line.contains("ms)")) {
                    adjustHierarchy(hierarchy, indentOf(line));
                    hierarchy.addLast(suite.group(1).trim());
                }
            }
        }

        if (failures.isEmpty()) {
            return emptyResult();
        }

        List<JestFailure> all = new ArrayList<>(failures.values());
        List<FormattedError> errors = all.stream().map(JestFailure::toError).toList();
        String digest = String.join("\n", ResultAssembler.cap(all).stream().map(JestFailure::digest).toList());

        return ResultAssembler.build(
            errors,
            all.size() + " test failure(s)",
            GUIDANCE,
            digest,
            ExtractionMetadata.of(DetectionConfidence.STRONG.score(), ResultAssembler.completeness(errors), List.of())
        );
    }

    /**
     * Reads the message lines of a {@code ●} block, capped at {@link #MAX_CONTINUATION_LINES}
     * with a truncation marker, and the first stack frame outside {@code node_modules}.
     */
    private void readDetails(List<String> lines, int start, JestFailure failure) {
        List<String> message = new ArrayList<>();
        boolean truncated = false;
        for (int j = start; j < lines.size(); j++) {
            String line = lines.get(j);
            if (matches(DETAILED_HEADER, line) || findFirst(FAIL_LINE, line) != null
                    || matches(PASS_LINE, line) || matches(RUN_SUMMARY, line)) {
                break;
            }
            if (matches(STACK_FRAME, line)) {
                if (failure.location == null) {
                    Optional<StackLocation> location =
                        ExtractorPatterns.parseStackLocation(line, List.of(ExtractorPatterns.GENERIC_FRAME));
                    location.filter(loc -> !loc.file().contains("node_modules"))
                        .ifPresent(loc -> failure.location = loc);
                }
                continue;
            }
            if (matches(CODE_FRAME, line) || line.isBlank()) {
                continue;
            }
            if (message.size() >= MAX_CONTINUATION_LINES) {
                truncated = true;
                continue;
            }
            message.add(line.trim());
        }
        if (truncated) {
            message.add(TRUNCATION_MARKER);
        }
        if (!message.isEmpty() && failure.message == null) {
            failure.message = String.join(" ", message);
        }
    }

    private static int indentOf(String line) {
        int indent = 0;
        while (indent < line.length() && Character.isWhitespace(line.charAt(indent))) {
            indent++;
        }
        return indent;
    }

    /**
     * Pops describe levels until the stack depth matches the indentation; two spaces per level.
     */
    private static void adjustHierarchy(Deque<String> hierarchy, int indent) {
        while (!hierarchy.isEmpty() && indent < (hierarchy.size() + 1) * 2) {
            hierarchy.removeLast();
            if (indent == (hierarchy.size() + 1) * 2) {
                break;
            }
        }
    }

    private static String joinHierarchy(Deque<String> hierarchy, String testName) {
        if (hierarchy.isEmpty()) {
            return testName;
        }
        return String.join(" › ", hierarchy) + " › " + testName;
    }

    private static final class JestFailure {
        private final String file;
        private final String testName;
        private String message;
        private StackLocation location;

        JestFailure(String file, String testName) {
            this.file = file;
            this.testName = testName;
        }

        FormattedError toError() {
            String text = testName + ": " + (message != null ? message : "Test failed");
            FormattedError error = location != null
                ? FormattedError.at(location.file(), location.line(), location.column(), text)
                : FormattedError.at(file, null, null, text);
            return error.withContext(testName);
        }

        String digest() {
            String where = location != null
                ? toError().location()
                : file;
            return "● " + testName + "\n  " + (message != null ? message : "Test failed") + "\n  Location: " + where + "\n";
        }
    }

    @Override
    public List<ExtractorSample> getSamples() {
        return List.of(
            new ExtractorSample(
                "single-test-failure",
                "Single Jest test failure with inline marker",
                """
                 FAIL test/example.test.ts
                  Example Suite
                    ✕ should pass (15 ms)
                """,
                1,
                List.of("test/example.test.ts", "Example Suite › should pass")),
            new ExtractorSample(
                "multiple-failures-with-hierarchy",
                "Multiple test failures with nested describe blocks",
                """
                 FAIL test/example.test.ts
                  Example Suite
                    Nested Suite
                      ✕ test one (10 ms)
                      ✕ test two (12 ms)
                """,
                2,
                List.of("Example Suite › Nested Suite › test one", "Example Suite › Nested Suite › test two")),
            new ExtractorSample(
                "detailed-format",
                "Jest output with detailed error format (●)",
                """
                 FAIL test/example.test.ts
                  ● Example Suite › should handle errors

                    expect(received).toBe(expected) // Object.is equality

                    Expected: 5
                    Received: 3

                      10 |   it('should handle errors', () => {
                    > 11 |     expect(compute()).toBe(5);
                         |                       ^

                      at Object.<anonymous> (test/example.test.ts:11:23)
                """,
                1,
                List.of("Example Suite › should handle errors", "Expected: 5"))
        );
    }
}
