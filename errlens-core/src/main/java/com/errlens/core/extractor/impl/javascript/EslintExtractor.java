package com.errlens.core.extractor.impl.javascript;

import com.errlens.core.assembler.ResultAssembler;
import com.errlens.core.extractor.DetectionConfidence;
import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.extractor.ExtractorHints;
import com.errlens.core.extractor.ExtractorSample;
import com.errlens.core.extractor.base.AbstractLineExtractor;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.ExtractionMetadata;
import com.errlens.core.model.FormattedError;
import com.errlens.core.model.Severity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extractor for ESLint output in the unix/compact style and the default "stylish" style.
 *
 * <p>Stylish output prints a file header line followed by indented
 * {@code line:col  severity  message  rule} lines, so the current file is tracked
 * while scanning. When several rules report the same location (e.g. {@code no-unused-vars}
 * and {@code @typescript-eslint/no-unused-vars}) the typescript-eslint rule wins.
 */
public class EslintExtractor extends AbstractLineExtractor {

    private static final Pattern UNIX_LINE =
        Pattern.compile("^(.+?):(\\d+):(\\d+):\\s+(error|warning)\\s+(.+?)\\s+(\\S+)$");

    private static final Pattern STYLISH_LINE =
        Pattern.compile("^\\s+(\\d+):(\\d+)\\s+(error|warning)\\s+(.+?)\\s+(\\S+)\\s*$");

    private static final Pattern UNIX_MARKER = Pattern.compile(":\\d+:\\d+:\\s*(?:error|warning)");
    private static final Pattern STYLISH_MARKER =
        Pattern.compile("^[ \\t]+\\d+:\\d+[ \\t]+(?:error|warning)[ \\t]+", Pattern.MULTILINE);
    private static final Pattern PROBLEM_SUMMARY = Pattern.compile("✖ \\d+ problems?");

    private static final String TS_ESLINT_PREFIX = "@typescript-eslint/";

    public EslintExtractor() {
        super("eslint", "Extracts ESLint linting errors and warnings", "eslint", "linter", "javascript", "typescript");
    }

    @Override
    public ExtractorHints getHints() {
        return ExtractorHints.anyOf("error", "warning");
    }

    @Override
    public int getPriority() {
        return 85;
    }

    @Override
    public int getDetectionThreshold() {
        return 85;
    }

    @Override
    protected String getFailureUnit() {
        return "ESLint error";
    }

    @Override
    protected DetectionResult detectFormat(String output) {
        List<String> patterns = new ArrayList<>();
        if (matches(UNIX_MARKER, output)) {
            patterns.add("file:line:col: error/warning rule-name");
        }
        if (matches(STYLISH_MARKER, output)) {
            patterns.add("stylish line:col error/warning");
        }
        if (patterns.isEmpty()) {
            return DetectionResult.none();
        }
        if (matches(PROBLEM_SUMMARY, output)) {
            patterns.add("✖ X problems summary");
            return detected(DetectionConfidence.STRONG.score(), "ESLint error format detected", patterns);
        }
        return detected(DetectionConfidence.SINGLE_SIGNAL.score(), "ESLint error format detected", patterns);
    }

    @Override
    protected ErrorExtractorResult extractErrors(String output, String context) {
        List<FormattedError> parsed = new ArrayList<>();
        String currentFile = null;

        for (String line : lines(output)) {
            Matcher unix = matchLine(UNIX_LINE, line);
            if (unix != null) {
                parsed.add(violation(unix.group(1).trim(), unix.group(2), unix.group(3), unix.group(4),
                    unix.group(5), unix.group(6).replaceAll("[\\[\\]]", "")));
                continue;
            }

            Matcher stylish = matchLine(STYLISH_LINE, line);
            if (stylish != null && currentFile != null) {
                parsed.add(violation(currentFile, stylish.group(1), stylish.group(2), stylish.group(3),
                    stylish.group(4), stylish.group(5)));
                continue;
            }

            if (isFileHeader(line)) {
                currentFile = line.trim();
            }
        }

        List<FormattedError> errors = deduplicate(parsed);
        if (errors.isEmpty()) {
            return emptyResult();
        }

        long errorCount = errors.stream().filter(e -> e.severity() == Severity.ERROR).count();
        long warningCount = errors.size() - errorCount;

        String digest = String.join("\n", ResultAssembler.cap(errors).stream()
            .map(e -> e.file() + ":" + e.line() + ":" + e.column() + " - " + e.message() + " [" + e.code() + "]")
            .toList());

        return ResultAssembler.build(
            errors,
            errorCount + " ESLint error(s), " + warningCount + " warning(s)",
            guidanceFor(errors),
            digest,
            ExtractionMetadata.of(DetectionConfidence.SINGLE_SIGNAL.score(), ResultAssembler.completeness(errors), List.of())
        );
    }

    private FormattedError violation(String file, String line, String column, String severity, String message, String rule) {
        return FormattedError.at(file, parseNumber(line), parseNumber(column), message.trim() + " (" + rule + ")")
            .withSeverity(Severity.fromText(severity))
            .withCode(rule);
    }

    private boolean isFileHeader(String line) {
        return !line.isEmpty()
            && !line.contains(":")
            && !line.startsWith(" ")
            && !line.startsWith("\t")
            && (line.contains("/") || line.contains("\\"));
    }

    private List<FormattedError> deduplicate(List<FormattedError> errors) {
        Map<String, FormattedError> byLocation = new LinkedHashMap<>();
        for (FormattedError error : errors) {
            String key = error.file() + ":" + error.line() + ":" + error.column();
            FormattedError existing = byLocation.get(key);
            if (existing == null) {
                byLocation.put(key, error);
            } else if (!isTypeScriptRule(existing) && isTypeScriptRule(error)) {
                byLocation.put(key, error);
            }
        }
        return new ArrayList<>(byLocation.values());
    }

    private boolean isTypeScriptRule(FormattedError error) {
        return error.code() != null && error.code().startsWith(TS_ESLINT_PREFIX);
    }

    private String guidanceFor(List<FormattedError> errors) {
        List<String> guidance = new ArrayList<>();
        if (errors.stream().anyMatch(e -> "@typescript-eslint/no-unused-vars".equals(e.code())
                || "no-unused-vars".equals(e.code()))) {
            guidance.add("Remove or prefix unused variables with underscore");
        }
        if (errors.stream().anyMatch(e -> "no-console".equals(e.code()))) {
            guidance.add("Replace console.log with logger");
        }
        return guidance.isEmpty() ? "Fix ESLint errors - run with --fix to auto-fix some issues" : String.join(". ", guidance);
    }

    @Override
    public List<ExtractorSample> getSamples() {
        return List.of(
            new ExtractorSample(
                "single-no-console-error",
                "Single ESLint no-console error",
                "src/index.ts:10:5: error Unexpected console statement no-console",
                1,
                List.of("no-console", "Replace console.log with logger")),
            new ExtractorSample(
                "stylish-format",
                "Default stylish formatter with a file header",
                """
                /home/ci/app/src/index.ts
                  10:5   error    Unexpected console statement  no-console
                  12:10  warning  'x' is defined but never used  @typescript-eslint/no-unused-vars

                ✖ 2 problems (1 error, 1 warning)
                """,
                2,
                List.of("no-console", "@typescript-eslint/no-unused-vars", "1 ESLint error(s), 1 warning(s)"))
        );
    }
}
