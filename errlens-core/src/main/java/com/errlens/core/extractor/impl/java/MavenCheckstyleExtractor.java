package com.errlens.core.extractor.impl.java;

import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.extractor.ExtractorHints;
import com.errlens.core.extractor.ExtractorSample;
import com.errlens.core.extractor.base.AbstractLineExtractor;
import com.errlens.core.extractor.base.ExtractorPatterns;
import com.errlens.core.model.DetectionMetadata;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.FormattedError;
import com.errlens.core.model.Severity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extractor for maven-checkstyle-plugin violations.
 *
 * <p>The plugin prints each violation twice in different layouts: once during the
 * audit ({@code [WARN] /abs/Foo.java:10:5: message [Rule]}) and once in the
 * report ({@code [WARNING] Foo.java:[10,5] (group) Rule: message}). Violations
 * are keyed by {@code file:line:column} so each is reported once.
 */
public class MavenCheckstyleExtractor extends AbstractLineExtractor {

    private static final String NAME = "maven-checkstyle";

    private static final Pattern AUDIT_FORMAT =
        Pattern.compile("^\\[(WARN|ERROR)]\\s+(.+?):(\\d+):(\\d+):\\s+(.+?)\\s+\\[(\\w+)]$");
    private static final Pattern REPORT_FORMAT =
        Pattern.compile("^\\[(WARNING|ERROR)]\\s+(\\S+):\\[(\\d+),(\\d+)]\\s+\\((\\w+)\\)\\s+(\\w+):\\s+(.+)$");
    private static final Pattern VIOLATION_SUMMARY = Pattern.compile("You have (\\d+) Checkstyle violations?");

    public MavenCheckstyleExtractor() {
        super(NAME, "Extracts Checkstyle violations from Maven Checkstyle plugin output", "maven", "checkstyle", "java", "lint");
    }

    @Override
    public ExtractorHints getHints() {
        return ExtractorHints.anyOf("[WARN]", "[WARNING]", "Checkstyle", "checkstyle", "Starting audit");
    }

    @Override
    public int getPriority() {
        return 60;
    }

    @Override
    protected String getFailureUnit() {
        return "Checkstyle violation";
    }

    @Override
    protected DetectionResult detectFormat(String output) {
        DetectionMetadata detection = score(output);
        if (!hasViolationEvidence(output)) {
            return DetectionResult.none();
        }
        return MavenResults.toDetectionResult(detection);
    }

    private boolean hasViolationEvidence(String output) {
        Matcher summary = findFirst(VIOLATION_SUMMARY, output);
        if (summary != null && !summary.group(1).matches("0+")) {
            return true;
        }
        return lines(output).stream().anyMatch(line -> matches(AUDIT_FORMAT, line) || matches(REPORT_FORMAT, line));
    }

    private DetectionMetadata score(String output) {
        int score = 0;
        List<String> patterns = new ArrayList<>();

        if (output.contains("maven-checkstyle-plugin")) {
            score += 40;
            patterns.add("maven-checkstyle-plugin reference");
        }
        if (output.contains("Starting audit")) {
            score += 20;
            patterns.add("Checkstyle audit start marker");
        }
        if (output.contains("Audit done")) {
            score += 20;
            patterns.add("Checkstyle audit complete marker");
        }
        if (matches(VIOLATION_SUMMARY, output)) {
            score += 30;
            patterns.add("Checkstyle violation summary");
        }
        if (lines(output).stream().anyMatch(line -> matches(AUDIT_FORMAT, line) || matches(REPORT_FORMAT, line))) {
            score += 20;
            patterns.add("Checkstyle violation lines");
        }

        String reason = MavenResults.reason(score, "Maven Checkstyle plugin output detected",
            "Possible Maven Checkstyle output", "Not Maven Checkstyle output");
        return MavenResults.detection(NAME, score, patterns, reason);
    }

    @Override
    protected ErrorExtractorResult extractErrors(String output, String context) {
        DetectionMetadata detection = score(output);
        if (detection.confidence() < MavenResults.MINIMUM_SCORE) {
            return MavenResults.lowConfidence("Checkstyle", detection);
        }

        Map<String, FormattedError> unique = new LinkedHashMap<>();
        for (String line : lines(output)) {
            Matcher audit = matchLine(AUDIT_FORMAT, line);
            if (audit != null) {
                add(unique, audit.group(1), audit.group(2), audit.group(3), audit.group(4), audit.group(5), audit.group(6));
                continue;
            }
            Matcher report = matchLine(REPORT_FORMAT, line);
            if (report != null) {
                add(unique, report.group(1), report.group(2), report.group(3), report.group(4), report.group(7), report.group(6));
            }
        }

        List<FormattedError> errors = new ArrayList<>(unique.values());
        Set<String> files = new LinkedHashSet<>();
        errors.forEach(e -> files.add(e.file()));

        String command = context != null && !context.isBlank() ? context : "mvn checkstyle:check";
        return MavenResults.build(
            detection,
            errors,
            errors.size() + " Checkstyle violation(s) in " + files.size() + " file(s)",
            errors.isEmpty() ? null : "Fix Checkstyle violations listed above. Run " + command + " to see all details.",
            MavenResults.digest(errors, "Error"),
            100,
            100,
            List.of()
        );
    }

    private void add(Map<String, FormattedError> unique, String level, String path, String line, String column,
                     String message, String rule) {
        String file = ExtractorPatterns.relativeToSourceRoot(path);
        String key = file + ":" + line + ":" + column;
        if (unique.containsKey(key)) {
            return;
        }
        Severity severity = "ERROR".equals(level) ? Severity.ERROR : Severity.WARNING;
        unique.put(key, FormattedError.at(file, parseNumber(line), parseNumber(column), message.trim())
            .withCode(rule)
            .withSeverity(severity));
    }

    @Override
    public List<ExtractorSample> getSamples() {
        return List.of(
            new ExtractorSample(
                "basic-warn-format",
                "Audit output in [WARN] format",
                """
                [INFO] --- maven-checkstyle-plugin:3.3.1:check (validate) @ app ---
                [INFO] Starting audit...
                [WARN] /project/src/main/java/com/example/Foo.java:10:5: Missing a Javadoc comment. [JavadocVariable]
                [WARN] /project/src/main/java/com/example/Foo.java:15:1: '{' at column 1 should be on the previous line. [LeftCurly]
                Audit done.
                """,
                2,
                List.of("src/main/java/com/example/Foo.java:10:5", "Missing a Javadoc comment", "JavadocVariable")),
            new ExtractorSample(
                "basic-warning-format",
                "Report output in [WARNING] format repeated after the audit",
                """
                [INFO] --- maven-checkstyle-plugin:3.3.1:check (validate) @ app ---
                [INFO] Starting audit...
                [WARN] /project/src/main/java/com/example/Bar.java:3:8: Unused import - java.util.List. [UnusedImports]
                Audit done.
                [WARNING] src/main/java/com/example/Bar.java:[3,8] (imports) UnusedImports: Unused import - java.util.List.
                [ERROR] Failed to execute goal org.apache.maven.plugins:maven-checkstyle-plugin:3.3.1:check (validate) on project app: You have 1 Checkstyle violation.
                """,
                1,
                List.of("1 Checkstyle violation(s) in 1 file(s)", "UnusedImports", "mvn checkstyle:check"))
        );
    }
}
