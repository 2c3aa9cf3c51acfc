package com.errlens.core.extractor.impl.java;

import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.extractor.ExtractorHints;
import com.errlens.core.extractor.ExtractorSample;
import com.errlens.core.extractor.base.AbstractLineExtractor;
import com.errlens.core.extractor.base.ExtractorPatterns;
import com.errlens.core.model.DetectionMetadata;
import com.errlens.core.model.ErrorExtractorResult;
import com.errlens.core.model.FormattedError;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extractor for javac errors reported by the maven-compiler-plugin.
 *
 * <p>Errors are printed as {@code [ERROR] /abs/path/Foo.java:[line,col] message},
 * optionally followed by indented {@code symbol:} and {@code location:} lines,
 * and are usually repeated in the final build failure report; duplicates are
 * removed.
 */
public class MavenCompilerExtractor extends AbstractLineExtractor {

    private static final String NAME = "maven-compiler";

    private static final Pattern ERROR_LINE = Pattern.compile("^\\[ERROR]\\s+([^:]+):\\[(\\d+)(?:,(\\d+))?]\\s+(.+)$");
    private static final Pattern COMPILATION_ERROR = Pattern.compile("^\\[ERROR]\\s+COMPILATION ERROR\\s*:");
    private static final Pattern ERROR_COUNT = Pattern.compile("^\\[INFO]\\s+(\\d+)\\s+errors?\\s*$");
    private static final List<Pattern> JAVAC_MESSAGES = List.of(
        Pattern.compile("cannot find symbol"),
        Pattern.compile("incompatible types"),
        Pattern.compile("class, interface, (?:or )?enum(?:, or record)? expected"),
        Pattern.compile("illegal start of expression"),
        Pattern.compile("reached end of file while parsing"),
        Pattern.compile("package .* does not exist"),
        Pattern.compile("method .* cannot be applied")
    );
    private static final int CONTEXT_LOOKAHEAD = 4;

    public MavenCompilerExtractor() {
        super(NAME, "Extracts Java compilation errors from Maven compiler plugin output",
            "maven", "java", "compiler", "javac");
    }

    @Override
    public ExtractorHints getHints() {
        return ExtractorHints.required("[ERROR]").withAnyOf("COMPILATION ERROR", "maven-compiler-plugin", ".java:[");
    }

    @Override
    public int getPriority() {
        return 70;
    }

    @Override
    protected String getFailureUnit() {
        return "compilation error";
    }

    @Override
    protected DetectionResult detectFormat(String output) {
        return MavenResults.toDetectionResult(score(output));
    }

    private DetectionMetadata score(String output) {
        int score = 0;
        List<String> patterns = new ArrayList<>();
        boolean errorLineSeen = false;
        boolean javacMessageSeen = false;

        for (String line : lines(output)) {
            if (matches(COMPILATION_ERROR, line)) {
                score += 30;
                patterns.add("[ERROR] COMPILATION ERROR marker");
            }
            if (line.contains("maven-compiler-plugin")) {
                score += 30;
                patterns.add("maven-compiler-plugin reference");
            }
            if (matches(ERROR_COUNT, line)) {
                score += 20;
                patterns.add("error count summary");
            }
            if (!errorLineSeen && matches(ERROR_LINE, line)) {
                score += 20;
                patterns.add("file:[line,column] format");
                errorLineSeen = true;
            }
            if (!javacMessageSeen && JAVAC_MESSAGES.stream().anyMatch(p -> p.matcher(line).find())) {
                score += 10;
                patterns.add("Java compiler error pattern");
                javacMessageSeen = true;
            }
        }

        String reason = MavenResults.reason(score, "Maven compiler plugin output detected",
            "Possible Maven compiler output", "Not Maven compiler output");
        return MavenResults.detection(NAME, score, patterns, reason);
    }

    @Override
    protected ErrorExtractorResult extractErrors(String output, String context) {
        DetectionMetadata detection = score(output);
        if (detection.confidence() < MavenResults.MINIMUM_SCORE) {
            return MavenResults.lowConfidence("compiler", detection);
        }

        List<String> lines = lines(output);
        Map<String, FormattedError> unique = new LinkedHashMap<>();

        for (int i = 0; i < lines.size(); i++) {
            Matcher match = matchLine(ERROR_LINE, lines.get(i));
            if (match == null) {
                continue;
            }

            List<String> contextLines = new ArrayList<>();
            for (int j = i + 1; j < Math.min(i + 1 + CONTEXT_LOOKAHEAD, lines.size()); j++) {
                String next = lines.get(j).trim();
                if (next.startsWith("[")) {
                    break;
                }
                if (next.startsWith("symbol:") || next.startsWith("location:")) {
                    contextLines.add(next);
                }
            }

            String message = match.group(4).trim();
            String fullMessage = contextLines.isEmpty() ? message : message + "\n" + String.join("\n", contextLines);
            FormattedError error = FormattedError.at(ExtractorPatterns.relativeToSourceRoot(match.group(1)),
                parseNumber(match.group(2)), parseNumber(match.group(3)), fullMessage);

            String key = error.location() + ":" + message;
            unique.putIfAbsent(key, error);
        }

        List<FormattedError> errors = new ArrayList<>(unique.values());
        Set<String> files = new LinkedHashSet<>();
        errors.forEach(e -> files.add(e.file()));

        String command = context != null && !context.isBlank() ? context : "mvn compile";
        return MavenResults.build(
            detection,
            errors,
            errors.size() + " compilation error(s) in " + files.size() + " file(s)",
            errors.isEmpty() ? null : "Fix Java compilation errors. Run " + command + " to see all details.",
            MavenResults.digest(errors, "Error"),
            100,
            100,
            List.of()
        );
    }

    @Override
    public List<ExtractorSample> getSamples() {
        return List.of(
            new ExtractorSample(
                "basic-cannot-find-symbol",
                "Simple cannot find symbol error",
                """
                [INFO] Compiling 45 source files
                [ERROR] COMPILATION ERROR :
                [ERROR] /Users/dev/project/src/main/java/com/example/Foo.java:[42,25] cannot find symbol
                  symbol:   method extractComponent()
                  location: class com.example.RefactoringActions
                [INFO] 1 error
                """,
                1,
                List.of("src/main/java/com/example/Foo.java:42:25", "cannot find symbol", "symbol:   method extractComponent()")),
            new ExtractorSample(
                "repeated-in-failure-report",
                "Errors listed in the compiler section and repeated in the build failure report",
                """
                [INFO] --- maven-compiler-plugin:3.11.0:compile (default-compile) @ app ---
                [INFO] Compiling 12 source files with javac [debug target 17] to target/classes
                [INFO] -------------------------------------------------------------
                [ERROR] COMPILATION ERROR :
                [INFO] -------------------------------------------------------------
                [ERROR] /home/ci/app/src/main/java/com/acme/Order.java:[17,22] incompatible types: java.lang.String cannot be converted to int
                [ERROR] /home/ci/app/src/main/java/com/acme/Invoice.java:[9,8] class, interface, enum, or record expected
                [INFO] 2 errors
                [INFO] -------------------------------------------------------------
                [INFO] BUILD FAILURE
                [ERROR] Failed to execute goal org.apache.maven.plugins:maven-compiler-plugin:3.11.0:compile (default-compile) on project app: Compilation failure: Compilation failure:
                [ERROR] /home/ci/app/src/main/java/com/acme/Order.java:[17,22] incompatible types: java.lang.String cannot be converted to int
                [ERROR] /home/ci/app/src/main/java/com/acme/Invoice.java:[9,8] class, interface, enum, or record expected
                """,
                2,
                List.of("2 compilation error(s) in 2 file(s)", "src/main/java/com/acme/Order.java:17:22", "mvn compile"))
        );
    }
}
