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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extractor for TypeScript compiler ({@code tsc}) diagnostics.
 *
 * <p>Supports both output styles:
 * <ul>
 *   <li>{@code src/index.ts:10:5 - error TS2322: message} (tsc 3.x and later, pretty off)</li>
 *   <li>{@code src/index.ts(10,5): error TS2322: message} (classic format)</li>
 * </ul>
 *
 * <p>The classic format is only consulted when no line in the modern format exists.
 */
public class TypeScriptExtractor extends AbstractLineExtractor {

    private static final Pattern MODERN_DIAGNOSTIC =
        Pattern.compile("^(.+?):(\\d+):(\\d+)\\s+-\\s*(error|warning)\\s+(TS\\d+):\\s+(.+)$");

    private static final Pattern CLASSIC_DIAGNOSTIC =
        Pattern.compile("^(.+?)\\((\\d+),(\\d+)\\):\\s*(error|warning)\\s+(TS\\d+):\\s+(.+)$");

    private static final Pattern ERROR_CODE = Pattern.compile("error TS\\d+:");

    public TypeScriptExtractor() {
        super("typescript", "Extracts TypeScript compiler (tsc) errors", "typescript", "compiler", "type-checking");
    }

    @Override
    public ExtractorHints getHints() {
        return ExtractorHints.anyOf("error TS", "warning TS");
    }

    @Override
    public int getPriority() {
        return 95;
    }

    @Override
    public int getDetectionThreshold() {
        return 90;
    }

    @Override
    protected String getFailureUnit() {
        return "type error";
    }

    @Override
    protected DetectionResult detectFormat(String output) {
        if (matches(ERROR_CODE, output)) {
            return DetectionResult.of(DetectionConfidence.DISTINCTIVE,
                List.of("error TS#### pattern"), "TypeScript compiler error format detected");
        }
        return DetectionResult.none();
    }

    @Override
    protected ErrorExtractorResult extractErrors(String output, String context) {
        List<String> lines = lines(output);
        List<FormattedError> errors = parse(lines, MODERN_DIAGNOSTIC);
        if (errors.isEmpty()) {
            errors = parse(lines, CLASSIC_DIAGNOSTIC);
        }
        if (errors.isEmpty()) {
            return emptyResult();
        }

        long errorCount = errors.stream().filter(e -> e.severity() == Severity.ERROR).count();
        long warningCount = errors.size() - errorCount;

        String digest = String.join("\n", ResultAssembler.cap(errors).stream()
            .map(e -> e.file() + ":" + e.line() + ":" + e.column() + " - " + e.code() + ": " + e.message())
            .toList());

        return ResultAssembler.build(
            errors,
            errorCount + " type error(s), " + warningCount + " warning(s)",
            guidanceFor(errors),
            digest,
            ExtractionMetadata.of(DetectionConfidence.DISTINCTIVE.score(), ResultAssembler.completeness(errors), List.of())
        );
    }

    private List<FormattedError> parse(List<String> lines, Pattern pattern) {
        List<FormattedError> errors = new ArrayList<>();
        for (String line : lines) {
            Matcher m = matchLine(pattern, line);
            if (m != null) {
                errors.add(FormattedError.at(m.group(1).trim(), parseNumber(m.group(2)), parseNumber(m.group(3)),
                        m.group(6).trim())
                    .withSeverity(Severity.fromText(m.group(4)))
                    .withCode(m.group(5)));
            }
        }
        return errors;
    }

    private String guidanceFor(List<FormattedError> errors) {
        Set<String> codes = new LinkedHashSet<>();
        errors.forEach(e -> codes.add(e.code()));

        List<String> guidance = new ArrayList<>();
        if (codes.contains("TS2322")) {
            guidance.add("Type mismatch - check variable/parameter types");
        }
        if (codes.contains("TS2304")) {
            guidance.add("Cannot find name - check imports and type definitions");
        }
        if (codes.contains("TS2345")) {
            guidance.add("Argument type mismatch - check function signatures");
        }
        return guidance.isEmpty() ? "Fix TypeScript type errors in listed files" : String.join(". ", guidance);
    }

    @Override
    public List<ExtractorSample> getSamples() {
        return List.of(
            new ExtractorSample(
                "single-type-error",
                "Single TypeScript type mismatch error",
                "src/index.ts(10,5): error TS2322: Type 'string' is not assignable to type 'number'.",
                1,
                List.of("TS2322", "Type mismatch")),
            new ExtractorSample(
                "multiple-errors-with-warning",
                "Multiple TypeScript errors with one warning",
                """
                src/index.ts(10,5): error TS2322: Type 'string' is not assignable to type 'number'.
                src/config.ts(25,12): error TS2304: Cannot find name 'process'.
                src/utils.ts(100,3): warning TS6133: 'unusedVar' is declared but never used.
                """,
                3,
                List.of("TS2322", "TS2304", "TS6133"))
        );
    }
}
