package com.errlens.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * One structured failure record extracted from tool output.
 *
 * <p>Only {@code message} is guaranteed. Location fields are best-effort and
 * stay {@code null} when the output does not carry them.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * FormattedError error = FormattedError.at("src/index.ts", 10, 5, "Type 'string' is not assignable")
 *     .withCode("TS2322");
 * }</pre>
 *
 * @param file path as printed by the tool (relative where the tool prints it relative)
 * @param line 1-based line number
 * @param column 1-based column number
 * @param message error text
 * @param context test name or hierarchy the error belongs to
 * @param guidance remediation hint specific to this error
 * @param severity error or warning
 * @param code tool-specific code (TypeScript code, lint rule id)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FormattedError(
    String file,
    Integer line,
    Integer column,
    String message,
    String context,
    String guidance,
    Severity severity,
    String code
) {
    public FormattedError {
        Objects.requireNonNull(message, "message must not be null");
        if (line != null && line < 1) {
            line = null;
        }
        if (column != null && column < 1) {
            column = null;
        }
    }

    /**
     * Creates an error-severity record with a location.
     *
     * @param file file path, may be null
     * @param line line number, may be null
     * @param column column number, may be null
     * @param message error message
     * @return new error record
     */
    public static FormattedError at(String file, Integer line, Integer column, String message) {
        return new FormattedError(file, line, column, message, null, null, Severity.ERROR, null);
    }

    /**
     * Creates a message-only record.
     *
     * @param message error message
     * @return new error record without location
     */
    public static FormattedError of(String message) {
        return at(null, null, null, message);
    }

    public FormattedError withContext(String newContext) {
        return new FormattedError(file, line, column, message, newContext, guidance, severity, code);
    }

    public FormattedError withGuidance(String newGuidance) {
        return new FormattedError(file, line, column, message, context, newGuidance, severity, code);
    }

    public FormattedError withSeverity(Severity newSeverity) {
        return new FormattedError(file, line, column, message, context, guidance, newSeverity, code);
    }

    public FormattedError withCode(String newCode) {
        return new FormattedError(file, line, column, message, context, guidance, severity, newCode);
    }

    /**
     * Renders the location as {@code file:line:column}, dropping missing parts.
     *
     * @return location string, or {@code "unknown"} when no file is known
     */
    public String location() {
        if (file == null || file.isBlank()) {
            return "unknown";
        }
        StringBuilder sb = new StringBuilder(file);
        if (line != null) {
            sb.append(':').append(line);
            if (column != null) {
                sb.append(':').append(column);
            }
        }
        return sb.toString();
    }
}
