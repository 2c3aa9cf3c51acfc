package com.errlens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a single extracted error.
 *
 * <p>Serialized in lowercase ({@code error}, {@code warning}) so that structured
 * output matches the wording tools print themselves.
 */
public enum Severity {
    ERROR,
    WARNING;

    /**
     * Parses a tool-provided severity word.
     *
     * @param value severity text such as {@code "error"} or {@code "warning"}
     * @return matching severity, {@link #ERROR} for anything unrecognized
     */
    public static Severity fromText(String value) {
        if (value != null && value.trim().toLowerCase(Locale.ROOT).startsWith("warn")) {
            return WARNING;
        }
        return ERROR;
    }

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
