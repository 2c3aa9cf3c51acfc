package com.errlens.core.extractor.base;

/**
 * File position parsed from a stack frame or location marker.
 *
 * @param file file path with any {@code file://} prefix removed
 * @param line line number, may be null
 * @param column column number, may be null
 */
public record StackLocation(String file, Integer line, Integer column) {

    /**
     * Renders {@code file:line:column}, omitting absent parts.
     *
     * @return printable location
     */
    public String describe() {
        StringBuilder text = new StringBuilder(file);
        if (line != null) {
            text.append(':').append(line);
            if (column != null) {
                text.append(':').append(column);
            }
        }
        return text.toString();
    }
}
