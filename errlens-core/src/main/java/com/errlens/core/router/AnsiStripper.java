package com.errlens.core.router;

import java.util.regex.Pattern;

/**
 * Removes terminal escape sequences and normalizes line endings.
 *
 * <p>Every extractor sees output that went through {@link #strip(String)} first,
 * so no parser has to deal with colors or {@code \r}.
 */
public final class AnsiStripper {

    // CSI sequences (colors, cursor movement, erase) and OSC sequences (titles, hyperlinks)
    private static final Pattern ESCAPE_SEQUENCES = Pattern.compile(
        "\\u001B\\[[0-?]*[ -/]*[@-~]|\\u001B\\][^\\u0007\\u001B]*(?:\\u0007|\\u001B\\\\)|\\u009B[0-?]*[ -/]*[@-~]");

    private AnsiStripper() {
        // Utility class
    }

    /**
     * Strips ANSI sequences and converts {@code \r\n} and lone {@code \r} to {@code \n}.
     *
     * @param text raw tool output, may be null
     * @return cleaned text, empty for null input
     */
    public static String strip(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String withoutEscapes = ESCAPE_SEQUENCES.matcher(text).replaceAll("");
        return withoutEscapes.replace("\r\n", "\n").replace('\r', '\n');
    }
}
