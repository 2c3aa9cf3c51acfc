package com.errlens.core.extractor.base;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared regex patterns and helpers used by several extractors.
 *
 * <p>Patterns are compiled once at class loading time. Stack location patterns
 * follow one convention: group 1 is the file, group 2 the line and group 3
 * the optional column.
 */
public final class ExtractorPatterns {

    public static final Pattern ERROR_TYPE =
        Pattern.compile("^([A-Za-z]*Error)(?:\\s\\[\\w+\\])?\\s*:");

    /** {@code at Context.<anonymous> (file:line:col)} as printed by Mocha and Jasmine. */
    public static final Pattern CONTEXT_ANONYMOUS_FRAME =
        Pattern.compile("at (?:User)?Context\\.<anonymous> \\((?:file://)?([^:)]+):(\\d+)(?::(\\d+))?\\)");

    /** Any {@code at fn (file:line:col)} frame. */
    public static final Pattern GENERIC_FRAME =
        Pattern.compile("at .+ \\((?:file://)?([^:)]+):(\\d+)(?::(\\d+))?\\)");

    /** {@code › file:///path:line:col} as printed by AVA. */
    public static final Pattern ARROW_FILE_URL =
        Pattern.compile("› file://([^:]+):(\\d+)(?::(\\d+))?");

    /** {@code at file:///path:line:col}. */
    public static final Pattern AT_FILE_URL =
        Pattern.compile("at file://([^:]+):(\\d+)(?::(\\d+))?");

    /** Bare {@code file.js:line}. */
    public static final Pattern SIMPLE_FILE_LINE =
        Pattern.compile("^([^:]+\\.(?:js|ts|mjs|cjs)):(\\d+)$");

    public static final List<Pattern> NODE_STACK_PATTERNS =
        List.of(CONTEXT_ANONYMOUS_FRAME, GENERIC_FRAME, ARROW_FILE_URL, AT_FILE_URL);

    private static final Pattern SOURCE_ROOT = Pattern.compile("(?:^|[/\\\\])(src[/\\\\].*)$");

    private ExtractorPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Derives the error type from the start of a message.
     *
     * <p>Matches {@code TypeError: ...}, {@code AssertionError [ERR_ASSERTION]: ...} and plain {@code Error: ...}.
     *
     * @param message error message
     * @return error type, or empty if the message has no type prefix
     */
    public static Optional<String> extractErrorType(String message) {
        if (message == null) {
            return Optional.empty();
        }
        Matcher matcher = ERROR_TYPE.matcher(message.trim());
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /**
     * Parses the first location found in a line, trying patterns in order.
     *
     * @param line text to inspect
     * @param patterns candidate patterns (file, line, optional column groups)
     * @return parsed location, or empty
     */
    public static Optional<StackLocation> parseStackLocation(String line, List<Pattern> patterns) {
        if (line == null) {
            return Optional.empty();
        }
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(line);
            if (matcher.find()) {
                Integer lineNumber = toInt(matcher.group(2));
                Integer column = matcher.groupCount() >= 3 ? toInt(matcher.group(3)) : null;
                return Optional.of(new StackLocation(matcher.group(1), lineNumber, column));
            }
        }
        return Optional.empty();
    }

    /**
     * Shortens an absolute path to start at its {@code src/} directory.
     *
     * <p>{@code /home/ci/project/src/main/java/Foo.java} becomes {@code src/main/java/Foo.java}.
     * Paths without a {@code src} segment are returned unchanged.
     *
     * @param path path as printed by the tool
     * @return source-relative path
     */
    public static String relativeToSourceRoot(String path) {
        if (path == null) {
            return null;
        }
        Matcher matcher = SOURCE_ROOT.matcher(path.trim());
        return matcher.find() ? matcher.group(1).replace('\\', '/') : path.trim();
    }

    /**
     * Decodes the five predefined XML entities; {@code &amp;} is decoded last.
     *
     * @param text encoded text
     * @return decoded text
     */
    public static String decodeXmlEntities(String text) {
        if (text == null) {
            return null;
        }
        return text
            .replace("&lt;", "<")
            .replace("&gt;", ">")
            .replace("&quot;", "\"")
            .replace("&apos;", "'")
            .replace("&#39;", "'")
            .replace("&amp;", "&");
    }

    private static Integer toInt(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
