package com.errlens.core.extractor.base;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abstract base class for extractors that classify output line by line.
 *
 * <p>Every built-in parser is a single forward pass over the output lines,
 * recognising three roles:
 * <ul>
 *   <li>section boundaries (headers that change how later lines are read)</li>
 *   <li>record openers (lines starting a new failure)</li>
 *   <li>continuation lines (message, stack and snippet lines of the current record)</li>
 * </ul>
 *
 * <p>This class provides precompiled-pattern helpers and bounded line collection
 * so that each parser's state machine stays short.
 *
 * @see AbstractExtractor
 */
public abstract class AbstractLineExtractor extends AbstractExtractor {

    /**
     * Default cap on continuation lines collected for one message.
     */
    protected static final int MAX_CONTINUATION_LINES = 5;

    protected static final String TRUNCATION_MARKER = "...(truncated)";

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n|\\r");

    protected AbstractLineExtractor(String name, String description, String... tags) {
        super(name, description, tags);
    }

    // ==================== Line Utilities ====================

    /**
     * Splits output into lines, accepting any line terminator.
     *
     * @param output text to split
     * @return lines, trailing empty lines included
     */
    protected List<String> lines(String output) {
        return Arrays.asList(LINE_BREAK.split(output, -1));
    }

    /**
     * Collects lines starting at {@code start} until {@code stop} matches or
     * {@code maxLines} lines were taken.
     *
     * @param lines all lines
     * @param start first index to inspect
     * @param maxLines upper bound on collected lines
     * @param stop predicate ending the block (the stopping line is not collected)
     * @return collected lines
     */
    protected List<String> collectUntil(List<String> lines, int start, int maxLines, Predicate<String> stop) {
        List<String> collected = new ArrayList<>();
        for (int i = start; i < lines.size() && collected.size() < maxLines; i++) {
            String line = lines.get(i);
            if (stop.test(line)) {
                break;
            }
            collected.add(line);
        }
        return collected;
    }

    // ==================== Pattern Matching Utilities ====================

    /**
     * Finds the first match of a pattern in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return matcher if found, null otherwise
     */
    protected Matcher findFirst(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher : null;
    }

    /**
     * Matches a pattern against the whole line.
     *
     * @param pattern compiled regex pattern
     * @param line line to test
     * @return matcher if the line matches, null otherwise
     */
    protected Matcher matchLine(Pattern pattern, String line) {
        Matcher matcher = pattern.matcher(line);
        return matcher.matches() ? matcher : null;
    }

    /**
     * Checks if a pattern matches anywhere in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return true if pattern matches
     */
    protected boolean matches(Pattern pattern, String text) {
        return pattern.matcher(text).find();
    }

    /**
     * Parses a captured number.
     *
     * @param text digits, may be null
     * @return parsed value, or null when absent or not a positive int
     */
    protected Integer parseNumber(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            int value = Integer.parseInt(text.trim());
            return value > 0 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parses a captured count, keeping zero.
     *
     * @param text digits, may be null
     * @return parsed value, or null when absent or too large for an int
     */
    protected Integer parseCount(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            int value = Integer.parseInt(text.trim());
            return value >= 0 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
