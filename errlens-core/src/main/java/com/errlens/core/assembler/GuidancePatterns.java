package com.errlens.core.assembler;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Remediation hints derived from common failure wording.
 *
 * <p>Each pattern fires at most once per result. Output order follows the order
 * in which failures are encountered, so it is deterministic for a given input.
 */
public final class GuidancePatterns {

    /**
     * A single guidance rule.
     *
     * @param key deduplication key
     * @param messageMatchers substrings looked up in the message
     * @param errorTypeMatchers error types that trigger the rule directly
     * @param guidance text emitted when the rule fires
     */
    public record Rule(String key, List<String> messageMatchers, List<String> errorTypeMatchers, String guidance) {
        public Rule {
            messageMatchers = List.copyOf(messageMatchers);
            errorTypeMatchers = errorTypeMatchers != null ? List.copyOf(errorTypeMatchers) : List.of();
        }

        boolean appliesTo(String message, String errorType) {
            if (errorType != null && errorTypeMatchers.contains(errorType)) {
                return true;
            }
            return messageMatchers.stream().anyMatch(message::contains);
        }
    }

    public static final List<Rule> COMMON = List.of(
        new Rule("assertion", List.of("Expected", "expected", "should"), List.of("AssertionError"),
            "Review test assertions and expected values"),
        new Rule("timeout", List.of("Timeout", "timeout", "exceeded", "did not complete", "timed out"), null,
            "Increase test timeout or optimize async operations"),
        new Rule("type", List.of("Cannot read properties", "typeerror"), List.of("TypeError"),
            "Check for null/undefined values and type mismatches"),
        new Rule("file", List.of("ENOENT", "no such file"), null,
            "Verify file paths and ensure test fixtures exist"),
        new Rule("module", List.of("Cannot find module", "Cannot find package"), null,
            "Install missing dependencies or check import paths")
    );

    private GuidancePatterns() {
        // Utility class
    }

    /**
     * Generates newline-joined guidance using {@link #COMMON}.
     *
     * @param failures failures to inspect
     * @return guidance text, empty when no rule fired
     */
    public static String generate(List<TestFailure> failures) {
        return generate(failures, COMMON);
    }

    public static String generate(List<TestFailure> failures, List<Rule> patterns) {
        List<String> guidance = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();

        for (TestFailure failure : failures) {
            String message = failure.message() != null ? failure.message() : "";
            for (Rule pattern : patterns) {
                if (!seen.contains(pattern.key()) && pattern.appliesTo(message, failure.errorType())) {
                    guidance.add(pattern.guidance());
                    seen.add(pattern.key());
                }
            }
        }
        return String.join("\n", guidance);
    }
}
