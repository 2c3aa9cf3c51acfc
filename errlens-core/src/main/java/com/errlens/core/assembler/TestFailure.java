package com.errlens.core.assembler;

/**
 * Failure record produced by test-runner parsers before assembly.
 *
 * <p>All fields are optional; {@link ResultAssembler#fromTestFailures} fills defaults.
 *
 * @param file file the failure points to
 * @param line line number
 * @param column column number
 * @param message error message
 * @param testName test name or hierarchy
 * @param errorType error classification (exception class or a category such as "timeout")
 * @param guidance failure-specific guidance
 */
public record TestFailure(
    String file,
    Integer line,
    Integer column,
    String message,
    String testName,
    String errorType,
    String guidance
) {
    public static TestFailure of(String file, Integer line, String message, String testName) {
        return new TestFailure(file, line, null, message, testName, null, null);
    }

    public TestFailure withErrorType(String newErrorType) {
        return new TestFailure(file, line, column, message, testName, newErrorType, guidance);
    }

    public TestFailure withGuidance(String newGuidance) {
        return new TestFailure(file, line, column, message, testName, errorType, newGuidance);
    }
}
