package org.jtdd.confirm;

import java.util.Objects;

/**
 * Raised when a value confirmation does not hold. Both sides are kept in their rendered
 * text form.
 */
public final class ValueConfirmException extends ConfirmException {
    private final String expected;
    private final String actual;

    public ValueConfirmException(String expected, String actual, int line) {
        super(formatReason(expected, actual), line);
        this.expected = expected;
        this.actual = actual;
    }

    public String expected() {
        return expected;
    }

    public String actual() {
        return actual;
    }

    private static String formatReason(String expected, String actual) {
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(actual, "actual");
        return "Expected: " + expected + "\nActual: " + actual;
    }
}
