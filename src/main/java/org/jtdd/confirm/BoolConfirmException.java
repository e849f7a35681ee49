package org.jtdd.confirm;

/**
 * Raised when a boolean confirmation does not hold.
 */
public final class BoolConfirmException extends ConfirmException {
    private final boolean expected;

    public BoolConfirmException(boolean expected, int line) {
        super("Expected: " + expected, line);
        this.expected = expected;
    }

    public boolean expected() {
        return expected;
    }
}
