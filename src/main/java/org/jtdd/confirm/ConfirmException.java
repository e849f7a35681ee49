package org.jtdd.confirm;

import java.util.OptionalInt;

/**
 * Signals a failed confirmation inside a test body or suite lifecycle operation.
 *
 * <p>The reason is rendered once at construction so a runner can report the failure
 * without looking at the test again.
 */
public abstract class ConfirmException extends RuntimeException {
    /** Sentinel used when the source line of a confirmation is unknown. */
    public static final int NO_LINE = -1;

    private final String reason;
    private final int line;

    ConfirmException(String reason, int line) {
        super(reason);
        if (reason == null || reason.isEmpty()) {
            throw new IllegalArgumentException("reason must not be empty");
        }
        this.reason = reason;
        this.line = line < 0 ? NO_LINE : line;
    }

    public String reason() {
        return reason;
    }

    /**
     * Raw source line, or {@link #NO_LINE}.
     */
    public int line() {
        return line;
    }

    public OptionalInt sourceLine() {
        return line == NO_LINE ? OptionalInt.empty() : OptionalInt.of(line);
    }
}
