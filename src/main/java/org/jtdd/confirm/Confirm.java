package org.jtdd.confirm;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Confirmations used inside test bodies and suite lifecycle operations.
 *
 * <p>Every operation returns normally when the confirmation holds and throws a
 * {@link ConfirmException} otherwise. Overloads without a {@code line} argument record the
 * line of the calling frame.
 *
 * <p>Floating point confirmations use a fixed absolute tolerance: {@value #FLOAT_TOLERANCE}
 * for {@code float}, {@value #DOUBLE_TOLERANCE} for {@code double} and {@link BigDecimal}.
 */
public final class Confirm {
    public static final float FLOAT_TOLERANCE = 0.0001f;
    public static final double DOUBLE_TOLERANCE = 0.000001d;

    private static final BigDecimal DECIMAL_TOLERANCE = BigDecimal.valueOf(DOUBLE_TOLERANCE);
    private static final StackWalker STACK_WALKER = StackWalker.getInstance();

    private Confirm() {
    }

    public static void confirm(boolean expected, boolean actual, int line) {
        if (actual != expected) {
            throw new BoolConfirmException(expected, line);
        }
    }

    public static void confirm(boolean expected, boolean actual) {
        if (actual != expected) {
            throw new BoolConfirmException(expected, callerLine());
        }
    }

    public static void confirmTrue(boolean actual, int line) {
        confirm(true, actual, line);
    }

    public static void confirmTrue(boolean actual) {
        if (!actual) {
            throw new BoolConfirmException(true, callerLine());
        }
    }

    public static void confirmFalse(boolean actual, int line) {
        confirm(false, actual, line);
    }

    public static void confirmFalse(boolean actual) {
        if (actual) {
            throw new BoolConfirmException(false, callerLine());
        }
    }

    public static void confirm(String expected, String actual, int line) {
        if (!Objects.equals(expected, actual)) {
            throw new ValueConfirmException(String.valueOf(expected), String.valueOf(actual), line);
        }
    }

    public static void confirm(String expected, String actual) {
        if (!Objects.equals(expected, actual)) {
            throw new ValueConfirmException(String.valueOf(expected), String.valueOf(actual), callerLine());
        }
    }

    public static void confirm(long expected, long actual, int line) {
        if (actual != expected) {
            throw new ValueConfirmException(Long.toString(expected), Long.toString(actual), line);
        }
    }

    public static void confirm(long expected, long actual) {
        if (actual != expected) {
            throw new ValueConfirmException(Long.toString(expected), Long.toString(actual), callerLine());
        }
    }

    public static void confirm(float expected, float actual, int line) {
        if (!withinTolerance(expected, actual)) {
            throw new ValueConfirmException(Float.toString(expected), Float.toString(actual), line);
        }
    }

    public static void confirm(float expected, float actual) {
        if (!withinTolerance(expected, actual)) {
            throw new ValueConfirmException(Float.toString(expected), Float.toString(actual), callerLine());
        }
    }

    public static void confirm(double expected, double actual, int line) {
        if (!withinTolerance(expected, actual)) {
            throw new ValueConfirmException(Double.toString(expected), Double.toString(actual), line);
        }
    }

    public static void confirm(double expected, double actual) {
        if (!withinTolerance(expected, actual)) {
            throw new ValueConfirmException(Double.toString(expected), Double.toString(actual), callerLine());
        }
    }

    public static void confirm(BigDecimal expected, BigDecimal actual, int line) {
        if (!withinTolerance(expected, actual)) {
            throw new ValueConfirmException(render(expected), render(actual), line);
        }
    }

    public static void confirm(BigDecimal expected, BigDecimal actual) {
        if (!withinTolerance(expected, actual)) {
            throw new ValueConfirmException(render(expected), render(actual), callerLine());
        }
    }

    /**
     * Equality through {@link Object#equals}; both sides are rendered with {@link String#valueOf}.
     */
    public static <T> void confirm(T expected, T actual, int line) {
        if (!Objects.equals(expected, actual)) {
            throw new ValueConfirmException(String.valueOf(expected), String.valueOf(actual), line);
        }
    }

    public static <T> void confirm(T expected, T actual) {
        if (!Objects.equals(expected, actual)) {
            throw new ValueConfirmException(String.valueOf(expected), String.valueOf(actual), callerLine());
        }
    }

    static boolean withinTolerance(float expected, float actual) {
        return expected == actual || Math.abs(actual - expected) <= FLOAT_TOLERANCE;
    }

    static boolean withinTolerance(double expected, double actual) {
        return expected == actual || Math.abs(actual - expected) <= DOUBLE_TOLERANCE;
    }

    static boolean withinTolerance(BigDecimal expected, BigDecimal actual) {
        if (expected == null || actual == null) {
            return expected == actual;
        }
        return expected.subtract(actual).abs().compareTo(DECIMAL_TOLERANCE) <= 0;
    }

    private static String render(BigDecimal value) {
        return value == null ? "null" : value.toPlainString();
    }

    /**
     * Line of the first frame outside this class, or {@link ConfirmException#NO_LINE}.
     */
    static int callerLine() {
        return STACK_WALKER.walk(frames -> frames
            .filter(frame -> !Confirm.class.getName().equals(frame.getClassName()))
            .findFirst()
            .map(StackWalker.StackFrame::getLineNumber)
            .filter(line -> line > 0)
            .orElse(ConfirmException.NO_LINE));
    }
}
