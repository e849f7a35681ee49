package org.jtdd.confirm;

/**
 * Raised by the runner when a test declared a required exception type but finished
 * without throwing it.
 */
public final class MissingExpectedException extends RuntimeException {
    private final String exceptionType;

    public MissingExpectedException(String exceptionType) {
        super(formatReason(requireText(exceptionType)));
        this.exceptionType = exceptionType.trim();
    }

    public String exceptionType() {
        return exceptionType;
    }

    public String reason() {
        return getMessage();
    }

    private static String formatReason(String exceptionType) {
        return "Expected exception type " + exceptionType + " was not thrown.";
    }

    private static String requireText(String value) {
        String normalized = value == null ? null : value.trim();
        if (normalized == null || normalized.isEmpty()) {
            throw new IllegalArgumentException("exceptionType must not be blank");
        }
        return normalized;
    }
}
