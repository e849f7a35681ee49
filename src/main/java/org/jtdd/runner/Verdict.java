package org.jtdd.runner;

/**
 * Final classification of a unit after expected failures are taken into account.
 */
public enum Verdict {
    PASSED,
    EXPECTED_FAILURE,
    MISSED_EXPECTED_FAILURE,
    FAILED,
    /** Not run because its suite setup failed. Not counted. */
    SKIPPED;

    /**
     * Classifies a raw test outcome. A test passes as an expected failure only when its
     * failure reason equals the expected reason exactly; a missed expected failure needs both
     * a raw pass and an expected reason.
     */
    static Verdict classify(Outcome outcome, String expectedFailureReason) {
        boolean expectsFailure = expectedFailureReason != null && !expectedFailureReason.isEmpty();
        if (outcome.passed()) {
            return expectsFailure ? MISSED_EXPECTED_FAILURE : PASSED;
        }
        if (expectsFailure && expectedFailureReason.equals(outcome.reason().orElse(null))) {
            return EXPECTED_FAILURE;
        }
        return FAILED;
    }

    static Verdict classify(Outcome outcome) {
        return outcome.passed() ? PASSED : FAILED;
    }
}
