package org.jtdd.runner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.jtdd.confirm.Confirm;
import org.junit.jupiter.api.Test;

class VerdictTest {
    @Test
    void passWithoutExpectationIsPassed() {
        assertEquals(Verdict.PASSED, Verdict.classify(Outcome.pass(), null));
    }

    @Test
    void passWithExpectationIsMissedExpectedFailure() {
        assertEquals(Verdict.MISSED_EXPECTED_FAILURE, Verdict.classify(Outcome.pass(), "Expected: true"));
    }

    @Test
    void failureMatchingExpectationExactlyIsExpectedFailure() {
        Outcome outcome = Outcome.confirmFailure("Expected: 0\nActual: 2", 23);

        assertEquals(Verdict.EXPECTED_FAILURE, Verdict.classify(outcome, "Expected: 0\nActual: 2"));
        assertEquals(Verdict.FAILED, Verdict.classify(outcome, "    Expected: 0\n    Actual: 2"));
        assertEquals(Verdict.FAILED, Verdict.classify(outcome, null));
    }

    @Test
    void emptyExpectationCountsAsNone() {
        assertEquals(Verdict.PASSED, Verdict.classify(Outcome.pass(), ""));
        assertEquals(Verdict.FAILED, Verdict.classify(Outcome.missingException("Expected exception type int was not thrown."), ""));
    }

    @Test
    void lifecycleOutcomesIgnoreExpectations() {
        assertEquals(Verdict.PASSED, Verdict.classify(Outcome.pass()));
        assertEquals(Verdict.FAILED, Verdict.classify(Outcome.unexpectedException(new IllegalStateException())));
    }

    @Test
    void captureClassifiesThrowables() {
        assertEquals(Outcome.Kind.PASS, Outcome.capture(() -> {
        }).kind());

        Outcome confirm = Outcome.capture(() -> Confirm.confirm(1L, 2L, 8));
        assertEquals(Outcome.Kind.CONFIRM_FAILURE, confirm.kind());
        assertEquals(8, confirm.line());

        Outcome unexpected = Outcome.capture(() -> {
            throw new AssertionError("plain assert");
        });
        assertEquals(Outcome.Kind.UNEXPECTED_EXCEPTION, unexpected.kind());
        assertEquals("Unexpected exception thrown.", unexpected.reason().orElseThrow());
        assertEquals("java.lang.AssertionError", unexpected.exceptionClass().orElseThrow());
    }

    @Test
    void captureRethrowsVirtualMachineErrors() {
        assertThrows(StackOverflowError.class, () -> Outcome.capture(() -> {
            throw new StackOverflowError();
        }));
    }
}
