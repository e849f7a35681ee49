package org.jtdd.runner;

import java.util.Objects;
import java.util.Optional;
import org.jtdd.confirm.ConfirmException;
import org.jtdd.confirm.MissingExpectedException;
import org.jtdd.registry.TestBody;
import org.jtdd.registry.TestUnit;

/**
 * Raw result of running one test body or suite lifecycle operation, before any expected
 * failure is taken into account.
 */
public final class Outcome {
    static final String UNEXPECTED_REASON = "Unexpected exception thrown.";
    static final String ALREADY_RAN_REASON = "Test already ran. Register it again to rerun.";

    private static final Outcome PASS = new Outcome(Kind.PASS, null, TestUnit.NO_LINE, null);

    public enum Kind {
        PASS,
        CONFIRM_FAILURE,
        MISSING_EXCEPTION,
        UNEXPECTED_EXCEPTION,
        ALREADY_RAN
    }

    private final Kind kind;
    private final String reason;
    private final int line;
    private final String exceptionClass;

    private Outcome(Kind kind, String reason, int line, String exceptionClass) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.reason = reason;
        this.line = line;
        this.exceptionClass = exceptionClass;
        if (kind == Kind.PASS && reason != null) {
            throw new IllegalArgumentException("reason must be null for passing outcomes");
        }
        if (kind != Kind.PASS && (reason == null || reason.isEmpty())) {
            throw new IllegalArgumentException("reason is required for failed outcomes");
        }
    }

    public static Outcome pass() {
        return PASS;
    }

    public static Outcome confirmFailure(String reason, int line) {
        return new Outcome(Kind.CONFIRM_FAILURE, reason, line < 0 ? TestUnit.NO_LINE : line, null);
    }

    public static Outcome missingException(String reason) {
        return new Outcome(Kind.MISSING_EXCEPTION, reason, TestUnit.NO_LINE, null);
    }

    public static Outcome unexpectedException(Throwable thrown) {
        Objects.requireNonNull(thrown, "thrown");
        return new Outcome(Kind.UNEXPECTED_EXCEPTION, UNEXPECTED_REASON, TestUnit.NO_LINE, thrown.getClass().getName());
    }

    /**
     * A test whose verdict was recorded by an earlier run.
     */
    public static Outcome alreadyRan() {
        return new Outcome(Kind.ALREADY_RAN, ALREADY_RAN_REASON, TestUnit.NO_LINE, null);
    }

    /**
     * Runs {@code body} and converts whatever it throws into an outcome. Virtual machine
     * errors are rethrown.
     */
    public static Outcome capture(TestBody body) {
        Objects.requireNonNull(body, "body");
        try {
            body.run();
            return PASS;
        } catch (ConfirmException e) {
            return confirmFailure(e.reason(), e.line());
        } catch (MissingExpectedException e) {
            return missingException(e.reason());
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return unexpectedException(e);
        }
    }

    public Kind kind() {
        return kind;
    }

    public boolean passed() {
        return kind == Kind.PASS;
    }

    public Optional<String> reason() {
        return Optional.ofNullable(reason);
    }

    public int line() {
        return line;
    }

    /**
     * Class name of the unexpected throwable, for diagnostics only.
     */
    public Optional<String> exceptionClass() {
        return Optional.ofNullable(exceptionClass);
    }

    /**
     * Stores a failed outcome on the unit; passing outcomes leave it untouched.
     */
    void applyTo(TestUnit unit) {
        if (kind != Kind.PASS) {
            unit.setFailed(reason, line);
        }
    }
}
