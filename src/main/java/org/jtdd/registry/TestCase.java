package org.jtdd.registry;

import java.util.Objects;
import java.util.Optional;
import org.jtdd.confirm.MissingExpectedException;

/**
 * A registered test: a body plus its optional expected-failure reason and required
 * exception type.
 */
public final class TestCase extends TestUnit {
    private final TestBody body;
    private final String expectedFailureReason;
    private final Class<? extends Throwable> requiredException;
    private final String requiredExceptionName;
    private boolean executed;

    TestCase(
        String name,
        String suiteName,
        TestBody body,
        String expectedFailureReason,
        Class<? extends Throwable> requiredException,
        String requiredExceptionName
    ) {
        super(name, suiteName);
        this.body = Objects.requireNonNull(body, "body");
        this.expectedFailureReason = expectedFailureReason == null || expectedFailureReason.isEmpty()
            ? null
            : expectedFailureReason;
        this.requiredException = requiredException;
        if (requiredException != null) {
            this.requiredExceptionName = requiredExceptionName == null || requiredExceptionName.isBlank()
                ? requiredException.getSimpleName()
                : requiredExceptionName.trim();
        } else {
            this.requiredExceptionName = null;
        }
        this.executed = false;
    }

    public Optional<String> expectedFailureReason() {
        return Optional.ofNullable(expectedFailureReason);
    }

    public Optional<Class<? extends Throwable>> requiredException() {
        return Optional.ofNullable(requiredException);
    }

    /**
     * Name used when reporting a missing required exception.
     */
    public Optional<String> requiredExceptionName() {
        return Optional.ofNullable(requiredExceptionName);
    }

    public boolean executed() {
        return executed;
    }

    /**
     * Runs the body once. A throwable of the required type ends the body successfully;
     * finishing without one raises {@link MissingExpectedException}.
     *
     * @throws IllegalStateException if this test already ran
     */
    public void execute() throws Exception {
        if (executed) {
            throw new IllegalStateException("test '" + name() + "' already ran; register it again to rerun");
        }
        executed = true;
        if (requiredException == null) {
            body.run();
            return;
        }
        try {
            body.run();
        } catch (Throwable thrown) {
            if (requiredException.isInstance(thrown)) {
                if (thrown instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                return;
            }
            throw thrown;
        }
        throw new MissingExpectedException(requiredExceptionName);
    }
}
